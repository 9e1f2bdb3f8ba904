package com.heronix.surveytiers.random;

import lombok.Getter;

/**
 * Random state owned by a single dataset generation run.
 *
 * The primary stream drives population, cohort, credential base and response
 * draws in a fixed call order. The auxiliary stream covers credential
 * characters and demographic groups so that they never shift the primary
 * sequence.
 */
@Getter
public final class GenerationContext {

    /**
     * Mixed into the seed of the auxiliary stream.
     */
    static final long AUXILIARY_SALT = 0x5DEECE66DL;

    private final long seed;
    private final DeterministicRandomSource primary;
    private final DeterministicRandomSource auxiliary;

    private GenerationContext(long seed) {
        this.seed = seed;
        this.primary = new DeterministicRandomSource(seed);
        this.auxiliary = new DeterministicRandomSource(seed ^ AUXILIARY_SALT);
    }

    public static GenerationContext forSeed(long seed) {
        return new GenerationContext(seed);
    }
}
