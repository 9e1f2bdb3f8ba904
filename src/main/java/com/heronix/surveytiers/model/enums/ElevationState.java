package com.heronix.surveytiers.model.enums;

import java.util.function.DoubleSupplier;

/**
 * Latent per-student condition that biases simulated item scores upward.
 *
 * Carried across waves to produce autocorrelated flare-ups:
 * - ELEVATED -> NORMAL with the recovery probability
 * - NORMAL -> ELEVATED with the relapse probability, only after a wave that
 *   was itself elevated
 */
public enum ElevationState {

    NORMAL,

    ELEVATED;

    public boolean isElevated() {
        return this == ELEVATED;
    }

    /**
     * Initial state for a new student. Consumes one draw.
     */
    public static ElevationState initial(DoubleSupplier random, double elevationRate) {
        return random.getAsDouble() < elevationRate ? ELEVATED : NORMAL;
    }

    /**
     * Whether a processed wave is elevated. Consumes one draw only in the
     * NORMAL state.
     */
    public boolean elevatesWave(DoubleSupplier random, double waveElevationRate) {
        return isElevated() || random.getAsDouble() < waveElevationRate;
    }

    /**
     * State after a processed wave. Consumes at most one draw, and none when
     * the state is NORMAL and the wave was not elevated.
     */
    public ElevationState next(boolean elevatedThisWave, DoubleSupplier random,
                               double recoveryRate, double relapseRate) {
        if (this == ELEVATED) {
            return random.getAsDouble() < recoveryRate ? NORMAL : ELEVATED;
        }
        if (elevatedThisWave && random.getAsDouble() < relapseRate) {
            return ELEVATED;
        }
        return NORMAL;
    }
}
