package com.heronix.surveytiers.random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;

class DeterministicRandomSourceTest {

    @Test
    void seedOneProducesReferenceFirstDraw() {
        DeterministicRandomSource random = new DeterministicRandomSource(1);

        double first = random.next();

        assertThat(random.state()).isEqualTo(1015568748L);
        assertThat(first).isCloseTo(0.2363, within(0.0001));
        assertThat(first).isEqualTo(1015568748L / 4294967296.0);
    }

    @Test
    void followsRecurrenceModulo2To32() {
        DeterministicRandomSource random = new DeterministicRandomSource(1);
        random.next();
        random.next();

        long expected = (1664525L * 1015568748L + 1013904223L) % 4294967296L;
        assertThat(random.state()).isEqualTo(expected);
    }

    @Test
    void sameSeedSameSequence() {
        DeterministicRandomSource a = new DeterministicRandomSource(42);
        DeterministicRandomSource b = new DeterministicRandomSource(42);

        for (int i = 0; i < 1000; i++) {
            assertThat(a.next()).isEqualTo(b.next());
        }
    }

    @Test
    void outputsStayInUnitInterval() {
        DeterministicRandomSource random = new DeterministicRandomSource(0xFFFFFFFFL);
        for (int i = 0; i < 10_000; i++) {
            assertThat(random.next()).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);
        }
    }

    @Test
    void usesLowThirtyTwoBitsOfSeed() {
        DeterministicRandomSource wide = new DeterministicRandomSource((7L << 32) | 5L);
        DeterministicRandomSource narrow = new DeterministicRandomSource(5L);

        assertThat(wide.next()).isEqualTo(narrow.next());
    }

    @Test
    void negativeSeedIsTreatedAsUnsigned() {
        DeterministicRandomSource negative = new DeterministicRandomSource(-1);
        DeterministicRandomSource unsigned = new DeterministicRandomSource(4294967295L);

        assertThat(negative.next()).isEqualTo(unsigned.next());
    }

    @Test
    void nextIntAndPickConsumeOneDrawEach() {
        DeterministicRandomSource random = new DeterministicRandomSource(9);
        DeterministicRandomSource reference = new DeterministicRandomSource(9);

        int value = random.nextInt(6);
        String picked = random.pick(List.of("a", "b", "c", "d"));

        assertThat(value).isEqualTo((int) Math.floor(reference.next() * 6));
        assertThat(picked).isEqualTo(List.of("a", "b", "c", "d").get((int) Math.floor(reference.next() * 4)));
        assertThat(random.state()).isEqualTo(reference.state());
    }

    @Test
    void rejectsNonPositiveBound() {
        DeterministicRandomSource random = new DeterministicRandomSource(1);

        assertThatThrownBy(() -> random.nextInt(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bound must be positive");
    }

    @Test
    void contextStreamsAreIndependentOfEachOther() {
        GenerationContext context = GenerationContext.forSeed(42);
        DeterministicRandomSource reference = new DeterministicRandomSource(42);

        context.getAuxiliary().next();
        context.getAuxiliary().next();

        assertThat(context.getPrimary().next()).isEqualTo(reference.next());
        assertThat(context.getSeed()).isEqualTo(42L);
    }
}
