package com.ebay.challenge.ratemeter.meter;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class EwmaTest {

    private static final Duration TICK = Duration.ofSeconds(5);

    @Test
    void testDecayCoefficients() {
        assertThat(Ewma.oneMinute(TICK).alpha()).isCloseTo(1 - Math.exp(-5.0 / 60), within(1e-12));
        assertThat(Ewma.fiveMinute(TICK).alpha()).isCloseTo(1 - Math.exp(-5.0 / 300), within(1e-12));
        assertThat(Ewma.fifteenMinute(TICK).alpha()).isCloseTo(1 - Math.exp(-5.0 / 900), within(1e-12));
    }

    /**
     * Update only accumulates, the rate moves on tick.
     */
    @Test
    void testUpdateDoesNotChangeRate() {
        Ewma ewma = Ewma.oneMinute(TICK);
        ewma.update(3);
        ewma.update(7);

        assertThat(ewma.rate()).isZero();
    }

    /**
     * First tick seeds the rate from the interval instead of blending with zero.
     */
    @Test
    void testFirstTickSeedsRate() {
        Ewma ewma = Ewma.fifteenMinute(TICK);
        ewma.update(3);
        ewma.tick();

        assertThat(ewma.rate()).isCloseTo(0.6, within(1e-12));
    }

    @Test
    void testSecondTickBlends() {
        Ewma ewma = Ewma.oneMinute(TICK);
        ewma.update(3);
        ewma.tick();
        ewma.tick();

        // 0.6 * exp(-5/60)
        assertThat(ewma.rate()).isCloseTo(0.5520266487775938, within(1e-9));
    }

    @Test
    void testPendingResetOnTick() {
        Ewma ewma = Ewma.oneMinute(TICK);
        ewma.update(5);
        ewma.tick();
        double seeded = ewma.rate();

        ewma.update(5);
        ewma.tick();

        // same events per interval keeps the rate steady
        assertThat(ewma.rate()).isCloseTo(seeded, within(1e-12));
    }

    @Test
    void testRateNormalizedToTickInterval() {
        Ewma ewma = Ewma.oneMinute(Duration.ofMillis(500));
        ewma.update(1);
        ewma.tick();

        assertThat(ewma.rate()).isCloseTo(2.0, within(1e-12));
    }

    /**
     * Longer windows forget more slowly.
     */
    @Test
    void testLongerWindowDecaysSlower() {
        Ewma m1 = Ewma.oneMinute(TICK);
        Ewma m15 = Ewma.fifteenMinute(TICK);
        m1.update(10);
        m15.update(10);
        m1.tick();
        m15.tick();

        for (int i = 0; i < 12; i++) {
            m1.tick();
            m15.tick();
        }

        assertThat(m15.rate()).isGreaterThan(m1.rate());
        assertThat(m1.rate()).isPositive();
    }

    @Test
    void testRejectsNonPositiveDurations() {
        assertThatThrownBy(() -> new Ewma(Duration.ZERO, TICK))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Ewma(Duration.ofMinutes(1), Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
