package com.ebay.challenge.ratemeter.meter;

/**
 * Counts events and exposes exponentially-weighted moving average rates
 * at one, five and fifteen minutes, plus a lifetime mean rate.
 *
 * Windowed rates are only as fresh as the last arbiter tick.
 * All rates are in events per second.
 */
public interface Meter {

    long count();

    /**
     * Record the occurrence of {@code n} events.
     */
    void mark(long n);

    default void mark() {
        mark(1);
    }

    double rate1();

    double rate5();

    double rate15();

    double rateMean();

    /**
     * Read-only copy of the current count and rates.
     */
    MeterSnapshot snapshot();

    /**
     * Stop the meter. Further marks are ignored and the meter is released
     * by the arbiter. Safe to call more than once.
     */
    void stop();
}
