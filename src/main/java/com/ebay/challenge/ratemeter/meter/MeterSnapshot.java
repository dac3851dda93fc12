package com.ebay.challenge.ratemeter.meter;

/**
 * Immutable copy of a meter's count and rates at one instant.
 *
 * This is a READ MODEL:
 * - values never change after capture
 * - not tracked by the arbiter
 * - marking it is a caller bug and fails fast
 */
public record MeterSnapshot(
        long count,
        double rate1,
        double rate5,
        double rate15,
        double rateMean
) implements Meter {

    public static final MeterSnapshot EMPTY = new MeterSnapshot(0, 0, 0, 0, 0);

    @Override
    public void mark(long n) {
        throw new UnsupportedOperationException("mark called on a MeterSnapshot");
    }

    @Override
    public MeterSnapshot snapshot() {
        return this;
    }

    @Override
    public void stop() {
        // no-op
    }
}
