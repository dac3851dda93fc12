package com.ebay.challenge.ratemeter.meter;

/**
 * No-op meter implementation.
 * Used when metrics collection is disabled. Never registers with an arbiter.
 */
public final class NoOpMeter implements Meter {

    public static final NoOpMeter INSTANCE = new NoOpMeter();

    private NoOpMeter() {
    }

    @Override
    public long count() {
        return 0;
    }

    @Override
    public void mark(long n) {
        // no-op
    }

    @Override
    public double rate1() {
        return 0.0;
    }

    @Override
    public double rate5() {
        return 0.0;
    }

    @Override
    public double rate15() {
        return 0.0;
    }

    @Override
    public double rateMean() {
        return 0.0;
    }

    @Override
    public MeterSnapshot snapshot() {
        return MeterSnapshot.EMPTY;
    }

    @Override
    public void stop() {
        // no-op
    }
}
