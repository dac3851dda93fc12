package com.ebay.challenge.ratemeter.meter;

import java.time.Duration;
import java.util.concurrent.atomic.LongAdder;

/**
 * Exponentially-weighted moving average of an event rate, advanced on a fixed tick.
 * <p>
 * {@link #update(long)} only accumulates. The rate changes on {@link #tick()}, where the
 * events seen during the last interval are folded in as
 * <pre>
 *   instant = pending / tickSeconds
 *   rate    = rate + alpha * (instant - rate),   alpha = 1 - exp(-tickSeconds / windowSeconds)
 * </pre>
 * The first tick seeds the rate with the instant rate.
 * <p>
 * Not safe for concurrent ticks: the owning meter serializes access.
 */
public class Ewma {

    private static final Duration ONE_MINUTE = Duration.ofMinutes(1);
    private static final Duration FIVE_MINUTES = Duration.ofMinutes(5);
    private static final Duration FIFTEEN_MINUTES = Duration.ofMinutes(15);

    private final LongAdder uncounted = new LongAdder();
    private final double tickSeconds;
    private final double alpha;

    private volatile double rate;
    private volatile boolean initialized;

    public Ewma(Duration window, Duration tickInterval) {
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tick interval must be positive: " + tickInterval);
        }
        this.tickSeconds = seconds(tickInterval);
        this.alpha = 1 - Math.exp(-tickSeconds / seconds(window));
    }

    public static Ewma oneMinute(Duration tickInterval) {
        return new Ewma(ONE_MINUTE, tickInterval);
    }

    public static Ewma fiveMinute(Duration tickInterval) {
        return new Ewma(FIVE_MINUTES, tickInterval);
    }

    public static Ewma fifteenMinute(Duration tickInterval) {
        return new Ewma(FIFTEEN_MINUTES, tickInterval);
    }

    public void update(long n) {
        uncounted.add(n);
    }

    public void tick() {
        double instantRate = uncounted.sumThenReset() / tickSeconds;
        if (initialized) {
            rate += alpha * (instantRate - rate);
        } else {
            rate = instantRate;
            initialized = true;
        }
    }

    /**
     * @return events per second as of the last tick
     */
    public double rate() {
        return rate;
    }

    double alpha() {
        return alpha;
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1e9;
    }
}
