package com.ebay.challenge.ratemeter.meter;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;

/**
 * Standard meter backed by three {@link Ewma}s and ticked by a {@link MeterArbiter}.
 * <p>
 * All mutable state is guarded by one read/write lock, so count and rates are always
 * read from the same instant. Marks are taken on caller threads, ticks on the arbiter thread.
 * <p>
 * Create through {@link MeterFactory}, which registers the meter with its arbiter.
 * Call {@link #stop()} once the meter is of no use, otherwise the arbiter keeps it forever.
 */
public class StandardMeter implements Meter, Tickable {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final MeterArbiter arbiter;
    private final LongSupplier nanoClock;
    private final long startNanos;

    private final Ewma a1;
    private final Ewma a5;
    private final Ewma a15;

    // guarded by lock
    private long count;
    private double rate1;
    private double rate5;
    private double rate15;
    private double rateMean;
    private boolean stopped;

    StandardMeter(MeterArbiter arbiter) {
        this(arbiter, System::nanoTime);
    }

    StandardMeter(MeterArbiter arbiter, LongSupplier nanoClock) {
        this.arbiter = arbiter;
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
        this.a1 = Ewma.oneMinute(arbiter.getTickInterval());
        this.a5 = Ewma.fiveMinute(arbiter.getTickInterval());
        this.a15 = Ewma.fifteenMinute(arbiter.getTickInterval());
    }

    @Override
    public void mark(long n) {
        lock.writeLock().lock();
        try {
            if (stopped) {
                return;
            }
            count += n;
            a1.update(n);
            a5.update(n);
            a15.update(n);
            rateMean = computeMeanRate();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Fold pending events into the averages and refresh the cached rates.
     * Called by the arbiter thread only. A stopped meter is left untouched.
     */
    @Override
    public void tick() {
        lock.writeLock().lock();
        try {
            if (stopped) {
                return;
            }
            a1.tick();
            a5.tick();
            a15.tick();
            rate1 = a1.rate();
            rate5 = a5.rate();
            rate15 = a15.rate();
            rateMean = computeMeanRate();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void stop() {
        boolean wasStopped;
        lock.writeLock().lock();
        try {
            wasStopped = stopped;
            stopped = true;
        } finally {
            lock.writeLock().unlock();
        }
        // arbiter lock is never taken while holding the meter lock
        if (!wasStopped) {
            arbiter.unregister(this);
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public double rate1() {
        lock.readLock().lock();
        try {
            return rate1;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public double rate5() {
        lock.readLock().lock();
        try {
            return rate5;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public double rate15() {
        lock.readLock().lock();
        try {
            return rate15;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public double rateMean() {
        lock.readLock().lock();
        try {
            return rateMean;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public MeterSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new MeterSnapshot(count, rate1, rate5, rate15, rateMean);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isStopped() {
        lock.readLock().lock();
        try {
            return stopped;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Must run with the write lock held.
     */
    private double computeMeanRate() {
        double elapsedSeconds = (nanoClock.getAsLong() - startNanos) / 1e9;
        if (elapsedSeconds <= 0) {
            return 0;
        }
        return count / elapsedSeconds;
    }

    @Override
    public String toString() {
        MeterSnapshot s = snapshot();
        return String.format("StandardMeter[count=%d, m1=%.3f, m5=%.3f, m15=%.3f, mean=%.3f]",
                s.count(), s.rate1(), s.rate5(), s.rate15(), s.rateMean());
    }
}
