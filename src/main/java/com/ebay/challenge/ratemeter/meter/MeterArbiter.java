package com.ebay.challenge.ratemeter.meter;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ticks every registered meter from a single background thread.
 * <p>
 * The set of meters is a non-owning registration: a meter stays here until it is stopped.
 * The arbiter lock only guards membership and the started flag. A sweep copies the
 * membership and then ticks each meter under that meter's own lock, so one slow meter
 * never blocks registration and meters are not serialized behind a global lock.
 * <p>
 * The tick loop starts lazily with the first registration and runs for the life of the process.
 */
@Slf4j
public class MeterArbiter {

    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(5);

    private static final AtomicInteger THREAD_SEQUENCE = new AtomicInteger();

    private final Duration tickInterval;
    private final String threadName;

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private final Set<Tickable> meters = new HashSet<>();
    private boolean started;
    private ScheduledExecutorService executor;

    /**
     * Process-wide arbiter used by {@link MeterFactory} unless another one is supplied.
     */
    public static MeterArbiter getDefault() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Creates an arbiter with its own tick loop. Outside tests, use {@link #getDefault()}.
     *
     * @param tickInterval time between two sweeps, also the interval the averages are normalized to
     */
    public MeterArbiter(Duration tickInterval) {
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tick interval must be positive: " + tickInterval);
        }
        this.tickInterval = tickInterval;
        this.threadName = "meter-arbiter-" + THREAD_SEQUENCE.incrementAndGet();
    }

    void register(Tickable meter) {
        lock.lock();
        try {
            meters.add(meter);
            if (!started) {
                start();
            }
            log.debug("Registered meter on {} ({} live)", threadName, meters.size());
        } finally {
            lock.unlock();
        }
    }

    boolean unregister(Tickable meter) {
        lock.lock();
        try {
            boolean removed = meters.remove(meter);
            if (removed) {
                log.debug("Unregistered meter from {} ({} live)", threadName, meters.size());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Must run with the lock held.
     */
    private void start() {
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
        long periodNanos = tickInterval.toNanos();
        executor.scheduleAtFixedRate(this::tickMeters, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
        started = true;
        log.info("Started {} with tick interval {}", threadName, tickInterval);
    }

    /**
     * One sweep over the live meters. A failing meter is logged and skipped,
     * an escaping exception would cancel the schedule.
     */
    void tickMeters() {
        List<Tickable> live;
        lock.lock();
        try {
            live = new ArrayList<>(meters);
        } finally {
            lock.unlock();
        }

        for (Tickable meter : live) {
            try {
                meter.tick();
            } catch (RuntimeException e) {
                log.error("Failed to tick meter {}", meter, e);
            }
        }
        log.trace("Ticked {} meters on {}", live.size(), threadName);
    }

    /**
     * Stops the tick loop. Only meant for arbiters created in tests,
     * the default arbiter runs until the process exits.
     */
    public void shutdown() {
        if (this == DefaultHolder.INSTANCE) {
            log.warn("Ignoring shutdown of the default meter arbiter");
            return;
        }
        lock.lock();
        try {
            if (executor != null) {
                executor.shutdownNow();
                log.info("Stopped {} ({} meters still registered)", threadName, meters.size());
            }
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return meters.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isStarted() {
        lock.lock();
        try {
            return started;
        } finally {
            lock.unlock();
        }
    }

    boolean contains(Tickable meter) {
        lock.lock();
        try {
            return meters.contains(meter);
        } finally {
            lock.unlock();
        }
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    String getThreadName() {
        return threadName;
    }

    private static final class DefaultHolder {
        static final MeterArbiter INSTANCE = new MeterArbiter(DEFAULT_TICK_INTERVAL);
    }
}
