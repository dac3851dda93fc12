package com.ebay.challenge.ratemeter.registry;

import com.ebay.challenge.ratemeter.meter.Meter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Named meters, thread-safe.
 * <p>
 * Unregister a meter once it is of no use: this also stops it, which is what lets
 * the arbiter release it for garbage collection.
 */
@Slf4j
public class MeterRegistry {

    private final ConcurrentMap<String, Meter> meters = new ConcurrentHashMap<>();

    /**
     * Return the meter registered under {@code name}, creating and registering it if absent.
     * The factory runs at most once per absent name, even under concurrent calls.
     *
     * @param name    meter name
     * @param factory creates the meter when the name is free
     * @return the existing or newly registered meter
     */
    public Meter getOrRegister(String name, Supplier<? extends Meter> factory) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(factory, "factory");
        return meters.computeIfAbsent(name, k -> {
            log.debug("Creating meter {}", k);
            return factory.get();
        });
    }

    /**
     * Register {@code meter} under {@code name}.
     *
     * @throws DuplicateMeterException if the name is already taken
     */
    public void register(String name, Meter meter) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(meter, "meter");
        Meter existing = meters.putIfAbsent(name, meter);
        if (existing != null) {
            log.warn("Rejected duplicate registration of meter {}", name);
            throw new DuplicateMeterException(name);
        }
        log.debug("Registered meter {}", name);
    }

    /**
     * @return the meter registered under {@code name}, or null if none
     */
    public Meter get(String name) {
        return meters.get(name);
    }

    /**
     * Remove and stop the meter registered under {@code name}.
     *
     * @return true if a meter was removed
     */
    public boolean unregister(String name) {
        Meter removed = meters.remove(name);
        if (removed == null) {
            return false;
        }
        removed.stop();
        log.debug("Unregistered and stopped meter {}", name);
        return true;
    }

    public Map<String, Meter> getMeters() {
        return Collections.unmodifiableMap(meters);
    }

    public int size() {
        return meters.size();
    }
}
