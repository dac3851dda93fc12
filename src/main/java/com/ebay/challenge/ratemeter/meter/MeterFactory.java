package com.ebay.challenge.ratemeter.meter;

import com.ebay.challenge.ratemeter.registry.DuplicateMeterException;
import com.ebay.challenge.ratemeter.registry.MeterRegistry;
import lombok.Getter;

import java.util.Objects;

/**
 * Creates meters for one configuration.
 * <p>
 * Whether meters are live or no-op is decided when the factory is built and never changes,
 * so every meter from one factory behaves the same way.
 */
@Getter
public class MeterFactory {

    private final boolean disabled;
    private final MeterArbiter arbiter;

    /**
     * Live meters ticked by the default arbiter.
     */
    public MeterFactory() {
        this(false, MeterArbiter.getDefault());
    }

    public MeterFactory(boolean disabled, MeterArbiter arbiter) {
        this.disabled = disabled;
        this.arbiter = Objects.requireNonNull(arbiter, "arbiter");
    }

    /**
     * New meter registered with the arbiter, or {@link NoOpMeter} when disabled.
     * Call {@link Meter#stop()} once the meter is of no use.
     */
    public Meter newMeter() {
        if (disabled) {
            return NoOpMeter.INSTANCE;
        }
        StandardMeter meter = new StandardMeter(arbiter);
        arbiter.register(meter);
        return meter;
    }

    /**
     * New meter, registered in {@code registry} under {@code name}.
     *
     * @throws DuplicateMeterException if the name is taken; the new meter is stopped first
     */
    public Meter newRegisteredMeter(String name, MeterRegistry registry) {
        Meter meter = newMeter();
        try {
            registry.register(name, meter);
        } catch (DuplicateMeterException e) {
            meter.stop();
            throw e;
        }
        return meter;
    }

    /**
     * Existing meter named {@code name} in {@code registry}, or a new registered one.
     */
    public Meter getOrRegisterMeter(String name, MeterRegistry registry) {
        return registry.getOrRegister(name, this::newMeter);
    }
}
