package com.ebay.challenge.ratemeter.registry;

/**
 * Thrown when a meter is registered under a name that is already taken.
 */
public class DuplicateMeterException extends RuntimeException {

    private final String name;

    public DuplicateMeterException(String name) {
        super("Meter already registered: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
