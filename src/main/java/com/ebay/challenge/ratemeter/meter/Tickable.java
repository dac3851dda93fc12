package com.ebay.challenge.ratemeter.meter;

/**
 * The only capability the arbiter needs from a meter.
 */
interface Tickable {

    void tick();
}
