package com.reservepolicy.engine.clock;

/**
 * Time source of the execution substrate. Both readings are taken once per
 * submission, so every call in a submission observes the same instant.
 */
public interface ChainClock {

    /** Unix seconds. */
    long now();

    /** Monotonic slot (block) height. */
    long slot();
}
