package com.reservepolicy.engine.clock;

import java.time.Clock;

/**
 * Wall-clock backed {@link ChainClock}: slots advance every {@code slotMillis}
 * since {@code genesisMillis}.
 */
public class SystemChainClock implements ChainClock {

    private final Clock clock;
    private final long genesisMillis;
    private final long slotMillis;

    public SystemChainClock(Clock clock, long genesisMillis, long slotMillis) {
        if (slotMillis <= 0) {
            throw new IllegalArgumentException("slotMillis must be positive: " + slotMillis);
        }
        this.clock         = clock;
        this.genesisMillis = genesisMillis;
        this.slotMillis    = slotMillis;
    }

    @Override
    public long now() {
        return clock.instant().getEpochSecond();
    }

    @Override
    public long slot() {
        return Math.max(0L, (clock.millis() - genesisMillis) / slotMillis);
    }
}
