package com.reservepolicy.engine.support;

import com.reservepolicy.engine.clock.ChainClock;

/** Test clock moved explicitly by the test. */
public class ManualChainClock implements ChainClock {

    private volatile long now;
    private volatile long slot;

    public ManualChainClock(long now, long slot) {
        this.now  = now;
        this.slot = slot;
    }

    @Override
    public long now() {
        return now;
    }

    @Override
    public long slot() {
        return slot;
    }

    public void advance(long seconds, long slots) {
        this.now  += seconds;
        this.slot += slots;
    }

    public void advanceSeconds(long seconds) {
        advance(seconds, 0);
    }
}
