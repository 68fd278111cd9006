package com.reservepolicy.engine.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.common.model.BreakerPhase;
import com.reservepolicy.common.model.HealthLevel;

/**
 * Circuit breaker state: {@code Idle | Requested(at) | Active(at)} plus the most
 * recent advisory signalled by the vault health monitor.
 *
 * <p>{@code since} is the request time for REQUESTED, the activation time for
 * ACTIVE and 0 for IDLE. The advisory never influences the phase.
 */
public record BreakerState(
    @JsonProperty("phase")      BreakerPhase phase,
    @JsonProperty("since")      long since,
    @JsonProperty("advisory")   HealthLevel advisory,
    @JsonProperty("advisoryAt") long advisoryAt
) {
    public static BreakerState idle() {
        return new BreakerState(BreakerPhase.IDLE, 0L, HealthLevel.HEALTHY, 0L);
    }

    public BreakerState requested(long at) {
        return new BreakerState(BreakerPhase.REQUESTED, at, advisory, advisoryAt);
    }

    public BreakerState activated(long at) {
        return new BreakerState(BreakerPhase.ACTIVE, at, advisory, advisoryAt);
    }

    public BreakerState reset() {
        return new BreakerState(BreakerPhase.IDLE, 0L, advisory, advisoryAt);
    }

    public BreakerState withAdvisory(HealthLevel level, long at) {
        return new BreakerState(phase, since, level, at);
    }

    public boolean isActive() {
        return phase == BreakerPhase.ACTIVE;
    }
}
