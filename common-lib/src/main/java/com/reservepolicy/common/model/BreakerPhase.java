package com.reservepolicy.common.model;

/**
 * Circuit breaker phases. {@code IDLE → REQUESTED → ACTIVE} is slow (timelocked);
 * {@code ACTIVE → IDLE} is immediate.
 */
public enum BreakerPhase {
    IDLE,
    REQUESTED,
    ACTIVE
}
