package com.reservepolicy.common.model;

/**
 * Closed set of monetary policy actions an agent can propose.
 * Each type has exactly one payload variant in {@code com.reservepolicy.common.policy}.
 */
public enum PolicyType {
    MINT_SUPPLY,
    BURN_SUPPLY,
    REBALANCE,
    PARAMETER_UPDATE;

    /** Whether executing a policy of this type changes reserve value or liabilities. */
    public boolean affectsReserve() {
        return this != PARAMETER_UPDATE;
    }
}
