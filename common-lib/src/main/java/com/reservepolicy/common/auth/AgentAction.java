package com.reservepolicy.common.auth;

/**
 * Every mutating engine entry point. The name is the domain separator in the
 * signed message, so a signature for one action can never authorize another.
 */
public enum AgentAction {
    INITIALIZE,
    UPDATE_CONFIG,
    CREATE_PROPOSAL,
    VOTE,
    FINALIZE_PROPOSAL,
    EXECUTE_PROPOSAL,
    CANCEL_PROPOSAL,
    MARK_CLAIMED,
    UPDATE_ORACLE,
    REQUEST_CIRCUIT_BREAKER,
    ACTIVATE_CIRCUIT_BREAKER,
    DEACTIVATE_CIRCUIT_BREAKER,
    DEPOSIT,
    WITHDRAW,
    REBALANCE_VAULT
}
