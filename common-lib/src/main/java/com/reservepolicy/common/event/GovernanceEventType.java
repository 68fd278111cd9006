package com.reservepolicy.common.event;

public enum GovernanceEventType {
    PROTOCOL_INITIALIZED,
    CONFIG_UPDATED,
    PROPOSAL_CREATED,
    VOTE_RECORDED,
    PROPOSAL_PASSED,
    PROPOSAL_FAILED,
    PROPOSAL_EXECUTED,
    PROPOSAL_CANCELLED,
    VOTE_CLAIMED,
    ORACLE_UPDATED,
    BREAKER_REQUESTED,
    BREAKER_ACTIVATED,
    BREAKER_DEACTIVATED,
    HEALTH_SIGNAL,
    RESERVE_DEPOSIT,
    RESERVE_WITHDRAWAL,
    RESERVE_REBALANCED
}
