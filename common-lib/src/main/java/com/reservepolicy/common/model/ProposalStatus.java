package com.reservepolicy.common.model;

/**
 * Proposal lifecycle.
 *
 * <pre>
 *   ACTIVE ──finalize──▶ PASSED ──execute (after delay)──▶ EXECUTED
 *     │  └──finalize──▶ FAILED
 *     └──cancel (authority, before end)──▶ CANCELLED
 * </pre>
 */
public enum ProposalStatus {
    ACTIVE,
    PASSED,
    FAILED,
    EXECUTED,
    CANCELLED;

    public boolean canTransitionTo(ProposalStatus next) {
        return switch (this) {
            case ACTIVE -> next == PASSED || next == FAILED || next == CANCELLED;
            case PASSED -> next == EXECUTED;
            default     -> false;
        };
    }

    /** True once voting has been resolved one way or another. */
    public boolean isResolved() {
        return this != ACTIVE;
    }
}
