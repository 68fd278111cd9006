package com.reservepolicy.common.model;

/**
 * Outcome of a single vote as seen by the external settlement service.
 * The engine only derives it; payout and slashing amounts are computed elsewhere.
 */
public enum SettlementOutcome {
    /** Proposal still open; nothing to settle. */
    PENDING,
    /** Prediction matched the resolved outcome. */
    WIN,
    /** Prediction did not match the resolved outcome. */
    LOSE,
    /** Proposal cancelled; stake is returned in full. */
    REFUND;

    public static SettlementOutcome of(ProposalStatus status, boolean prediction) {
        return switch (status) {
            case ACTIVE              -> PENDING;
            case CANCELLED           -> REFUND;
            case PASSED, EXECUTED    -> prediction ? WIN : LOSE;
            case FAILED              -> prediction ? LOSE : WIN;
        };
    }
}
