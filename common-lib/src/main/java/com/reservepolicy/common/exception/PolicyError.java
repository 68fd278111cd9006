package com.reservepolicy.common.exception;

/**
 * Closed set of rejection reasons raised by the policy engine.
 */
public enum PolicyError {

    // ── authentication ───────────────────────────────────────────────────────
    MISSING_SIGNATURE_VERIFICATION(ErrorCategory.AUTHENTICATION, "Missing signature verification step"),
    AGENT_MISMATCH(ErrorCategory.AUTHENTICATION, "Agent public key mismatch"),
    INVALID_NONCE(ErrorCategory.AUTHENTICATION, "Invalid nonce"),
    SIGNATURE_VERIFICATION_FAILED(ErrorCategory.AUTHENTICATION, "Signature verification failed"),
    SIGNATURE_EXPIRED(ErrorCategory.AUTHENTICATION, "Signature expired"),

    // ── authorization ────────────────────────────────────────────────────────
    UNAUTHORIZED(ErrorCategory.AUTHORIZATION, "Unauthorized"),

    // ── validation ───────────────────────────────────────────────────────────
    MALFORMED_PAYLOAD(ErrorCategory.VALIDATION, "Malformed policy payload"),
    INVALID_VOTING_PERIOD(ErrorCategory.VALIDATION, "Invalid voting period"),
    INVALID_STAKE_AMOUNT(ErrorCategory.VALIDATION, "Invalid stake amount"),
    DUPLICATE_VOTE(ErrorCategory.VALIDATION, "Agent already voted on this proposal"),
    COUNTER_OVERFLOW(ErrorCategory.VALIDATION, "Proposal counter overflow"),
    INVALID_INDEX_VALUE(ErrorCategory.VALIDATION, "Invalid index value"),
    INVALID_YIELD(ErrorCategory.VALIDATION, "Invalid yield value"),
    INVALID_VOLATILITY(ErrorCategory.VALIDATION, "Invalid volatility value"),
    INVALID_TVL(ErrorCategory.VALIDATION, "Invalid TVL value"),
    STALE_ORACLE_READING(ErrorCategory.VALIDATION, "Oracle reading timestamp or slot out of range"),
    INVALID_EPOCH_DURATION(ErrorCategory.VALIDATION, "Invalid epoch duration"),
    INVALID_MINT_BURN_CAP(ErrorCategory.VALIDATION, "Invalid mint/burn cap"),
    INVALID_STABILITY_FEE(ErrorCategory.VALIDATION, "Invalid stability fee"),
    INVALID_VHR_THRESHOLD(ErrorCategory.VALIDATION, "Invalid VHR threshold"),
    INVALID_RESERVE_VAULT(ErrorCategory.VALIDATION, "Invalid reserve vault or mint reference"),
    INVALID_AMOUNT(ErrorCategory.VALIDATION, "Invalid amount"),
    PROPOSAL_NOT_FOUND(ErrorCategory.VALIDATION, "Proposal not found"),
    VOTE_NOT_FOUND(ErrorCategory.VALIDATION, "Vote record not found"),

    // ── temporal ─────────────────────────────────────────────────────────────
    ORACLE_UPDATE_TOO_SOON(ErrorCategory.TEMPORAL, "Oracle update too soon"),
    SLOT_BUFFER_NOT_MET(ErrorCategory.TEMPORAL, "Slot buffer not met"),
    PROPOSAL_STILL_ACTIVE(ErrorCategory.TEMPORAL, "Voting window has not ended"),
    VOTING_CLOSED(ErrorCategory.TEMPORAL, "Voting window has ended"),
    EXECUTION_DELAY_NOT_MET(ErrorCategory.TEMPORAL, "Execution delay not met"),
    CIRCUIT_BREAKER_TIMELOCK_NOT_MET(ErrorCategory.TEMPORAL, "Circuit breaker timelock not met"),

    // ── arithmetic ───────────────────────────────────────────────────────────
    ARITHMETIC_OVERFLOW(ErrorCategory.ARITHMETIC, "Arithmetic overflow"),
    ARITHMETIC_UNDERFLOW(ErrorCategory.ARITHMETIC, "Arithmetic underflow"),

    // ── lifecycle state ──────────────────────────────────────────────────────
    NOT_INITIALIZED(ErrorCategory.STATE, "Protocol not initialized"),
    ALREADY_INITIALIZED(ErrorCategory.STATE, "Protocol already initialized"),
    PROPOSAL_NOT_ACTIVE(ErrorCategory.STATE, "Proposal not active"),
    PROPOSAL_NOT_PASSED(ErrorCategory.STATE, "Proposal not passed"),
    PROPOSAL_NOT_RESOLVED(ErrorCategory.STATE, "Proposal not resolved"),
    CIRCUIT_BREAKER_ACTIVE(ErrorCategory.STATE, "Circuit breaker is active"),
    INVALID_BREAKER_TRANSITION(ErrorCategory.STATE, "Invalid circuit breaker transition"),
    MINT_BURN_CAP_EXCEEDED(ErrorCategory.STATE, "Mint/burn cap exceeded"),
    INSUFFICIENT_VAULT_BALANCE(ErrorCategory.STATE, "Insufficient vault balance"),
    VHR_BELOW_THRESHOLD(ErrorCategory.STATE, "VHR below threshold");

    private final ErrorCategory category;
    private final String message;

    PolicyError(ErrorCategory category, String message) {
        this.category = category;
        this.message  = message;
    }

    public ErrorCategory category() {
        return category;
    }

    public String message() {
        return message;
    }
}
