package com.reservepolicy.engine.state;

import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.model.ConfigParameter;

/**
 * Protocol singleton.
 *
 * <p>Identity references (authority, oracle authority, settlement authority,
 * reserve vault, token mint) are final: pinned at initialization and never
 * re-derived. Config fields change only through {@link #applyConfig} and
 * {@link #applyParameter}; the proposal counter only moves forward through
 * {@link #allocateProposalId()}.
 *
 * <p>Instances held by the committed ledger are never mutated; a transaction
 * works on a {@link #copy()}.
 */
public class GlobalState {

    private final String authority;
    private final String oracleAuthority;
    private final String settlementAuthority;
    private final String reserveVault;
    private final String tokenMint;
    private final long initializedAt;
    private final long initializedSlot;

    private long epochDurationSeconds;
    private long mintBurnCapBps;
    private long stabilityFeeBps;
    private long vhrWarningBps;
    private long vhrCriticalBps;

    private long proposalCounter;
    private BreakerState breaker;

    /** {@code null} until the first oracle update is admitted. */
    private Long lastOracleUpdateAt;
    /** Initialization slot until the first oracle update is admitted. */
    private long lastOracleSlot;

    public GlobalState(String authority, String oracleAuthority, String settlementAuthority,
                       String reserveVault, String tokenMint,
                       long epochDurationSeconds, long mintBurnCapBps, long stabilityFeeBps,
                       long vhrWarningBps, long vhrCriticalBps,
                       long initializedAt, long initializedSlot) {
        this(authority, oracleAuthority, settlementAuthority, reserveVault, tokenMint,
             initializedAt, initializedSlot, 0L);
        applyConfig(epochDurationSeconds, mintBurnCapBps, stabilityFeeBps, vhrWarningBps, vhrCriticalBps);
        this.breaker        = BreakerState.idle();
        this.lastOracleSlot = initializedSlot;
    }

    GlobalState(String authority, String oracleAuthority, String settlementAuthority,
                String reserveVault, String tokenMint, long initializedAt, long initializedSlot,
                long proposalCounter) {
        this.authority           = authority;
        this.oracleAuthority     = oracleAuthority;
        this.settlementAuthority = settlementAuthority;
        this.reserveVault        = reserveVault;
        this.tokenMint           = tokenMint;
        this.initializedAt       = initializedAt;
        this.initializedSlot     = initializedSlot;
        this.proposalCounter     = proposalCounter;
        this.breaker             = BreakerState.idle();
        this.lastOracleSlot      = initializedSlot;
    }

    public GlobalState copy() {
        GlobalState c = new GlobalState(authority, oracleAuthority, settlementAuthority,
            reserveVault, tokenMint, initializedAt, initializedSlot, proposalCounter);
        c.epochDurationSeconds = epochDurationSeconds;
        c.mintBurnCapBps       = mintBurnCapBps;
        c.stabilityFeeBps      = stabilityFeeBps;
        c.vhrWarningBps        = vhrWarningBps;
        c.vhrCriticalBps       = vhrCriticalBps;
        c.breaker              = breaker;
        c.lastOracleUpdateAt   = lastOracleUpdateAt;
        c.lastOracleSlot       = lastOracleSlot;
        return c;
    }

    /**
     * Returns the current counter value as the new proposal id and advances the
     * counter. The increment is checked before the id is handed out.
     */
    public long allocateProposalId() {
        long id = proposalCounter;
        try {
            proposalCounter = Math.addExact(id, 1L);
        } catch (ArithmeticException e) {
            throw new PolicyEngineException(PolicyError.COUNTER_OVERFLOW, "counter=" + id, e);
        }
        return id;
    }

    /** Validates and replaces every config field at once. */
    public void applyConfig(long epochDurationSeconds, long mintBurnCapBps, long stabilityFeeBps,
                            long vhrWarningBps, long vhrCriticalBps) {
        requireBounds(ConfigParameter.EPOCH_DURATION_SECONDS, epochDurationSeconds);
        requireBounds(ConfigParameter.MINT_BURN_CAP_BPS, mintBurnCapBps);
        requireBounds(ConfigParameter.STABILITY_FEE_BPS, stabilityFeeBps);
        requireBounds(ConfigParameter.VHR_WARNING_BPS, vhrWarningBps);
        requireBounds(ConfigParameter.VHR_CRITICAL_BPS, vhrCriticalBps);
        PolicyEngineException.require(vhrWarningBps > vhrCriticalBps, PolicyError.INVALID_VHR_THRESHOLD,
            "warning " + vhrWarningBps + " must exceed critical " + vhrCriticalBps);

        this.epochDurationSeconds = epochDurationSeconds;
        this.mintBurnCapBps       = mintBurnCapBps;
        this.stabilityFeeBps      = stabilityFeeBps;
        this.vhrWarningBps        = vhrWarningBps;
        this.vhrCriticalBps       = vhrCriticalBps;
    }

    /** Rewrites a single config field, keeping the cross-field threshold rule. */
    public void applyParameter(ConfigParameter parameter, long value) {
        switch (parameter) {
            case EPOCH_DURATION_SECONDS -> applyConfig(value, mintBurnCapBps, stabilityFeeBps, vhrWarningBps, vhrCriticalBps);
            case MINT_BURN_CAP_BPS      -> applyConfig(epochDurationSeconds, value, stabilityFeeBps, vhrWarningBps, vhrCriticalBps);
            case STABILITY_FEE_BPS      -> applyConfig(epochDurationSeconds, mintBurnCapBps, value, vhrWarningBps, vhrCriticalBps);
            case VHR_WARNING_BPS        -> applyConfig(epochDurationSeconds, mintBurnCapBps, stabilityFeeBps, value, vhrCriticalBps);
            case VHR_CRITICAL_BPS       -> applyConfig(epochDurationSeconds, mintBurnCapBps, stabilityFeeBps, vhrWarningBps, value);
        }
    }

    public long configValue(ConfigParameter parameter) {
        return switch (parameter) {
            case EPOCH_DURATION_SECONDS -> epochDurationSeconds;
            case MINT_BURN_CAP_BPS      -> mintBurnCapBps;
            case STABILITY_FEE_BPS      -> stabilityFeeBps;
            case VHR_WARNING_BPS        -> vhrWarningBps;
            case VHR_CRITICAL_BPS       -> vhrCriticalBps;
        };
    }

    public void recordOracleUpdate(long at, long slot) {
        this.lastOracleUpdateAt = at;
        this.lastOracleSlot     = slot;
    }

    public void setBreaker(BreakerState breaker) {
        this.breaker = breaker;
    }

    private static void requireBounds(ConfigParameter parameter, long value) {
        PolicyEngineException.require(parameter.accepts(value), parameter.violation(),
            parameter + "=" + value);
    }

    // ── accessors ────────────────────────────────────────────────────────────

    public String getAuthority()           { return authority; }
    public String getOracleAuthority()     { return oracleAuthority; }
    public String getSettlementAuthority() { return settlementAuthority; }
    public String getReserveVault()        { return reserveVault; }
    public String getTokenMint()           { return tokenMint; }
    public long getInitializedAt()         { return initializedAt; }
    public long getInitializedSlot()       { return initializedSlot; }
    public long getEpochDurationSeconds()  { return epochDurationSeconds; }
    public long getMintBurnCapBps()        { return mintBurnCapBps; }
    public long getStabilityFeeBps()       { return stabilityFeeBps; }
    public long getVhrWarningBps()         { return vhrWarningBps; }
    public long getVhrCriticalBps()        { return vhrCriticalBps; }
    public long getProposalCounter()       { return proposalCounter; }
    public BreakerState getBreaker()       { return breaker; }
    public Long getLastOracleUpdateAt()    { return lastOracleUpdateAt; }
    public long getLastOracleSlot()        { return lastOracleSlot; }
}
