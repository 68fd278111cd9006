package com.reservepolicy.engine.config;

import com.reservepolicy.common.model.StakeWeighting;

/**
 * Engine-wide timing windows and oracle bounds. Immutable; bound once from
 * {@code policy.*} properties in {@link PolicyEngineConfig}.
 *
 * <p>All durations are seconds; slot counts are raw slots.
 */
public record EngineParameters(
    long executionDelaySeconds,
    long circuitBreakerDelaySeconds,
    long minOracleIntervalSeconds,
    long minSlotBuffer,
    long maxOracleStalenessSeconds,
    long minVotingPeriodSeconds,
    long maxVotingPeriodSeconds,
    long maxIndexValue,
    long maxYieldBps,
    long maxVolatilityBps,
    long maxTvlUsd,
    StakeWeighting stakeWeighting
) {
    public static final long DEFAULT_EXECUTION_DELAY       = 48 * 3600L;
    public static final long DEFAULT_CIRCUIT_BREAKER_DELAY = 24 * 3600L;
    public static final long DEFAULT_ORACLE_INTERVAL       = 300L;
    public static final long DEFAULT_SLOT_BUFFER           = 100L;
    public static final long DEFAULT_ORACLE_STALENESS      = 900L;
    public static final long DEFAULT_MIN_VOTING_PERIOD     = 3600L;
    public static final long DEFAULT_MAX_VOTING_PERIOD     = 7 * 24 * 3600L;
    public static final long DEFAULT_MAX_INDEX_VALUE       = 1_000_000_000_000L;
    public static final long DEFAULT_MAX_YIELD_BPS         = 10_000L;
    public static final long DEFAULT_MAX_VOLATILITY_BPS    = 10_000L;
    public static final long DEFAULT_MAX_TVL_USD           = 1_000_000_000_000_000_000L;

    public static EngineParameters defaults() {
        return new EngineParameters(
            DEFAULT_EXECUTION_DELAY,
            DEFAULT_CIRCUIT_BREAKER_DELAY,
            DEFAULT_ORACLE_INTERVAL,
            DEFAULT_SLOT_BUFFER,
            DEFAULT_ORACLE_STALENESS,
            DEFAULT_MIN_VOTING_PERIOD,
            DEFAULT_MAX_VOTING_PERIOD,
            DEFAULT_MAX_INDEX_VALUE,
            DEFAULT_MAX_YIELD_BPS,
            DEFAULT_MAX_VOLATILITY_BPS,
            DEFAULT_MAX_TVL_USD,
            StakeWeighting.LINEAR);
    }

    public EngineParameters withStakeWeighting(StakeWeighting weighting) {
        return new EngineParameters(executionDelaySeconds, circuitBreakerDelaySeconds,
            minOracleIntervalSeconds, minSlotBuffer, maxOracleStalenessSeconds,
            minVotingPeriodSeconds, maxVotingPeriodSeconds, maxIndexValue, maxYieldBps,
            maxVolatilityBps, maxTvlUsd, weighting);
    }
}
