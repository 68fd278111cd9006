package com.reservepolicy.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One batch delivered by the oracle feed.
 *
 * <ul>
 *   <li>{@code indexValue}: liquidity/credit index, scaled by 1e6</li>
 *   <li>{@code avgYieldBps}: average yield in basis points</li>
 *   <li>{@code volatilityBps}: volatility in basis points</li>
 *   <li>{@code tvlUsd}: total value locked, USD scaled by 1e6</li>
 *   <li>{@code timestamp}: feed-reported unix seconds</li>
 *   <li>{@code slot}: feed-reported slot</li>
 * </ul>
 *
 * Not validated here; the oracle gate re-validates every field.
 */
public record OracleReading(
    @JsonProperty("indexValue")    long indexValue,
    @JsonProperty("avgYieldBps")   long avgYieldBps,
    @JsonProperty("volatilityBps") long volatilityBps,
    @JsonProperty("tvlUsd")        long tvlUsd,
    @JsonProperty("timestamp")     long timestamp,
    @JsonProperty("slot")          long slot
) {}
