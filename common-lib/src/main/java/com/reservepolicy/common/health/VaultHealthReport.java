package com.reservepolicy.common.health;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.common.model.HealthLevel;

/**
 * Result of one VHR recomputation.
 *
 * <ul>
 *   <li>{@code reserveValue}: reserve units priced at the current index, USD scaled by 1e6</li>
 *   <li>{@code liabilities}: outstanding token supply, USD scaled by 1e6</li>
 *   <li>{@code vhrBps}: reserve value / liabilities in bps;
 *       {@link VaultHealthCalculator#UNBOUNDED_VHR} when there are no liabilities</li>
 *   <li>{@code oracleStale}: no accepted oracle update within the staleness window</li>
 * </ul>
 */
public record VaultHealthReport(
    @JsonProperty("reserveValue") long reserveValue,
    @JsonProperty("liabilities")  long liabilities,
    @JsonProperty("vhrBps")       long vhrBps,
    @JsonProperty("level")        HealthLevel level,
    @JsonProperty("oracleStale")  boolean oracleStale,
    @JsonProperty("computedAt")   long computedAt
) {}
