package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.engine.state.OracleState;

public record OracleView(
    @JsonProperty("indexValue")    long indexValue,
    @JsonProperty("avgYieldBps")   long avgYieldBps,
    @JsonProperty("volatilityBps") long volatilityBps,
    @JsonProperty("tvlUsd")        long tvlUsd,
    @JsonProperty("reportedAt")    long reportedAt,
    @JsonProperty("snapshotCount") int snapshotCount
) {
    public static OracleView from(OracleState o) {
        return new OracleView(o.getIndexValue(), o.getAvgYieldBps(), o.getVolatilityBps(), o.getTvlUsd(),
            o.getReportedAt(), o.getSnapshotCount());
    }
}
