package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.engine.state.BreakerState;
import com.reservepolicy.engine.state.GlobalState;

public record ProtocolView(
    @JsonProperty("authority")            String authority,
    @JsonProperty("oracleAuthority")      String oracleAuthority,
    @JsonProperty("settlementAuthority")  String settlementAuthority,
    @JsonProperty("reserveVault")         String reserveVault,
    @JsonProperty("tokenMint")            String tokenMint,
    @JsonProperty("epochDurationSeconds") long epochDurationSeconds,
    @JsonProperty("mintBurnCapBps")       long mintBurnCapBps,
    @JsonProperty("stabilityFeeBps")      long stabilityFeeBps,
    @JsonProperty("vhrWarningBps")        long vhrWarningBps,
    @JsonProperty("vhrCriticalBps")       long vhrCriticalBps,
    @JsonProperty("proposalCounter")      long proposalCounter,
    @JsonProperty("breaker")              BreakerState breaker,
    @JsonProperty("lastOracleUpdateAt")   Long lastOracleUpdateAt,
    @JsonProperty("lastOracleSlot")       long lastOracleSlot,
    @JsonProperty("initializedAt")        long initializedAt
) {
    public static ProtocolView from(GlobalState s) {
        return new ProtocolView(s.getAuthority(), s.getOracleAuthority(), s.getSettlementAuthority(),
            s.getReserveVault(), s.getTokenMint(), s.getEpochDurationSeconds(), s.getMintBurnCapBps(),
            s.getStabilityFeeBps(), s.getVhrWarningBps(), s.getVhrCriticalBps(), s.getProposalCounter(),
            s.getBreaker(), s.getLastOracleUpdateAt(), s.getLastOracleSlot(), s.getInitializedAt());
    }
}
