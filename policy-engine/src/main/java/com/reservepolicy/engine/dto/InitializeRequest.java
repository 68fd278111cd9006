package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** The signer becomes the protocol authority. */
public record InitializeRequest(
    @JsonProperty("auth")                 SignedEnvelope auth,
    @JsonProperty("oracleAuthority")      String oracleAuthority,
    @JsonProperty("settlementAuthority")  String settlementAuthority,
    @JsonProperty("reserveVault")         String reserveVault,
    @JsonProperty("tokenMint")            String tokenMint,
    @JsonProperty("epochDurationSeconds") long epochDurationSeconds,
    @JsonProperty("mintBurnCapBps")       long mintBurnCapBps,
    @JsonProperty("stabilityFeeBps")      long stabilityFeeBps,
    @JsonProperty("vhrWarningBps")        long vhrWarningBps,
    @JsonProperty("vhrCriticalBps")       long vhrCriticalBps
) {}
