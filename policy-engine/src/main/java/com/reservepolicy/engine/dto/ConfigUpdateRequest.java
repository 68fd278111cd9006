package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConfigUpdateRequest(
    @JsonProperty("auth")                 SignedEnvelope auth,
    @JsonProperty("epochDurationSeconds") long epochDurationSeconds,
    @JsonProperty("mintBurnCapBps")       long mintBurnCapBps,
    @JsonProperty("stabilityFeeBps")      long stabilityFeeBps,
    @JsonProperty("vhrWarningBps")        long vhrWarningBps,
    @JsonProperty("vhrCriticalBps")       long vhrCriticalBps
) {}
