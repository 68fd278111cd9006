package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record RebalanceRequest(
    @JsonProperty("auth")             SignedEnvelope auth,
    @JsonProperty("targetWeightsBps") Map<String, Integer> targetWeightsBps
) {}
