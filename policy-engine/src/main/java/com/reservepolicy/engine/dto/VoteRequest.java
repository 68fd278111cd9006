package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VoteRequest(
    @JsonProperty("auth")        SignedEnvelope auth,
    @JsonProperty("prediction")  boolean prediction,
    @JsonProperty("stakeAmount") long stakeAmount
) {}
