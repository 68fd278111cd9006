package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReserveAmountRequest(
    @JsonProperty("auth")  SignedEnvelope auth,
    @JsonProperty("units") long units
) {}
