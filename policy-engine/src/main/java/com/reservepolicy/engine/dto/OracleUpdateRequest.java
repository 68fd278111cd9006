package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.common.model.OracleReading;

public record OracleUpdateRequest(
    @JsonProperty("auth")    SignedEnvelope auth,
    @JsonProperty("reading") OracleReading reading
) {}
