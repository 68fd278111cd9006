package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
    @JsonProperty("code")     String code,
    @JsonProperty("category") String category,
    @JsonProperty("message")  String message
) {}
