package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of actions whose only arguments are in the path (finalize, execute, breaker, claim). */
public record SignedRequest(
    @JsonProperty("auth") SignedEnvelope auth
) {}
