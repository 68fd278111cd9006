package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.common.policy.PolicyParams;

public record CreateProposalRequest(
    @JsonProperty("auth")                SignedEnvelope auth,
    @JsonProperty("params")              PolicyParams params,
    @JsonProperty("votingPeriodSeconds") long votingPeriodSeconds
) {}
