package com.reservepolicy.engine.governance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.common.model.SettlementOutcome;

/**
 * Read model handed to the external settlement service: the vote as recorded,
 * the outcome derived from the proposal status, and the settlement flag.
 */
public record VoteSettlement(
    @JsonProperty("proposalId")  long proposalId,
    @JsonProperty("agent")       String agent,
    @JsonProperty("stakeAmount") long stakeAmount,
    @JsonProperty("votingPower") long votingPower,
    @JsonProperty("prediction")  boolean prediction,
    @JsonProperty("timestamp")   long timestamp,
    @JsonProperty("outcome")     SettlementOutcome outcome,
    @JsonProperty("claimed")     boolean claimed
) {}
