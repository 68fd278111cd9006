package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.engine.state.VoteRecord;

public record VoteView(
    @JsonProperty("proposalId")  long proposalId,
    @JsonProperty("agent")       String agent,
    @JsonProperty("stakeAmount") long stakeAmount,
    @JsonProperty("votingPower") long votingPower,
    @JsonProperty("prediction")  boolean prediction,
    @JsonProperty("timestamp")   long timestamp
) {
    public static VoteView from(VoteRecord v) {
        return new VoteView(v.getProposalId(), v.getAgent(), v.getStakeAmount(), v.getVotingPower(),
            v.isPrediction(), v.getTimestamp());
    }
}
