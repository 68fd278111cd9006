package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.common.model.PolicyType;
import com.reservepolicy.common.model.ProposalStatus;
import com.reservepolicy.common.policy.PolicyParams;
import com.reservepolicy.engine.state.PolicyProposal;

public record ProposalView(
    @JsonProperty("id")            long id,
    @JsonProperty("proposer")      String proposer,
    @JsonProperty("policyType")    PolicyType policyType,
    @JsonProperty("params")        PolicyParams params,
    @JsonProperty("startTime")     long startTime,
    @JsonProperty("endTime")       long endTime,
    @JsonProperty("yesStake")      long yesStake,
    @JsonProperty("noStake")       long noStake,
    @JsonProperty("status")        ProposalStatus status,
    @JsonProperty("passedAt")      Long passedAt,
    @JsonProperty("finalRatioBps") Long finalRatioBps,
    @JsonProperty("executedAt")    Long executedAt,
    @JsonProperty("cancelledAt")   Long cancelledAt
) {
    public static ProposalView from(PolicyProposal p) {
        return new ProposalView(p.getId(), p.getProposer(), p.getPolicyType(), p.getParams(),
            p.getStartTime(), p.getEndTime(), p.getYesStake(), p.getNoStake(), p.getStatus(),
            p.getPassedAt(), p.getFinalRatioBps(), p.getExecutedAt(), p.getCancelledAt());
    }
}
