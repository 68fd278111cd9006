package com.reservepolicy.engine.state;

import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.math.StakeMath;
import com.reservepolicy.common.model.PolicyType;
import com.reservepolicy.common.model.ProposalStatus;
import com.reservepolicy.common.policy.PolicyParams;

/**
 * A policy proposal and its stake totals.
 *
 * <p>Status changes go through {@link #moveTo}, which only allows the edges of
 * {@link ProposalStatus#canTransitionTo}. {@code passedAt} is written once, on PASSED.
 */
public class PolicyProposal {

    private final long id;
    private final String proposer;
    private final PolicyParams params;
    private final long startTime;
    private final long endTime;

    private long yesStake;
    private long noStake;
    private ProposalStatus status;
    private Long passedAt;
    private Long finalRatioBps;
    private Long executedAt;
    private Long cancelledAt;

    public PolicyProposal(long id, String proposer, PolicyParams params, long startTime, long endTime) {
        this.id        = id;
        this.proposer  = proposer;
        this.params    = params;
        this.startTime = startTime;
        this.endTime   = endTime;
        this.status    = ProposalStatus.ACTIVE;
    }

    public PolicyProposal copy() {
        PolicyProposal c = new PolicyProposal(id, proposer, params, startTime, endTime);
        c.yesStake      = yesStake;
        c.noStake       = noStake;
        c.status        = status;
        c.passedAt      = passedAt;
        c.finalRatioBps = finalRatioBps;
        c.executedAt    = executedAt;
        c.cancelledAt   = cancelledAt;
        return c;
    }

    /** Adds {@code amount} to the yes or no total; overflow is reported, never wrapped. */
    public void credit(boolean prediction, long amount) {
        if (prediction) {
            yesStake = StakeMath.checkedAdd(yesStake, amount);
        } else {
            noStake = StakeMath.checkedAdd(noStake, amount);
        }
    }

    public void markPassed(long now, long ratioBps) {
        moveTo(ProposalStatus.PASSED);
        this.passedAt      = now;
        this.finalRatioBps = ratioBps;
    }

    public void markFailed(long ratioBps) {
        moveTo(ProposalStatus.FAILED);
        this.finalRatioBps = ratioBps;
    }

    public void markExecuted(long now) {
        moveTo(ProposalStatus.EXECUTED);
        this.executedAt = now;
    }

    public void markCancelled(long now) {
        moveTo(ProposalStatus.CANCELLED);
        this.cancelledAt = now;
    }

    private void moveTo(ProposalStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new PolicyEngineException(PolicyError.PROPOSAL_NOT_ACTIVE,
                "proposal " + id + " cannot move " + status + " -> " + next);
        }
        this.status = next;
    }

    public PolicyType getPolicyType()  { return params.policyType(); }
    public long getId()                { return id; }
    public String getProposer()        { return proposer; }
    public PolicyParams getParams()    { return params; }
    public long getStartTime()         { return startTime; }
    public long getEndTime()           { return endTime; }
    public long getYesStake()          { return yesStake; }
    public long getNoStake()           { return noStake; }
    public ProposalStatus getStatus()  { return status; }
    public Long getPassedAt()          { return passedAt; }
    public Long getFinalRatioBps()     { return finalRatioBps; }
    public Long getExecutedAt()        { return executedAt; }
    public Long getCancelledAt()       { return cancelledAt; }
}
