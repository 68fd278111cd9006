package com.reservepolicy.engine.state;

/**
 * A single agent's stake on one proposal.
 *
 * <p>{@code votingPower} is the amount actually credited to the proposal totals;
 * it equals {@code stakeAmount} under linear weighting. {@code claimed} is the
 * only mutable field and only flips from false to true.
 */
public class VoteRecord {

    private final long proposalId;
    private final String agent;
    private final long stakeAmount;
    private final long votingPower;
    private final boolean prediction;
    private final long timestamp;
    private boolean claimed;

    public VoteRecord(long proposalId, String agent, long stakeAmount, long votingPower,
                      boolean prediction, long timestamp) {
        this.proposalId  = proposalId;
        this.agent       = agent;
        this.stakeAmount = stakeAmount;
        this.votingPower = votingPower;
        this.prediction  = prediction;
        this.timestamp   = timestamp;
    }

    public VoteRecord copy() {
        VoteRecord c = new VoteRecord(proposalId, agent, stakeAmount, votingPower, prediction, timestamp);
        c.claimed = claimed;
        return c;
    }

    /** @return {@code true} if the flag changed, {@code false} if it was already set */
    public boolean markClaimed() {
        if (claimed) {
            return false;
        }
        claimed = true;
        return true;
    }

    public VoteKey key() {
        return new VoteKey(proposalId, agent);
    }

    public long getProposalId()   { return proposalId; }
    public String getAgent()      { return agent; }
    public long getStakeAmount()  { return stakeAmount; }
    public long getVotingPower()  { return votingPower; }
    public boolean isPrediction() { return prediction; }
    public long getTimestamp()    { return timestamp; }
    public boolean isClaimed()    { return claimed; }
}
