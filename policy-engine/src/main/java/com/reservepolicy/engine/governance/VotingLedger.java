package com.reservepolicy.engine.governance;

import com.reservepolicy.common.event.GovernanceEventType;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.math.StakeMath;
import com.reservepolicy.common.model.ProposalStatus;
import com.reservepolicy.common.model.SettlementOutcome;
import com.reservepolicy.engine.auth.AgentAuthenticationGate;
import com.reservepolicy.engine.config.EngineParameters;
import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.state.PolicyProposal;
import com.reservepolicy.engine.state.VoteKey;
import com.reservepolicy.engine.state.VoteRecord;
import com.reservepolicy.engine.substrate.InvocationContext;
import com.reservepolicy.engine.substrate.LedgerTransaction;
import com.reservepolicy.engine.substrate.LedgerView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stake-weighted votes, one per (proposal, agent).
 *
 * <p>The vote slot is created before the totals are credited; a second vote by
 * the same agent fails on slot creation and the submission is discarded, so the
 * totals stay untouched.
 */
@Component
public class VotingLedger {

    private static final Logger log = LoggerFactory.getLogger(VotingLedger.class);

    private final AgentAuthenticationGate gate;
    private final EngineParameters parameters;

    public VotingLedger(AgentAuthenticationGate gate, EngineParameters parameters) {
        this.gate       = gate;
        this.parameters = parameters;
    }

    public VoteRecord vote(InvocationContext context, String agent, long proposalId,
                           boolean prediction, long stakeAmount) {
        gate.authenticate(context, agent);
        LedgerTransaction ledger = context.ledger();
        PolicyProposal proposal = ledger.proposal(proposalId);
        PolicyEngineException.require(proposal.getStatus() == ProposalStatus.ACTIVE,
            PolicyError.PROPOSAL_NOT_ACTIVE, "id=" + proposalId + " status=" + proposal.getStatus());
        PolicyEngineException.require(context.now() < proposal.getEndTime(),
            PolicyError.VOTING_CLOSED, "id=" + proposalId + " endTime=" + proposal.getEndTime());

        long power = StakeMath.votingPower(stakeAmount, parameters.stakeWeighting());
        VoteRecord vote = new VoteRecord(proposalId, agent, stakeAmount, power, prediction, context.now());
        ledger.insertVote(vote);
        proposal.credit(prediction, power);

        ledger.emit(GovernanceEventType.VOTE_RECORDED, agent, proposalId, Map.of(
            "prediction", prediction,
            "stakeAmount", stakeAmount,
            "votingPower", power));
        log.info("Vote recorded. proposal={} agent={} prediction={} stake={} power={}",
                 proposalId, agent, prediction, stakeAmount, power);
        return vote.copy();
    }

    /**
     * Flips the settlement flag of a vote on a resolved proposal. Restricted to the
     * settlement authority; repeating it is a no-op.
     */
    public VoteSettlement markClaimed(InvocationContext context, String agent, long proposalId, String voter) {
        LedgerTransaction ledger = context.ledger();
        GlobalState state = ledger.globalState();
        gate.authenticateRole(context, agent, state.getSettlementAuthority());

        PolicyProposal proposal = ledger.proposal(proposalId);
        PolicyEngineException.require(proposal.getStatus().isResolved(), PolicyError.PROPOSAL_NOT_RESOLVED,
            "id=" + proposalId);
        VoteRecord vote = ledger.vote(new VoteKey(proposalId, voter));
        SettlementOutcome outcome = SettlementOutcome.of(proposal.getStatus(), vote.isPrediction());

        if (vote.markClaimed()) {
            ledger.emit(GovernanceEventType.VOTE_CLAIMED, agent, proposalId, Map.of(
                "voter", voter,
                "outcome", outcome.name(),
                "stakeAmount", vote.getStakeAmount()));
            log.info("Vote claimed. proposal={} voter={} outcome={}", proposalId, voter, outcome);
        } else {
            log.debug("Vote already claimed. proposal={} voter={}", proposalId, voter);
        }
        return toSettlement(vote, proposal.getStatus());
    }

    public Optional<VoteSettlement> settlement(LedgerView view, long proposalId, String voter) {
        Optional<PolicyProposal> proposal = view.proposal(proposalId);
        if (proposal.isEmpty()) {
            return Optional.empty();
        }
        ProposalStatus status = proposal.get().getStatus();
        return view.vote(new VoteKey(proposalId, voter)).map(v -> toSettlement(v, status));
    }

    public List<VoteSettlement> settlements(LedgerView view, long proposalId) {
        PolicyProposal proposal = view.proposal(proposalId)
            .orElseThrow(() -> new PolicyEngineException(PolicyError.PROPOSAL_NOT_FOUND, "id=" + proposalId));
        return view.votes(proposalId).stream()
            .map(v -> toSettlement(v, proposal.getStatus()))
            .toList();
    }

    private static VoteSettlement toSettlement(VoteRecord vote, ProposalStatus status) {
        return new VoteSettlement(vote.getProposalId(), vote.getAgent(), vote.getStakeAmount(),
            vote.getVotingPower(), vote.isPrediction(), vote.getTimestamp(),
            SettlementOutcome.of(status, vote.isPrediction()), vote.isClaimed());
    }
}
