package com.reservepolicy.engine.governance;

import com.reservepolicy.common.event.GovernanceEventType;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.math.StakeMath;
import com.reservepolicy.common.model.ProposalStatus;
import com.reservepolicy.common.policy.PolicyParams;
import com.reservepolicy.engine.auth.AgentAuthenticationGate;
import com.reservepolicy.engine.breaker.CircuitBreakerController;
import com.reservepolicy.engine.config.EngineParameters;
import com.reservepolicy.engine.health.VaultHealthMonitor;
import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.state.PolicyProposal;
import com.reservepolicy.engine.substrate.InvocationContext;
import com.reservepolicy.engine.substrate.LedgerTransaction;
import com.reservepolicy.engine.substrate.LedgerView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Proposal lifecycle: create, finalize, execute, cancel.
 *
 * <p>Ids come from the global counter inside the serialized submission, so two
 * proposals created in the same block still receive consecutive ids. Execution
 * is held back by the execution delay measured from {@code passedAt}, and by an
 * ACTIVE circuit breaker.
 */
@Component
public class ProposalRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProposalRegistry.class);

    private final AgentAuthenticationGate gate;
    private final CircuitBreakerController breaker;
    private final VaultHealthMonitor healthMonitor;
    private final PolicyExecutor executor;
    private final EngineParameters parameters;

    public ProposalRegistry(AgentAuthenticationGate gate,
                            CircuitBreakerController breaker,
                            VaultHealthMonitor healthMonitor,
                            PolicyExecutor executor,
                            EngineParameters parameters) {
        this.gate          = gate;
        this.breaker       = breaker;
        this.healthMonitor = healthMonitor;
        this.executor      = executor;
        this.parameters    = parameters;
    }

    public PolicyProposal create(InvocationContext context, String proposer, PolicyParams params,
                                 long votingPeriodSeconds) {
        gate.authenticate(context, proposer);
        LedgerTransaction ledger = context.ledger();
        GlobalState state = ledger.globalState();
        breaker.requireNotHalted(state);

        PolicyEngineException.require(params != null, PolicyError.MALFORMED_PAYLOAD, "policy payload is required");
        params.validate();
        PolicyEngineException.require(
            votingPeriodSeconds >= parameters.minVotingPeriodSeconds()
                && votingPeriodSeconds <= parameters.maxVotingPeriodSeconds(),
            PolicyError.INVALID_VOTING_PERIOD,
            "period=" + votingPeriodSeconds + "s allowed=[" + parameters.minVotingPeriodSeconds()
                + ", " + parameters.maxVotingPeriodSeconds() + "]");

        long endTime = StakeMath.checkedAdd(context.now(), votingPeriodSeconds);
        long id = state.allocateProposalId();
        PolicyProposal proposal = new PolicyProposal(id, proposer, params, context.now(), endTime);
        ledger.insertProposal(proposal);

        ledger.emit(GovernanceEventType.PROPOSAL_CREATED, proposer, id, Map.of(
            "policyType", params.policyType().name(),
            "startTime", context.now(),
            "endTime", endTime));
        log.info("Proposal created. id={} type={} proposer={} endTime={}",
                 id, params.policyType(), proposer, endTime);
        return proposal.copy();
    }

    /** Resolves voting once the window has ended. Any authenticated agent may call it. */
    public PolicyProposal finalizeProposal(InvocationContext context, String agent, long proposalId) {
        gate.authenticate(context, agent);
        LedgerTransaction ledger = context.ledger();
        PolicyProposal proposal = ledger.proposal(proposalId);
        PolicyEngineException.require(proposal.getStatus() == ProposalStatus.ACTIVE,
            PolicyError.PROPOSAL_NOT_ACTIVE, "id=" + proposalId + " status=" + proposal.getStatus());
        PolicyEngineException.require(context.now() >= proposal.getEndTime(),
            PolicyError.PROPOSAL_STILL_ACTIVE, "id=" + proposalId + " endTime=" + proposal.getEndTime());

        long ratio = StakeMath.yesRatioBps(proposal.getYesStake(), proposal.getNoStake());
        boolean passed = StakeMath.passes(ratio);
        if (passed) {
            proposal.markPassed(context.now(), ratio);
        } else {
            proposal.markFailed(ratio);
        }

        ledger.emit(passed ? GovernanceEventType.PROPOSAL_PASSED : GovernanceEventType.PROPOSAL_FAILED,
            agent, proposalId, Map.of(
                "yesStake", proposal.getYesStake(),
                "noStake", proposal.getNoStake(),
                "ratioBps", ratio));
        log.info("Proposal finalized. id={} status={} ratioBps={} yes={} no={}",
                 proposalId, proposal.getStatus(), ratio, proposal.getYesStake(), proposal.getNoStake());
        return proposal.copy();
    }

    public PolicyProposal execute(InvocationContext context, String agent, long proposalId) {
        LedgerTransaction ledger = context.ledger();
        GlobalState state = ledger.globalState();
        gate.authenticateRole(context, agent, state.getAuthority());

        PolicyProposal proposal = ledger.proposal(proposalId);
        PolicyEngineException.require(proposal.getStatus() == ProposalStatus.PASSED,
            PolicyError.PROPOSAL_NOT_PASSED, "id=" + proposalId + " status=" + proposal.getStatus());
        long sincePassed = context.now() - proposal.getPassedAt();
        PolicyEngineException.require(sincePassed >= parameters.executionDelaySeconds(),
            PolicyError.EXECUTION_DELAY_NOT_MET,
            "id=" + proposalId + " elapsed=" + sincePassed + "s required=" + parameters.executionDelaySeconds() + "s");
        breaker.requireNotHalted(state);

        Map<String, Object> effect = new HashMap<>(executor.apply(context, state, proposal.getParams()));
        proposal.markExecuted(context.now());
        effect.put("policyType", proposal.getPolicyType().name());

        ledger.emit(GovernanceEventType.PROPOSAL_EXECUTED, agent, proposalId, effect);
        log.info("Proposal executed. id={} type={} passedAt={} executedAt={}",
                 proposalId, proposal.getPolicyType(), proposal.getPassedAt(), context.now());

        if (proposal.getPolicyType().affectsReserve()) {
            healthMonitor.recompute(context);
        }
        return proposal.copy();
    }

    /** Authority-only, while ACTIVE and before the voting window ends. Totals are frozen as they are. */
    public PolicyProposal cancel(InvocationContext context, String agent, long proposalId) {
        LedgerTransaction ledger = context.ledger();
        GlobalState state = ledger.globalState();
        gate.authenticateRole(context, agent, state.getAuthority());

        PolicyProposal proposal = ledger.proposal(proposalId);
        PolicyEngineException.require(proposal.getStatus() == ProposalStatus.ACTIVE,
            PolicyError.PROPOSAL_NOT_ACTIVE, "id=" + proposalId + " status=" + proposal.getStatus());
        PolicyEngineException.require(context.now() < proposal.getEndTime(),
            PolicyError.VOTING_CLOSED, "id=" + proposalId + " endTime=" + proposal.getEndTime());

        proposal.markCancelled(context.now());
        ledger.emit(GovernanceEventType.PROPOSAL_CANCELLED, agent, proposalId, Map.of(
            "yesStake", proposal.getYesStake(),
            "noStake", proposal.getNoStake()));
        log.info("Proposal cancelled. id={} by={}", proposalId, agent);
        return proposal.copy();
    }

    public Optional<PolicyProposal> find(LedgerView view, long proposalId) {
        return view.proposal(proposalId);
    }

    public List<PolicyProposal> list(LedgerView view, ProposalStatus status) {
        List<PolicyProposal> all = view.proposals();
        return status == null ? all : all.stream().filter(p -> p.getStatus() == status).toList();
    }
}
