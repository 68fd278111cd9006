package com.reservepolicy.engine.service;

import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.health.VaultHealthReport;
import com.reservepolicy.common.model.OracleReading;
import com.reservepolicy.common.model.ProposalStatus;
import com.reservepolicy.common.policy.PolicyParams;
import com.reservepolicy.engine.admin.ConfigUpdate;
import com.reservepolicy.engine.admin.ProtocolAdministration;
import com.reservepolicy.engine.admin.ProtocolSettings;
import com.reservepolicy.engine.breaker.CircuitBreakerController;
import com.reservepolicy.engine.clock.ChainClock;
import com.reservepolicy.engine.governance.ProposalRegistry;
import com.reservepolicy.engine.governance.VoteSettlement;
import com.reservepolicy.engine.governance.VotingLedger;
import com.reservepolicy.engine.health.VaultHealthMonitor;
import com.reservepolicy.engine.oracle.OracleUpdateGate;
import com.reservepolicy.engine.reserve.ReserveOperations;
import com.reservepolicy.engine.state.BreakerState;
import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.state.OracleState;
import com.reservepolicy.engine.state.PolicyProposal;
import com.reservepolicy.engine.state.ReserveVault;
import com.reservepolicy.engine.state.VoteRecord;
import com.reservepolicy.engine.substrate.EngineCall;
import com.reservepolicy.engine.substrate.ExecutionSubstrate;
import com.reservepolicy.engine.substrate.SignatureVerification;
import com.reservepolicy.engine.substrate.Submission;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the engine.
 *
 * <p>The {@code *Call} factories bind an entry point to its arguments; {@link #submit}
 * runs one call behind its signature verification step as an atomic submission.
 * Callers that need several calls in one submission build the {@link Submission}
 * themselves and hand it to the substrate.
 */
@Service
public class PolicyEngine {

    private final ExecutionSubstrate substrate;
    private final ChainClock clock;
    private final ProtocolAdministration administration;
    private final ProposalRegistry registry;
    private final VotingLedger votingLedger;
    private final OracleUpdateGate oracleGate;
    private final CircuitBreakerController breaker;
    private final VaultHealthMonitor healthMonitor;
    private final ReserveOperations reserve;

    public PolicyEngine(ExecutionSubstrate substrate,
                        ChainClock clock,
                        ProtocolAdministration administration,
                        ProposalRegistry registry,
                        VotingLedger votingLedger,
                        OracleUpdateGate oracleGate,
                        CircuitBreakerController breaker,
                        VaultHealthMonitor healthMonitor,
                        ReserveOperations reserve) {
        this.substrate      = substrate;
        this.clock          = clock;
        this.administration = administration;
        this.registry       = registry;
        this.votingLedger   = votingLedger;
        this.oracleGate     = oracleGate;
        this.breaker        = breaker;
        this.healthMonitor  = healthMonitor;
        this.reserve        = reserve;
    }

    public <T> T submit(SignatureVerification verification, EngineCall<T> call) {
        return substrate.submit(Submission.of(verification, call)).result(0);
    }

    public ExecutionSubstrate substrate() {
        return substrate;
    }

    // ── calls ────────────────────────────────────────────────────────────────

    public EngineCall<GlobalState> initializeCall(ProtocolSettings settings) {
        return new EngineCall<>("initialize", ctx -> administration.initialize(ctx, settings));
    }

    public EngineCall<GlobalState> updateConfigCall(String agent, ConfigUpdate update) {
        return new EngineCall<>("update_config", ctx -> administration.updateConfig(ctx, agent, update));
    }

    public EngineCall<PolicyProposal> createProposalCall(String proposer, PolicyParams params, long votingPeriodSeconds) {
        return new EngineCall<>("create_proposal", ctx -> registry.create(ctx, proposer, params, votingPeriodSeconds));
    }

    public EngineCall<VoteRecord> voteCall(String agent, long proposalId, boolean prediction, long stakeAmount) {
        return new EngineCall<>("vote", ctx -> votingLedger.vote(ctx, agent, proposalId, prediction, stakeAmount));
    }

    public EngineCall<PolicyProposal> finalizeCall(String agent, long proposalId) {
        return new EngineCall<>("finalize_proposal", ctx -> registry.finalizeProposal(ctx, agent, proposalId));
    }

    public EngineCall<PolicyProposal> executeCall(String agent, long proposalId) {
        return new EngineCall<>("execute_proposal", ctx -> registry.execute(ctx, agent, proposalId));
    }

    public EngineCall<PolicyProposal> cancelCall(String agent, long proposalId) {
        return new EngineCall<>("cancel_proposal", ctx -> registry.cancel(ctx, agent, proposalId));
    }

    public EngineCall<VoteSettlement> markClaimedCall(String agent, long proposalId, String voter) {
        return new EngineCall<>("mark_claimed", ctx -> votingLedger.markClaimed(ctx, agent, proposalId, voter));
    }

    public EngineCall<OracleState> updateOracleCall(String agent, OracleReading reading) {
        return new EngineCall<>("update_oracle", ctx -> oracleGate.update(ctx, agent, reading));
    }

    public EngineCall<BreakerState> requestBreakerCall(String agent) {
        return new EngineCall<>("request_circuit_breaker", ctx -> breaker.request(ctx, agent));
    }

    public EngineCall<BreakerState> activateBreakerCall(String agent) {
        return new EngineCall<>("activate_circuit_breaker", ctx -> breaker.activate(ctx, agent));
    }

    public EngineCall<BreakerState> deactivateBreakerCall(String agent) {
        return new EngineCall<>("deactivate_circuit_breaker", ctx -> breaker.deactivate(ctx, agent));
    }

    public EngineCall<ReserveVault> depositCall(String agent, long units) {
        return new EngineCall<>("deposit", ctx -> reserve.deposit(ctx, agent, units));
    }

    public EngineCall<ReserveVault> withdrawCall(String agent, long units) {
        return new EngineCall<>("withdraw", ctx -> reserve.withdraw(ctx, agent, units));
    }

    public EngineCall<ReserveVault> rebalanceCall(String agent, Map<String, Integer> targetWeightsBps) {
        return new EngineCall<>("rebalance_vault", ctx -> reserve.rebalance(ctx, agent, targetWeightsBps));
    }

    // ── reads ────────────────────────────────────────────────────────────────

    public GlobalState globalState() {
        return substrate.view().globalState()
            .orElseThrow(() -> new PolicyEngineException(PolicyError.NOT_INITIALIZED));
    }

    public PolicyProposal proposal(long proposalId) {
        return registry.find(substrate.view(), proposalId)
            .orElseThrow(() -> new PolicyEngineException(PolicyError.PROPOSAL_NOT_FOUND, "id=" + proposalId));
    }

    public List<PolicyProposal> proposals(ProposalStatus status) {
        return registry.list(substrate.view(), status);
    }

    public List<VoteSettlement> settlements(long proposalId) {
        return votingLedger.settlements(substrate.view(), proposalId);
    }

    public Optional<VoteSettlement> settlement(long proposalId, String voter) {
        return votingLedger.settlement(substrate.view(), proposalId, voter);
    }

    public OracleState oracle() {
        return oracleGate.current(substrate.view());
    }

    public BreakerState breakerState() {
        return breaker.current(substrate.view());
    }

    public ReserveVault vault() {
        return reserve.current(substrate.view());
    }

    public VaultHealthReport health() {
        return healthMonitor.currentReport(substrate.view(), clock.now());
    }

    public long lastNonce(String agent) {
        return substrate.view().lastNonce(agent);
    }
}
