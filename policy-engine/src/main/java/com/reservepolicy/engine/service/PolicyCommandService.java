package com.reservepolicy.engine.service;

import com.reservepolicy.common.auth.AgentAction;
import com.reservepolicy.common.auth.AgentMessages;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.engine.admin.ConfigUpdate;
import com.reservepolicy.engine.admin.ProtocolSettings;
import com.reservepolicy.engine.dto.ConfigUpdateRequest;
import com.reservepolicy.engine.dto.CreateProposalRequest;
import com.reservepolicy.engine.dto.InitializeRequest;
import com.reservepolicy.engine.dto.OracleUpdateRequest;
import com.reservepolicy.engine.dto.OracleView;
import com.reservepolicy.engine.dto.ProposalView;
import com.reservepolicy.engine.dto.ProtocolView;
import com.reservepolicy.engine.dto.RebalanceRequest;
import com.reservepolicy.engine.dto.ReserveAmountRequest;
import com.reservepolicy.engine.dto.SignedEnvelope;
import com.reservepolicy.engine.dto.VaultView;
import com.reservepolicy.engine.dto.VoteRequest;
import com.reservepolicy.engine.dto.VoteView;
import com.reservepolicy.engine.governance.VoteSettlement;
import com.reservepolicy.engine.signature.SignatureVerificationService;
import com.reservepolicy.engine.state.BreakerState;
import com.reservepolicy.engine.substrate.EngineCall;
import com.reservepolicy.engine.substrate.SignatureVerification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.function.Function;

/**
 * Reactive front of the engine for signed HTTP requests.
 *
 * <p>Each command rebuilds the canonical message from the request, verifies the
 * signature, and submits the call behind the resulting verification step.
 * Submissions take the substrate's write lock, so they run on
 * {@code boundedElastic} and never on a reactor thread.
 */
@Service
public class PolicyCommandService {

    private static final Logger log = LoggerFactory.getLogger(PolicyCommandService.class);

    private final PolicyEngine engine;
    private final SignatureVerificationService signatures;

    public PolicyCommandService(PolicyEngine engine, SignatureVerificationService signatures) {
        this.engine     = engine;
        this.signatures = signatures;
    }

    public Mono<ProtocolView> initialize(InitializeRequest request) {
        return signed(request.auth(),
            auth -> AgentMessages.build(AgentAction.INITIALIZE, auth.publicKey(), Map.of(
                "oracleAuthority", String.valueOf(request.oracleAuthority()),
                "settlementAuthority", String.valueOf(request.settlementAuthority()),
                "reserveVault", String.valueOf(request.reserveVault()),
                "tokenMint", String.valueOf(request.tokenMint()),
                "epochDurationSeconds", request.epochDurationSeconds(),
                "mintBurnCapBps", request.mintBurnCapBps(),
                "stabilityFeeBps", request.stabilityFeeBps(),
                "vhrWarningBps", request.vhrWarningBps(),
                "vhrCriticalBps", request.vhrCriticalBps()), auth.timestamp(), auth.nonce()),
            auth -> engine.initializeCall(new ProtocolSettings(auth.publicKey(),
                request.oracleAuthority(), request.settlementAuthority(), request.reserveVault(),
                request.tokenMint(), request.epochDurationSeconds(), request.mintBurnCapBps(),
                request.stabilityFeeBps(), request.vhrWarningBps(), request.vhrCriticalBps())))
            .map(ProtocolView::from);
    }

    public Mono<ProtocolView> updateConfig(ConfigUpdateRequest request) {
        return signed(request.auth(),
            auth -> AgentMessages.build(AgentAction.UPDATE_CONFIG, auth.publicKey(), Map.of(
                "epochDurationSeconds", request.epochDurationSeconds(),
                "mintBurnCapBps", request.mintBurnCapBps(),
                "stabilityFeeBps", request.stabilityFeeBps(),
                "vhrWarningBps", request.vhrWarningBps(),
                "vhrCriticalBps", request.vhrCriticalBps()), auth.timestamp(), auth.nonce()),
            auth -> engine.updateConfigCall(auth.publicKey(), new ConfigUpdate(
                request.epochDurationSeconds(), request.mintBurnCapBps(), request.stabilityFeeBps(),
                request.vhrWarningBps(), request.vhrCriticalBps())))
            .map(ProtocolView::from);
    }

    public Mono<ProposalView> createProposal(CreateProposalRequest request) {
        if (request.params() == null) {
            return Mono.error(new PolicyEngineException(PolicyError.MALFORMED_PAYLOAD, "policy payload is required"));
        }
        return signed(request.auth(),
            auth -> AgentMessages.createProposal(auth.publicKey(), request.params(),
                request.votingPeriodSeconds(), auth.timestamp(), auth.nonce()),
            auth -> engine.createProposalCall(auth.publicKey(), request.params(), request.votingPeriodSeconds()))
            .map(ProposalView::from);
    }

    public Mono<VoteView> vote(long proposalId, VoteRequest request) {
        return signed(request.auth(),
            auth -> AgentMessages.vote(auth.publicKey(), proposalId, request.prediction(),
                request.stakeAmount(), auth.timestamp(), auth.nonce()),
            auth -> engine.voteCall(auth.publicKey(), proposalId, request.prediction(), request.stakeAmount()))
            .map(VoteView::from);
    }

    public Mono<ProposalView> finalizeProposal(long proposalId, SignedEnvelope envelope) {
        return signed(envelope,
            auth -> AgentMessages.proposalAction(AgentAction.FINALIZE_PROPOSAL, auth.publicKey(), proposalId,
                auth.timestamp(), auth.nonce()),
            auth -> engine.finalizeCall(auth.publicKey(), proposalId))
            .map(ProposalView::from);
    }

    public Mono<ProposalView> execute(long proposalId, SignedEnvelope envelope) {
        return signed(envelope,
            auth -> AgentMessages.proposalAction(AgentAction.EXECUTE_PROPOSAL, auth.publicKey(), proposalId,
                auth.timestamp(), auth.nonce()),
            auth -> engine.executeCall(auth.publicKey(), proposalId))
            .map(ProposalView::from);
    }

    public Mono<ProposalView> cancel(long proposalId, SignedEnvelope envelope) {
        return signed(envelope,
            auth -> AgentMessages.proposalAction(AgentAction.CANCEL_PROPOSAL, auth.publicKey(), proposalId,
                auth.timestamp(), auth.nonce()),
            auth -> engine.cancelCall(auth.publicKey(), proposalId))
            .map(ProposalView::from);
    }

    public Mono<VoteSettlement> markClaimed(long proposalId, String voter, SignedEnvelope envelope) {
        return signed(envelope,
            auth -> AgentMessages.markClaimed(auth.publicKey(), proposalId, voter, auth.timestamp(), auth.nonce()),
            auth -> engine.markClaimedCall(auth.publicKey(), proposalId, voter));
    }

    public Mono<OracleView> updateOracle(OracleUpdateRequest request) {
        if (request.reading() == null) {
            return Mono.error(new PolicyEngineException(PolicyError.MALFORMED_PAYLOAD, "reading is required"));
        }
        return signed(request.auth(),
            auth -> AgentMessages.oracleUpdate(auth.publicKey(), request.reading(), auth.timestamp(), auth.nonce()),
            auth -> engine.updateOracleCall(auth.publicKey(), request.reading()))
            .map(OracleView::from);
    }

    public Mono<BreakerState> requestBreaker(SignedEnvelope envelope) {
        return breakerCommand(AgentAction.REQUEST_CIRCUIT_BREAKER, envelope,
            auth -> engine.requestBreakerCall(auth.publicKey()));
    }

    public Mono<BreakerState> activateBreaker(SignedEnvelope envelope) {
        return breakerCommand(AgentAction.ACTIVATE_CIRCUIT_BREAKER, envelope,
            auth -> engine.activateBreakerCall(auth.publicKey()));
    }

    public Mono<BreakerState> deactivateBreaker(SignedEnvelope envelope) {
        return breakerCommand(AgentAction.DEACTIVATE_CIRCUIT_BREAKER, envelope,
            auth -> engine.deactivateBreakerCall(auth.publicKey()));
    }

    public Mono<VaultView> deposit(ReserveAmountRequest request) {
        return signed(request.auth(),
            auth -> AgentMessages.reserveAmount(AgentAction.DEPOSIT, auth.publicKey(), request.units(),
                auth.timestamp(), auth.nonce()),
            auth -> engine.depositCall(auth.publicKey(), request.units()))
            .map(VaultView::from);
    }

    public Mono<VaultView> withdraw(ReserveAmountRequest request) {
        return signed(request.auth(),
            auth -> AgentMessages.reserveAmount(AgentAction.WITHDRAW, auth.publicKey(), request.units(),
                auth.timestamp(), auth.nonce()),
            auth -> engine.withdrawCall(auth.publicKey(), request.units()))
            .map(VaultView::from);
    }

    public Mono<VaultView> rebalance(RebalanceRequest request) {
        Map<String, Integer> weights = request.targetWeightsBps() == null ? Map.of() : request.targetWeightsBps();
        return signed(request.auth(),
            auth -> AgentMessages.build(AgentAction.REBALANCE_VAULT, auth.publicKey(),
                Map.of("targetWeightsBps", weights), auth.timestamp(), auth.nonce()),
            auth -> engine.rebalanceCall(auth.publicKey(), weights))
            .map(VaultView::from);
    }

    private Mono<BreakerState> breakerCommand(AgentAction action, SignedEnvelope envelope,
                                              Function<SignedEnvelope, EngineCall<BreakerState>> call) {
        return signed(envelope,
            auth -> AgentMessages.bare(action, auth.publicKey(), auth.timestamp(), auth.nonce()),
            call);
    }

    private <T> Mono<T> signed(SignedEnvelope envelope,
                               Function<SignedEnvelope, byte[]> message,
                               Function<SignedEnvelope, EngineCall<T>> call) {
        return Mono.fromCallable(() -> {
                PolicyEngineException.require(envelope != null, PolicyError.MISSING_SIGNATURE_VERIFICATION,
                    "signed envelope is required");
                SignatureVerification verification = signatures.verify(envelope, message.apply(envelope));
                return engine.submit(verification, call.apply(envelope));
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnError(PolicyEngineException.class, e -> log.debug("Command rejected. agent={} code={}",
                envelope == null ? null : envelope.publicKey(), e.getError()))
            .doOnError(e -> !(e instanceof PolicyEngineException),
                e -> log.error("Command failed. agent={}", envelope == null ? null : envelope.publicKey(), e));
    }
}
