package com.reservepolicy.engine.controller;

import com.reservepolicy.common.auth.AgentAction;
import com.reservepolicy.common.auth.AgentMessages;
import com.reservepolicy.common.policy.MintSupplyParams;
import com.reservepolicy.engine.dto.CreateProposalRequest;
import com.reservepolicy.engine.dto.InitializeRequest;
import com.reservepolicy.engine.dto.SignedEnvelope;
import com.reservepolicy.engine.dto.SignedRequest;
import com.reservepolicy.engine.dto.VoteRequest;
import com.reservepolicy.engine.service.PolicyCommandService;
import com.reservepolicy.engine.signature.Ed25519SignatureProvider;
import com.reservepolicy.engine.signature.SignatureVerificationService;
import com.reservepolicy.engine.support.AgentKeys;
import com.reservepolicy.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

class GovernanceControllerTest {

    private static final String BASE = "/api/v1/governance";

    private EngineFixture fx;
    private WebTestClient client;

    private final AgentKeys authority  = new AgentKeys();
    private final AgentKeys oracle     = new AgentKeys();
    private final AgentKeys settlement = new AgentKeys();
    private final AgentKeys alice      = new AgentKeys();
    private final AgentKeys bob        = new AgentKeys();

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        SignatureVerificationService signatures =
            new SignatureVerificationService(new Ed25519SignatureProvider(), fx.clock, 300);
        GovernanceController controller =
            new GovernanceController(new PolicyCommandService(fx.engine, signatures), fx.engine);
        client = WebTestClient.bindToController(controller)
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    private long now() {
        return fx.clock.now();
    }

    private WebTestClient.ResponseSpec initialize() {
        SignedEnvelope auth = authority.envelope(now(), (ts, nonce) ->
            AgentMessages.build(AgentAction.INITIALIZE, authority.publicKey(), Map.of(
                "oracleAuthority", oracle.publicKey(),
                "settlementAuthority", settlement.publicKey(),
                "reserveVault", "reserve-vault",
                "tokenMint", "token-mint",
                "epochDurationSeconds", 86_400L,
                "mintBurnCapBps", 1_000L,
                "stabilityFeeBps", 50L,
                "vhrWarningBps", 15_000L,
                "vhrCriticalBps", 12_000L), ts, nonce));
        return client.post().uri(BASE + "/initialize")
            .bodyValue(new InitializeRequest(auth, oracle.publicKey(), settlement.publicKey(),
                "reserve-vault", "token-mint", 86_400, 1_000, 50, 15_000, 12_000))
            .exchange();
    }

    private WebTestClient.ResponseSpec propose(AgentKeys agent, MintSupplyParams params) {
        SignedEnvelope auth = agent.envelope(now(), (ts, nonce) ->
            AgentMessages.createProposal(agent.publicKey(), params, 3_600, ts, nonce));
        return client.post().uri(BASE + "/proposals")
            .bodyValue(new CreateProposalRequest(auth, params, 3_600))
            .exchange();
    }

    private SignedEnvelope voteEnvelope(AgentKeys agent, long proposalId, boolean prediction, long stake) {
        return agent.envelope(now(), (ts, nonce) ->
            AgentMessages.vote(agent.publicKey(), proposalId, prediction, stake, ts, nonce));
    }

    private SignedRequest proposalAction(AgentKeys agent, AgentAction action, long proposalId) {
        return new SignedRequest(agent.envelope(now(), (ts, nonce) ->
            AgentMessages.proposalAction(action, agent.publicKey(), proposalId, ts, nonce)));
    }

    @Test
    @DisplayName("POST /initialize signed by the authority → 201 with pinned identities")
    void initializes() {
        initialize()
            .expectStatus().isCreated()
            .expectBody()
            .jsonPath("$.authority").isEqualTo(authority.publicKey())
            .jsonPath("$.oracleAuthority").isEqualTo(oracle.publicKey())
            .jsonPath("$.proposalCounter").isEqualTo(0)
            .jsonPath("$.breaker.phase").isEqualTo("IDLE");

        initialize()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.code").isEqualTo("ALREADY_INITIALIZED");
    }

    @Nested
    @DisplayName("after initialization")
    class InitializedTests {

        @BeforeEach
        void init() {
            initialize().expectStatus().isCreated();
        }

        @Test
        @DisplayName("create, vote, finalize through the API")
        void signedFlow() {
            propose(alice, new MintSupplyParams(1_000, "treasury"))
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo(0)
                .jsonPath("$.status").isEqualTo("ACTIVE")
                .jsonPath("$.params.type").isEqualTo("MINT_SUPPLY");

            client.post().uri(BASE + "/proposals/0/votes")
                .bodyValue(new VoteRequest(voteEnvelope(bob, 0, true, 75), true, 75))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.agent").isEqualTo(bob.publicKey())
                .jsonPath("$.votingPower").isEqualTo(75);

            fx.clock.advanceSeconds(3_600);
            client.post().uri(BASE + "/proposals/0/finalize")
                .bodyValue(proposalAction(alice, AgentAction.FINALIZE_PROPOSAL, 0))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("PASSED")
                .jsonPath("$.finalRatioBps").isEqualTo(10_000);

            client.get().uri(BASE + "/proposals/{id}/votes/{agent}", 0, bob.publicKey())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.outcome").isEqualTo("WIN")
                .jsonPath("$.claimed").isEqualTo(false);
        }

        @Test
        @DisplayName("replayed envelope → 401 INVALID_NONCE")
        void replay() {
            propose(alice, new MintSupplyParams(1_000, "treasury")).expectStatus().isCreated();
            VoteRequest vote = new VoteRequest(voteEnvelope(bob, 0, true, 10), true, 10);

            client.post().uri(BASE + "/proposals/0/votes").bodyValue(vote).exchange().expectStatus().isCreated();
            client.post().uri(BASE + "/proposals/0/votes").bodyValue(vote).exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INVALID_NONCE")
                .jsonPath("$.category").isEqualTo("AUTHENTICATION");
        }

        @Test
        @DisplayName("signature over a different stake → 401 SIGNATURE_VERIFICATION_FAILED, nothing recorded")
        void tamperedArguments() {
            propose(alice, new MintSupplyParams(1_000, "treasury")).expectStatus().isCreated();

            client.post().uri(BASE + "/proposals/0/votes")
                .bodyValue(new VoteRequest(voteEnvelope(bob, 0, true, 10), true, 10_000))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.code").isEqualTo("SIGNATURE_VERIFICATION_FAILED");

            client.get().uri(BASE + "/proposals/0")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.yesStake").isEqualTo(0);
        }

        @Test
        @DisplayName("execute by a non-authority → 403; finalize too early → 409")
        void errorMapping() {
            propose(alice, new MintSupplyParams(1_000, "treasury")).expectStatus().isCreated();

            client.post().uri(BASE + "/proposals/0/finalize")
                .bodyValue(proposalAction(alice, AgentAction.FINALIZE_PROPOSAL, 0))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.code").isEqualTo("PROPOSAL_STILL_ACTIVE");

            client.post().uri(BASE + "/proposals/0/execute")
                .bodyValue(proposalAction(bob, AgentAction.EXECUTE_PROPOSAL, 0))
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.code").isEqualTo("UNAUTHORIZED");
        }

        @Test
        @DisplayName("unknown proposal → 400 PROPOSAL_NOT_FOUND; unknown vote → 404")
        void notFound() {
            client.get().uri(BASE + "/proposals/99")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("PROPOSAL_NOT_FOUND");

            client.get().uri(BASE + "/proposals/{id}/votes/{agent}", 99, bob.publicKey())
                .exchange()
                .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("stale signature timestamp → 401 SIGNATURE_EXPIRED")
        void expired() {
            MintSupplyParams params = new MintSupplyParams(1_000, "treasury");
            SignedEnvelope stale = alice.envelope(now() - 301, (ts, nonce) ->
                AgentMessages.createProposal(alice.publicKey(), params, 3_600, ts, nonce));

            client.post().uri(BASE + "/proposals")
                .bodyValue(new CreateProposalRequest(stale, params, 3_600))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.code").isEqualTo("SIGNATURE_EXPIRED");
        }
    }
}
