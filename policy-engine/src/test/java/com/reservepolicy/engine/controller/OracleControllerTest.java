package com.reservepolicy.engine.controller;

import com.reservepolicy.common.auth.AgentAction;
import com.reservepolicy.common.auth.AgentMessages;
import com.reservepolicy.common.model.OracleReading;
import com.reservepolicy.engine.dto.InitializeRequest;
import com.reservepolicy.engine.dto.OracleUpdateRequest;
import com.reservepolicy.engine.dto.SignedEnvelope;
import com.reservepolicy.engine.service.PolicyCommandService;
import com.reservepolicy.engine.signature.Ed25519SignatureProvider;
import com.reservepolicy.engine.signature.SignatureVerificationService;
import com.reservepolicy.engine.support.AgentKeys;
import com.reservepolicy.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

class OracleControllerTest {

    private static final String BASE = "/api/v1/oracle";

    private EngineFixture fx;
    private WebTestClient client;

    private final AgentKeys authority = new AgentKeys();
    private final AgentKeys oracle    = new AgentKeys();
    private final AgentKeys intruder  = new AgentKeys();

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        SignatureVerificationService signatures =
            new SignatureVerificationService(new Ed25519SignatureProvider(), fx.clock, 300);
        PolicyCommandService commands = new PolicyCommandService(fx.engine, signatures);
        client = WebTestClient.bindToController(new OracleController(commands, fx.engine))
            .controllerAdvice(new ApiExceptionHandler())
            .build();

        SignedEnvelope auth = authority.envelope(fx.clock.now(), (ts, nonce) ->
            AgentMessages.build(AgentAction.INITIALIZE, authority.publicKey(), Map.of(
                "oracleAuthority", oracle.publicKey(),
                "settlementAuthority", "settlement",
                "reserveVault", "reserve-vault",
                "tokenMint", "token-mint",
                "epochDurationSeconds", 86_400L,
                "mintBurnCapBps", 1_000L,
                "stabilityFeeBps", 50L,
                "vhrWarningBps", 15_000L,
                "vhrCriticalBps", 12_000L), ts, nonce));
        commands.initialize(new InitializeRequest(auth, oracle.publicKey(), "settlement",
            "reserve-vault", "token-mint", 86_400, 1_000, 50, 15_000, 12_000)).block();
    }

    private OracleUpdateRequest update(AgentKeys agent, OracleReading reading) {
        return new OracleUpdateRequest(agent.envelope(fx.clock.now(), (ts, nonce) ->
            AgentMessages.oracleUpdate(agent.publicKey(), reading, ts, nonce)), reading);
    }

    private OracleReading reading(long indexValue) {
        return new OracleReading(indexValue, 450, 1_200, 5_000_000_000L, fx.clock.now(), fx.clock.slot());
    }

    @Test
    @DisplayName("reading from the oracle authority is admitted and served by GET /current")
    void admitted() {
        fx.clock.advance(300, 100);
        client.post().uri(BASE + "/readings")
            .bodyValue(update(oracle, reading(1_050_000)))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.indexValue").isEqualTo(1_050_000)
            .jsonPath("$.snapshotCount").isEqualTo(1);

        client.get().uri(BASE + "/current")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.indexValue").isEqualTo(1_050_000)
            .jsonPath("$.avgYieldBps").isEqualTo(450);
    }

    @Test
    @DisplayName("second reading inside the interval → 409 ORACLE_UPDATE_TOO_SOON")
    void tooSoon() {
        fx.clock.advance(300, 100);
        client.post().uri(BASE + "/readings")
            .bodyValue(update(oracle, reading(1_000_000)))
            .exchange()
            .expectStatus().isOk();

        fx.clock.advance(60, 200);
        client.post().uri(BASE + "/readings")
            .bodyValue(update(oracle, reading(1_000_100)))
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.code").isEqualTo("ORACLE_UPDATE_TOO_SOON");
    }

    @Test
    @DisplayName("reading signed by another agent → 403")
    void notOracleAuthority() {
        fx.clock.advance(300, 100);
        client.post().uri(BASE + "/readings")
            .bodyValue(update(intruder, reading(1_000_000)))
            .exchange()
            .expectStatus().isForbidden()
            .expectBody()
            .jsonPath("$.code").isEqualTo("UNAUTHORIZED");
    }

    @Test
    @DisplayName("missing reading → 400 MALFORMED_PAYLOAD")
    void missingReading() {
        client.post().uri(BASE + "/readings")
            .bodyValue(new OracleUpdateRequest(null, null))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.code").isEqualTo("MALFORMED_PAYLOAD");
    }
}
