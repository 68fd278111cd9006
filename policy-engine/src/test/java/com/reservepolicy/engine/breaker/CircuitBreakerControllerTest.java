package com.reservepolicy.engine.breaker;

import com.reservepolicy.common.event.GovernanceEventType;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.model.BreakerPhase;
import com.reservepolicy.engine.service.PolicyEngine;
import com.reservepolicy.engine.state.BreakerState;
import com.reservepolicy.engine.substrate.EngineCall;
import com.reservepolicy.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static com.reservepolicy.engine.support.EngineFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerControllerTest {

    private static final long HOUR = 3_600L;

    private EngineFixture fx;
    private PolicyEngine engine;
    private long delay;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture().initialized();
        engine = fx.engine;
        delay = fx.parameters.circuitBreakerDelaySeconds();
    }

    private BreakerState request() {
        return fx.as(AUTHORITY, engine.requestBreakerCall(AUTHORITY));
    }

    private BreakerState activate() {
        return fx.as(AUTHORITY, engine.activateBreakerCall(AUTHORITY));
    }

    private BreakerState deactivate() {
        return fx.as(AUTHORITY, engine.deactivateBreakerCall(AUTHORITY));
    }

    // ── request / activate ────────────────────────────────────────────────

    @Nested
    @DisplayName("request and activate")
    class ActivationTests {

        @Test
        @DisplayName("request moves IDLE → REQUESTED at now")
        void request_recordsTime() {
            BreakerState state = request();

            assertEquals(BreakerPhase.REQUESTED, state.phase());
            assertEquals(GENESIS_TIME, state.since());
            assertEquals(1, fx.events.ofType(GovernanceEventType.BREAKER_REQUESTED).size());
        }

        @Test
        @DisplayName("activation one hour after request → CIRCUIT_BREAKER_TIMELOCK_NOT_MET")
        void tooEarly() {
            request();
            fx.clock.advanceSeconds(HOUR);

            assertRejected(PolicyError.CIRCUIT_BREAKER_TIMELOCK_NOT_MET, CircuitBreakerControllerTest.this::activate);
            assertEquals(BreakerPhase.REQUESTED, engine.breakerState().phase());
        }

        @Test
        @DisplayName("activation 24h + 1s after request → ACTIVE")
        void afterDelay() {
            request();
            fx.clock.advanceSeconds(24 * HOUR + 1);

            BreakerState state = activate();
            assertEquals(BreakerPhase.ACTIVE, state.phase());
            assertEquals(fx.clock.now(), state.since());
        }

        @Test
        @DisplayName("activation exactly at the delay → ACTIVE")
        void exactlyAtDelay() {
            request();
            fx.clock.advanceSeconds(delay);

            assertTrue(activate().isActive());
        }

        @Test
        @DisplayName("activate without a request → INVALID_BREAKER_TRANSITION")
        void activateFromIdle() {
            fx.clock.advanceSeconds(delay);
            assertRejected(PolicyError.INVALID_BREAKER_TRANSITION, CircuitBreakerControllerTest.this::activate);
        }

        @Test
        @DisplayName("second request while REQUESTED or ACTIVE → INVALID_BREAKER_TRANSITION")
        void requestTwice() {
            request();
            assertRejected(PolicyError.INVALID_BREAKER_TRANSITION, CircuitBreakerControllerTest.this::request);

            fx.clock.advanceSeconds(delay);
            activate();
            assertRejected(PolicyError.INVALID_BREAKER_TRANSITION, CircuitBreakerControllerTest.this::request);
        }

        @Test
        @DisplayName("non-authority cannot request → UNAUTHORIZED")
        void nonAuthority() {
            assertRejected(PolicyError.UNAUTHORIZED, () -> fx.as("agent-a", engine.requestBreakerCall("agent-a")));
            assertEquals(BreakerPhase.IDLE, engine.breakerState().phase());
        }
    }

    // ── deactivate ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("deactivate")
    class DeactivationTests {

        @Test
        @DisplayName("ACTIVE → IDLE with no delay")
        void fromActive() {
            request();
            fx.clock.advanceSeconds(delay);
            activate();

            BreakerState state = deactivate();
            assertEquals(BreakerPhase.IDLE, state.phase());
            assertEquals(0L, state.since());
        }

        @Test
        @DisplayName("REQUESTED → IDLE cancels the pending request")
        void fromRequested() {
            request();

            assertEquals(BreakerPhase.IDLE, deactivate().phase());
            fx.clock.advanceSeconds(delay);
            assertRejected(PolicyError.INVALID_BREAKER_TRANSITION, CircuitBreakerControllerTest.this::activate);
        }

        @Test
        @DisplayName("from IDLE → INVALID_BREAKER_TRANSITION")
        void fromIdle() {
            assertRejected(PolicyError.INVALID_BREAKER_TRANSITION, CircuitBreakerControllerTest.this::deactivate);
        }

        @Test
        @DisplayName("a fresh request after deactivation restarts the timelock")
        void restartsTimelock() {
            request();
            fx.clock.advanceSeconds(delay);
            deactivate();
            request();

            assertRejected(PolicyError.CIRCUIT_BREAKER_TIMELOCK_NOT_MET, CircuitBreakerControllerTest.this::activate);
        }
    }

    @Test
    @DisplayName("over random sequences ACTIVE is only ever reached a full delay after the latest request")
    void timelockProperty() {
        Random random = new Random(42);
        Long requestedAt = null;

        for (int i = 0; i < 300; i++) {
            fx.clock.advanceSeconds(random.nextInt((int) (delay / 2)));
            EngineCall<BreakerState> call = switch (random.nextInt(3)) {
                case 0 -> engine.requestBreakerCall(AUTHORITY);
                case 1 -> engine.activateBreakerCall(AUTHORITY);
                default -> engine.deactivateBreakerCall(AUTHORITY);
            };
            BreakerState before = engine.breakerState();
            try {
                BreakerState after = fx.as(AUTHORITY, call);
                if (after.phase() == BreakerPhase.REQUESTED) {
                    requestedAt = after.since();
                }
                if (after.phase() == BreakerPhase.ACTIVE && before.phase() == BreakerPhase.REQUESTED) {
                    assertNotNull(requestedAt);
                    assertTrue(after.since() - requestedAt >= delay);
                }
            } catch (PolicyEngineException e) {
                assertEquals(before, engine.breakerState());
            }
        }
    }
}
