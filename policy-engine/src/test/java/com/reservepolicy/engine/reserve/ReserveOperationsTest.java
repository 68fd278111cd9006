package com.reservepolicy.engine.reserve;

import com.reservepolicy.common.event.GovernanceEventType;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.engine.service.PolicyEngine;
import com.reservepolicy.engine.state.ReserveVault;
import com.reservepolicy.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.reservepolicy.engine.support.EngineFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class ReserveOperationsTest {

    private EngineFixture fx;
    private PolicyEngine engine;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture().initialized();
        engine = fx.engine;
        fx.admitOracle(1_000_000);
    }

    @Nested
    @DisplayName("deposit()")
    class DepositTests {

        @Test
        @DisplayName("any authenticated agent may deposit; units accumulate")
        void deposits() {
            fx.as("agent-a", engine.depositCall("agent-a", 400));
            ReserveVault vault = fx.as("agent-b", engine.depositCall("agent-b", 600));

            assertEquals(1_000L, vault.getReserveUnits());
            assertEquals(2, fx.events.ofType(GovernanceEventType.RESERVE_DEPOSIT).size());
        }

        @Test
        @DisplayName("non-positive units → INVALID_AMOUNT")
        void invalidAmount() {
            assertRejected(PolicyError.INVALID_AMOUNT, () -> fx.as("agent-a", engine.depositCall("agent-a", 0)));
        }

        @Test
        @DisplayName("reserve units past Long.MAX_VALUE → ARITHMETIC_OVERFLOW")
        void overflow() {
            fx.as("agent-a", engine.depositCall("agent-a", Long.MAX_VALUE));

            assertRejected(PolicyError.ARITHMETIC_OVERFLOW, () -> fx.as("agent-a", engine.depositCall("agent-a", 1)));
            assertEquals(Long.MAX_VALUE, engine.vault().getReserveUnits());
        }

        @Test
        @DisplayName("before initialization → NOT_INITIALIZED")
        void notInitialized() {
            EngineFixture bare = new EngineFixture();
            assertRejected(PolicyError.NOT_INITIALIZED, () -> bare.as("agent-a", bare.engine.depositCall("agent-a", 1)));
        }
    }

    @Nested
    @DisplayName("withdraw()")
    class WithdrawTests {

        @BeforeEach
        void fund() {
            fx.as("agent-a", engine.depositCall("agent-a", 10_000_000));
        }

        @Test
        @DisplayName("authority withdraws freely while there are no liabilities")
        void noLiabilities() {
            ReserveVault vault = fx.as(AUTHORITY, engine.withdrawCall(AUTHORITY, 10_000_000));

            assertEquals(0L, vault.getReserveUnits());
        }

        @Test
        @DisplayName("more than the balance → INSUFFICIENT_VAULT_BALANCE")
        void insufficient() {
            assertRejected(PolicyError.INSUFFICIENT_VAULT_BALANCE,
                () -> fx.as(AUTHORITY, engine.withdrawCall(AUTHORITY, 10_000_001)));
        }

        @Test
        @DisplayName("withdrawal that would drop VHR below critical → VHR_BELOW_THRESHOLD; at critical it passes")
        void keepsCriticalRatio() {
            fx.executeMint(1_000_000);

            assertRejected(PolicyError.VHR_BELOW_THRESHOLD,
                () -> fx.as(AUTHORITY, engine.withdrawCall(AUTHORITY, 8_800_001)));
            assertEquals(10_000_000L, engine.vault().getReserveUnits());

            ReserveVault vault = fx.as(AUTHORITY, engine.withdrawCall(AUTHORITY, 8_800_000));
            assertEquals(CRIT_BPS, vault.getLastVhrBps());
        }

        @Test
        @DisplayName("null weight → MALFORMED_PAYLOAD and the previous weights stay")
        void nullWeight() {
            fx.as(AUTHORITY, engine.rebalanceCall(AUTHORITY, Map.of("USDC", 10_000)));
            Map<String, Integer> weights = new HashMap<>();
            weights.put("USDC", 10_000);
            weights.put("SOL", null);

            assertRejected(PolicyError.MALFORMED_PAYLOAD,
                () -> fx.as(AUTHORITY, engine.rebalanceCall(AUTHORITY, weights)));
            assertEquals(Map.of("USDC", 10_000), engine.vault().getTargetWeightsBps());
        }

        @Test
        @DisplayName("non-authority → UNAUTHORIZED")
        void nonAuthority() {
            assertRejected(PolicyError.UNAUTHORIZED, () -> fx.as("agent-a", engine.withdrawCall("agent-a", 1)));
        }

        @Test
        @DisplayName("breaker ACTIVE → CIRCUIT_BREAKER_ACTIVE")
        void halted() {
            fx.as(AUTHORITY, engine.requestBreakerCall(AUTHORITY));
            fx.clock.advanceSeconds(fx.parameters.circuitBreakerDelaySeconds());
            fx.as(AUTHORITY, engine.activateBreakerCall(AUTHORITY));

            assertRejected(PolicyError.CIRCUIT_BREAKER_ACTIVE, () -> fx.as(AUTHORITY, engine.withdrawCall(AUTHORITY, 1)));
            fx.as("agent-b", engine.depositCall("agent-b", 5));
            assertEquals(10_000_005L, engine.vault().getReserveUnits());
        }
    }

    @Nested
    @DisplayName("rebalance()")
    class RebalanceTests {

        @Test
        @DisplayName("authority replaces the target weights")
        void rebalances() {
            ReserveVault vault = fx.as(AUTHORITY, engine.rebalanceCall(AUTHORITY, Map.of("USDC", 6_000, "USDT", 4_000)));

            assertEquals(Map.of("USDC", 6_000, "USDT", 4_000), vault.getTargetWeightsBps());
            assertEquals(fx.clock.now(), vault.getLastRebalanceAt());
        }

        @Test
        @DisplayName("weights not summing to 10000 → MALFORMED_PAYLOAD")
        void badWeights() {
            assertRejected(PolicyError.MALFORMED_PAYLOAD,
                () -> fx.as(AUTHORITY, engine.rebalanceCall(AUTHORITY, Map.of("USDC", 6_000))));
        }

        @Test
        @DisplayName("non-authority → UNAUTHORIZED")
        void nonAuthority() {
            assertRejected(PolicyError.UNAUTHORIZED,
                () -> fx.as("agent-a", engine.rebalanceCall("agent-a", Map.of("USDC", 10_000))));
        }
    }
}
