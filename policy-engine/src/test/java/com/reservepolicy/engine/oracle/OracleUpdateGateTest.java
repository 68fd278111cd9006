package com.reservepolicy.engine.oracle;

import com.reservepolicy.common.event.GovernanceEvent;
import com.reservepolicy.common.event.GovernanceEventType;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.model.OracleReading;
import com.reservepolicy.engine.service.PolicyEngine;
import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.state.OracleState;
import com.reservepolicy.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.reservepolicy.engine.support.EngineFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class OracleUpdateGateTest {

    private EngineFixture fx;
    private PolicyEngine engine;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture().initialized();
        engine = fx.engine;
    }

    private OracleReading reading(long index) {
        return new OracleReading(index, 450, 1_200, 5_000_000_000L, fx.clock.now(), fx.clock.slot());
    }

    private OracleState submit(OracleReading reading) {
        return fx.as(ORACLE, engine.updateOracleCall(ORACLE, reading));
    }

    // ── timing ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("interval and slot buffer")
    class TimingTests {

        @Test
        @DisplayName("first update needs the slot buffer counted from initialization")
        void firstUpdateUsesInitSlot() {
            fx.clock.advance(10, 99);
            assertRejected(PolicyError.SLOT_BUFFER_NOT_MET, () -> submit(reading(1_000_000)));

            fx.clock.advance(0, 1);
            OracleState state = submit(reading(1_000_000));
            assertEquals(1, state.getSnapshotCount());
            assertEquals(GENESIS_SLOT + 100, engine.globalState().getLastOracleSlot());
        }

        @Test
        @DisplayName("three minutes after an admitted update → ORACLE_UPDATE_TOO_SOON")
        void tooSoon() {
            fx.admitOracle(1_000_000);
            fx.clock.advance(180, 500);

            assertRejected(PolicyError.ORACLE_UPDATE_TOO_SOON, () -> submit(reading(1_010_000)));
            assertEquals(1_000_000L, engine.oracle().getIndexValue());
        }

        @Test
        @DisplayName("five minutes and one second later but only ten slots → SLOT_BUFFER_NOT_MET")
        void slotBuffer() {
            fx.admitOracle(1_000_000);
            fx.clock.advance(301, 10);

            assertRejected(PolicyError.SLOT_BUFFER_NOT_MET, () -> submit(reading(1_010_000)));
        }

        @Test
        @DisplayName("interval and buffer met exactly → admitted, baselines move")
        void exactBoundaries() {
            fx.admitOracle(1_000_000);
            GlobalState before = engine.globalState();
            fx.clock.advance(fx.parameters.minOracleIntervalSeconds(), fx.parameters.minSlotBuffer());

            OracleState state = submit(reading(1_020_000));

            assertEquals(1_020_000L, state.getIndexValue());
            assertEquals(2, state.getSnapshotCount());
            GlobalState after = engine.globalState();
            assertEquals(before.getLastOracleUpdateAt() + 300, after.getLastOracleUpdateAt());
            assertEquals(before.getLastOracleSlot() + 100, after.getLastOracleSlot());
        }
    }

    // ── validation ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("reading validation")
    class ValidationTests {

        @BeforeEach
        void passBuffers() {
            fx.clock.advance(300, 100);
        }

        @Test
        @DisplayName("each field outside its bounds is rejected with its own code")
        void bounds() {
            long now = fx.clock.now();
            long slot = fx.clock.slot();
            assertRejected(PolicyError.INVALID_INDEX_VALUE,
                () -> submit(new OracleReading(0, 450, 1_200, 1, now, slot)));
            assertRejected(PolicyError.INVALID_YIELD,
                () -> submit(new OracleReading(1, 10_001, 1_200, 1, now, slot)));
            assertRejected(PolicyError.INVALID_VOLATILITY,
                () -> submit(new OracleReading(1, 450, -1, 1, now, slot)));
            assertRejected(PolicyError.INVALID_TVL,
                () -> submit(new OracleReading(1, 450, 1_200, 0, now, slot)));
            assertFalse(engine.oracle().hasReading());
        }

        @Test
        @DisplayName("reading older than the staleness window → STALE_ORACLE_READING")
        void stale() {
            OracleReading old = new OracleReading(1_000_000, 450, 1_200, 1, fx.clock.now() - 901, fx.clock.slot());
            assertRejected(PolicyError.STALE_ORACLE_READING, () -> submit(old));
        }

        @Test
        @DisplayName("timestamp in the future → STALE_ORACLE_READING")
        void future() {
            OracleReading ahead = new OracleReading(1_000_000, 450, 1_200, 1, fx.clock.now() + 1, fx.clock.slot());
            assertRejected(PolicyError.STALE_ORACLE_READING, () -> submit(ahead));
        }

        @Test
        @DisplayName("slot beyond the current slot → STALE_ORACLE_READING")
        void slotAhead() {
            OracleReading ahead = new OracleReading(1_000_000, 450, 1_200, 1, fx.clock.now(), fx.clock.slot() + 1);
            assertRejected(PolicyError.STALE_ORACLE_READING, () -> submit(ahead));
        }

        @Test
        @DisplayName("extreme or non-positive timestamps do not wrap into the freshness window")
        void extremeTimestamps() {
            long slot = fx.clock.slot();
            for (long ts : new long[] {Long.MIN_VALUE, Long.MIN_VALUE + 1, -1, 0, Long.MAX_VALUE}) {
                OracleReading reading = new OracleReading(1_000_000, 450, 1_200, 1, ts, slot);
                assertRejected(PolicyError.STALE_ORACLE_READING, () -> submit(reading));
            }
            assertFalse(engine.oracle().hasReading());
        }

        @Test
        @DisplayName("negative slot → STALE_ORACLE_READING")
        void negativeSlot() {
            long now = fx.clock.now();
            assertRejected(PolicyError.STALE_ORACLE_READING,
                () -> submit(new OracleReading(1_000_000, 450, 1_200, 1, now, -5)));
            assertRejected(PolicyError.STALE_ORACLE_READING,
                () -> submit(new OracleReading(1_000_000, 450, 1_200, 1, now, Long.MIN_VALUE)));
            assertFalse(engine.oracle().hasReading());
        }

        @Test
        @DisplayName("submitter other than the oracle authority → UNAUTHORIZED")
        void unauthorized() {
            assertRejected(PolicyError.UNAUTHORIZED,
                () -> fx.as(AUTHORITY, engine.updateOracleCall(AUTHORITY, reading(1_000_000))));
        }

        @Test
        @DisplayName("missing reading → MALFORMED_PAYLOAD")
        void missing() {
            assertRejected(PolicyError.MALFORMED_PAYLOAD, () -> submit(null));
        }
    }

    @Test
    @DisplayName("admission emits ORACLE_UPDATED followed by a HEALTH_SIGNAL")
    void emitsEvents() {
        fx.admitOracle(1_000_000);

        List<GovernanceEvent> events = fx.events.events();
        GovernanceEvent last = events.get(events.size() - 1);
        GovernanceEvent oracle = events.get(events.size() - 2);
        assertEquals(GovernanceEventType.ORACLE_UPDATED, oracle.type());
        assertEquals(ORACLE, oracle.actor());
        assertEquals(GovernanceEventType.HEALTH_SIGNAL, last.type());
        assertEquals(false, last.attributes().get("oracleStale"));
    }
}
