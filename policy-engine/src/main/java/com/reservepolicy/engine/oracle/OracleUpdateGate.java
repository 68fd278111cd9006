package com.reservepolicy.engine.oracle;

import com.reservepolicy.common.event.GovernanceEventType;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.model.OracleReading;
import com.reservepolicy.engine.auth.AgentAuthenticationGate;
import com.reservepolicy.engine.config.EngineParameters;
import com.reservepolicy.engine.health.VaultHealthMonitor;
import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.state.OracleState;
import com.reservepolicy.engine.substrate.InvocationContext;
import com.reservepolicy.engine.substrate.LedgerTransaction;
import com.reservepolicy.engine.substrate.LedgerView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Admits oracle readings from the pinned oracle authority.
 *
 * <p>Checks run in a fixed order: field bounds, reading freshness, minimum time
 * since the last admitted update, minimum slots since the last admitted update.
 * Time and slot deltas use the submission's engine clock, not the feed-reported
 * values. Before the first admission the slot baseline is the initialization slot
 * and there is no time baseline.
 */
@Component
public class OracleUpdateGate {

    private static final Logger log = LoggerFactory.getLogger(OracleUpdateGate.class);

    private final AgentAuthenticationGate gate;
    private final VaultHealthMonitor healthMonitor;
    private final EngineParameters parameters;

    public OracleUpdateGate(AgentAuthenticationGate gate, VaultHealthMonitor healthMonitor,
                            EngineParameters parameters) {
        this.gate          = gate;
        this.healthMonitor = healthMonitor;
        this.parameters    = parameters;
    }

    public OracleState update(InvocationContext context, String agent, OracleReading reading) {
        LedgerTransaction ledger = context.ledger();
        GlobalState state = ledger.globalState();
        gate.authenticateRole(context, agent, state.getOracleAuthority());
        PolicyEngineException.require(reading != null, PolicyError.MALFORMED_PAYLOAD, "reading is required");

        validateBounds(reading);
        validateFreshness(reading, context.now(), context.slot());

        Long lastAt = state.getLastOracleUpdateAt();
        if (lastAt != null) {
            long elapsed = context.now() - lastAt;
            PolicyEngineException.require(elapsed >= parameters.minOracleIntervalSeconds(),
                PolicyError.ORACLE_UPDATE_TOO_SOON,
                "elapsed=" + elapsed + "s required=" + parameters.minOracleIntervalSeconds() + "s");
        }
        long slots = context.slot() - state.getLastOracleSlot();
        PolicyEngineException.require(slots >= parameters.minSlotBuffer(), PolicyError.SLOT_BUFFER_NOT_MET,
            "slots=" + slots + " required=" + parameters.minSlotBuffer());

        OracleState oracle = ledger.oracle();
        oracle.accept(reading);
        state.recordOracleUpdate(context.now(), context.slot());

        ledger.emit(GovernanceEventType.ORACLE_UPDATED, agent, null, Map.of(
            "indexValue", reading.indexValue(),
            "avgYieldBps", reading.avgYieldBps(),
            "volatilityBps", reading.volatilityBps(),
            "tvlUsd", reading.tvlUsd()));
        log.info("Oracle update admitted. index={} yieldBps={} volBps={} tvl={} slot={} snapshots={}",
                 reading.indexValue(), reading.avgYieldBps(), reading.volatilityBps(), reading.tvlUsd(),
                 context.slot(), oracle.getSnapshotCount());

        healthMonitor.recompute(context);
        return oracle.copy();
    }

    public OracleState current(LedgerView view) {
        return view.oracle();
    }

    private void validateBounds(OracleReading reading) {
        PolicyEngineException.require(reading.indexValue() > 0 && reading.indexValue() <= parameters.maxIndexValue(),
            PolicyError.INVALID_INDEX_VALUE, "indexValue=" + reading.indexValue());
        PolicyEngineException.require(reading.avgYieldBps() >= 0 && reading.avgYieldBps() <= parameters.maxYieldBps(),
            PolicyError.INVALID_YIELD, "avgYieldBps=" + reading.avgYieldBps());
        PolicyEngineException.require(reading.volatilityBps() >= 0 && reading.volatilityBps() <= parameters.maxVolatilityBps(),
            PolicyError.INVALID_VOLATILITY, "volatilityBps=" + reading.volatilityBps());
        PolicyEngineException.require(reading.tvlUsd() > 0 && reading.tvlUsd() <= parameters.maxTvlUsd(),
            PolicyError.INVALID_TVL, "tvlUsd=" + reading.tvlUsd());
    }

    private void validateFreshness(OracleReading reading, long now, long slot) {
        // compared as bounds so an extreme reported timestamp cannot wrap
        long oldest = now - parameters.maxOracleStalenessSeconds();
        PolicyEngineException.require(reading.timestamp() > 0
                && reading.timestamp() >= oldest && reading.timestamp() <= now,
            PolicyError.STALE_ORACLE_READING, "timestamp=" + reading.timestamp() + " now=" + now);
        PolicyEngineException.require(reading.slot() >= 0 && reading.slot() <= slot,
            PolicyError.STALE_ORACLE_READING, "slot=" + reading.slot() + " current=" + slot);
    }
}
