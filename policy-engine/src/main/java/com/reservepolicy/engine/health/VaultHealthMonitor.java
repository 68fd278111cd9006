package com.reservepolicy.engine.health;

import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.health.VaultHealthCalculator;
import com.reservepolicy.common.health.VaultHealthReport;
import com.reservepolicy.engine.breaker.CircuitBreakerController;
import com.reservepolicy.engine.config.EngineParameters;
import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.state.OracleState;
import com.reservepolicy.engine.state.ReserveVault;
import com.reservepolicy.engine.substrate.InvocationContext;
import com.reservepolicy.engine.substrate.LedgerTransaction;
import com.reservepolicy.engine.substrate.LedgerView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recomputes the vault health ratio after every event that can move it
 * (oracle admission, reserve-affecting execution, deposit, withdraw, threshold
 * change) and passes the classification to the circuit breaker controller.
 *
 * <p>Signals only. Whether to halt stays an authority decision.
 */
@Component
public class VaultHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(VaultHealthMonitor.class);

    private final CircuitBreakerController breaker;
    private final EngineParameters parameters;

    public VaultHealthMonitor(CircuitBreakerController breaker, EngineParameters parameters) {
        this.breaker    = breaker;
        this.parameters = parameters;
    }

    public VaultHealthReport recompute(InvocationContext context) {
        LedgerTransaction ledger = context.ledger();
        GlobalState state  = ledger.globalState();
        ReserveVault vault = ledger.vault();
        VaultHealthReport report = evaluate(state, ledger.oracle(), vault, context.now());

        vault.recordHealth(report.vhrBps(), report.level());
        breaker.signal(context, report);
        log.debug("VHR recomputed. call={} vhrBps={} level={} stale={}",
                  context.callName(), report.vhrBps(), report.level(), report.oracleStale());
        return report;
    }

    /** Health of the committed state at {@code now}, without signalling. */
    public VaultHealthReport currentReport(LedgerView view, long now) {
        GlobalState state = view.globalState()
            .orElseThrow(() -> new PolicyEngineException(PolicyError.NOT_INITIALIZED));
        return evaluate(state, view.oracle(), view.vault(), now);
    }

    private VaultHealthReport evaluate(GlobalState state, OracleState oracle, ReserveVault vault, long now) {
        return VaultHealthCalculator.evaluate(
            vault.getReserveUnits(), oracle.getIndexValue(), vault.getLiabilities(),
            state.getVhrWarningBps(), state.getVhrCriticalBps(),
            isOracleStale(state, now), now);
    }

    boolean isOracleStale(GlobalState state, long now) {
        Long last = state.getLastOracleUpdateAt();
        return last == null || now - last > parameters.maxOracleStalenessSeconds();
    }
}
