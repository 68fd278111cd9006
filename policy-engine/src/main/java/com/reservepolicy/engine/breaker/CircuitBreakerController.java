package com.reservepolicy.engine.breaker;

import com.reservepolicy.common.event.GovernanceEventType;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.health.VaultHealthReport;
import com.reservepolicy.common.model.BreakerPhase;
import com.reservepolicy.engine.auth.AgentAuthenticationGate;
import com.reservepolicy.engine.config.EngineParameters;
import com.reservepolicy.engine.state.BreakerState;
import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.substrate.InvocationContext;
import com.reservepolicy.engine.substrate.LedgerView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Two-step, authority-only emergency halt.
 *
 * <pre>
 *   IDLE ──request──▶ REQUESTED ──activate (after delay)──▶ ACTIVE
 *     ▲                   │                                  │
 *     └────deactivate─────┴──────────deactivate──────────────┘
 * </pre>
 *
 * <p>While ACTIVE, proposal creation, proposal execution and reserve withdrawals
 * are refused. Health advisories from the vault monitor are recorded next to the
 * phase but never move it.
 */
@Component
public class CircuitBreakerController {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerController.class);

    private final AgentAuthenticationGate gate;
    private final EngineParameters parameters;

    public CircuitBreakerController(AgentAuthenticationGate gate, EngineParameters parameters) {
        this.gate       = gate;
        this.parameters = parameters;
    }

    public BreakerState request(InvocationContext context, String agent) {
        GlobalState state = context.ledger().globalState();
        gate.authenticateRole(context, agent, state.getAuthority());

        BreakerState current = state.getBreaker();
        PolicyEngineException.require(current.phase() == BreakerPhase.IDLE,
            PolicyError.INVALID_BREAKER_TRANSITION, current.phase() + " -> REQUESTED");

        BreakerState next = current.requested(context.now());
        state.setBreaker(next);
        context.ledger().emit(GovernanceEventType.BREAKER_REQUESTED, agent, null,
            Map.of("requestedAt", context.now()));
        log.info("Circuit breaker requested. by={} at={}", agent, context.now());
        return next;
    }

    public BreakerState activate(InvocationContext context, String agent) {
        GlobalState state = context.ledger().globalState();
        gate.authenticateRole(context, agent, state.getAuthority());

        BreakerState current = state.getBreaker();
        PolicyEngineException.require(current.phase() == BreakerPhase.REQUESTED,
            PolicyError.INVALID_BREAKER_TRANSITION, current.phase() + " -> ACTIVE");
        long elapsed = context.now() - current.since();
        PolicyEngineException.require(elapsed >= parameters.circuitBreakerDelaySeconds(),
            PolicyError.CIRCUIT_BREAKER_TIMELOCK_NOT_MET,
            "elapsed=" + elapsed + "s required=" + parameters.circuitBreakerDelaySeconds() + "s");

        BreakerState next = current.activated(context.now());
        state.setBreaker(next);
        context.ledger().emit(GovernanceEventType.BREAKER_ACTIVATED, agent, null,
            Map.of("requestedAt", current.since(), "activatedAt", context.now()));
        log.warn("Circuit breaker ACTIVE. by={} requestedAt={} activatedAt={}",
                 agent, current.since(), context.now());
        return next;
    }

    /** Returns to IDLE with no delay, from ACTIVE or from a pending request. */
    public BreakerState deactivate(InvocationContext context, String agent) {
        GlobalState state = context.ledger().globalState();
        gate.authenticateRole(context, agent, state.getAuthority());

        BreakerState current = state.getBreaker();
        PolicyEngineException.require(current.phase() != BreakerPhase.IDLE,
            PolicyError.INVALID_BREAKER_TRANSITION, "IDLE -> IDLE");

        BreakerState next = current.reset();
        state.setBreaker(next);
        context.ledger().emit(GovernanceEventType.BREAKER_DEACTIVATED, agent, null,
            Map.of("previousPhase", current.phase().name()));
        log.info("Circuit breaker deactivated. by={} previousPhase={}", agent, current.phase());
        return next;
    }

    /** Records a health advisory. Never changes the phase. */
    public void signal(InvocationContext context, VaultHealthReport report) {
        GlobalState state = context.ledger().globalState();
        BreakerState current = state.getBreaker();
        state.setBreaker(current.withAdvisory(report.level(), context.now()));
        context.ledger().emit(GovernanceEventType.HEALTH_SIGNAL, null, null, Map.of(
            "level", report.level().name(),
            "previousLevel", current.advisory().name(),
            "vhrBps", report.vhrBps(),
            "oracleStale", report.oracleStale()));
        if (report.level() != current.advisory()) {
            log.info("Health advisory changed. {} -> {} vhrBps={} phase={}",
                     current.advisory(), report.level(), report.vhrBps(), current.phase());
        }
    }

    public void requireNotHalted(GlobalState state) {
        PolicyEngineException.require(!state.getBreaker().isActive(), PolicyError.CIRCUIT_BREAKER_ACTIVE);
    }

    public BreakerState current(LedgerView view) {
        return view.globalState()
            .map(GlobalState::getBreaker)
            .orElseThrow(() -> new PolicyEngineException(PolicyError.NOT_INITIALIZED));
    }
}
