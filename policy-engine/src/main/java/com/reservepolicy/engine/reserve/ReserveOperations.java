package com.reservepolicy.engine.reserve;

import com.reservepolicy.common.event.GovernanceEventType;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.health.VaultHealthCalculator;
import com.reservepolicy.common.policy.RebalanceParams;
import com.reservepolicy.engine.auth.AgentAuthenticationGate;
import com.reservepolicy.engine.breaker.CircuitBreakerController;
import com.reservepolicy.engine.health.VaultHealthMonitor;
import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.state.ReserveVault;
import com.reservepolicy.engine.substrate.InvocationContext;
import com.reservepolicy.engine.substrate.LedgerTransaction;
import com.reservepolicy.engine.substrate.LedgerView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Direct movements of the reserve vault.
 *
 * <p>Deposits are open to any authenticated agent. Withdrawals are authority-only,
 * refused while the breaker is ACTIVE, and may not leave the vault below the
 * critical VHR threshold while liabilities are outstanding.
 */
@Component
public class ReserveOperations {

    private static final Logger log = LoggerFactory.getLogger(ReserveOperations.class);

    private final AgentAuthenticationGate gate;
    private final CircuitBreakerController breaker;
    private final VaultHealthMonitor healthMonitor;

    public ReserveOperations(AgentAuthenticationGate gate, CircuitBreakerController breaker,
                             VaultHealthMonitor healthMonitor) {
        this.gate          = gate;
        this.breaker       = breaker;
        this.healthMonitor = healthMonitor;
    }

    public ReserveVault deposit(InvocationContext context, String agent, long units) {
        gate.authenticate(context, agent);
        LedgerTransaction ledger = context.ledger();
        ledger.globalState();
        PolicyEngineException.require(units > 0, PolicyError.INVALID_AMOUNT, "units=" + units);

        ReserveVault vault = ledger.vault();
        vault.deposit(units);
        ledger.emit(GovernanceEventType.RESERVE_DEPOSIT, agent, null, Map.of(
            "units", units, "reserveUnits", vault.getReserveUnits()));
        log.info("Reserve deposit. agent={} units={} reserveUnits={}", agent, units, vault.getReserveUnits());

        healthMonitor.recompute(context);
        return vault.copy();
    }

    public ReserveVault withdraw(InvocationContext context, String agent, long units) {
        LedgerTransaction ledger = context.ledger();
        GlobalState state = ledger.globalState();
        gate.authenticateRole(context, agent, state.getAuthority());
        breaker.requireNotHalted(state);
        PolicyEngineException.require(units > 0, PolicyError.INVALID_AMOUNT, "units=" + units);

        ReserveVault vault = ledger.vault();
        PolicyEngineException.require(units <= vault.getReserveUnits(), PolicyError.INSUFFICIENT_VAULT_BALANCE,
            "units=" + units + " available=" + vault.getReserveUnits());
        vault.withdraw(units);

        if (vault.getLiabilities() > 0) {
            long value = VaultHealthCalculator.reserveValue(vault.getReserveUnits(), ledger.oracle().getIndexValue());
            long vhr   = VaultHealthCalculator.vhrBps(value, vault.getLiabilities());
            PolicyEngineException.require(vhr >= state.getVhrCriticalBps(), PolicyError.VHR_BELOW_THRESHOLD,
                "vhrBps=" + vhr + " criticalBps=" + state.getVhrCriticalBps());
        }

        ledger.emit(GovernanceEventType.RESERVE_WITHDRAWAL, agent, null, Map.of(
            "units", units, "reserveUnits", vault.getReserveUnits()));
        log.info("Reserve withdrawal. agent={} units={} reserveUnits={}", agent, units, vault.getReserveUnits());

        healthMonitor.recompute(context);
        return vault.copy();
    }

    public ReserveVault rebalance(InvocationContext context, String agent, Map<String, Integer> targetWeightsBps) {
        LedgerTransaction ledger = context.ledger();
        GlobalState state = ledger.globalState();
        gate.authenticateRole(context, agent, state.getAuthority());
        new RebalanceParams(targetWeightsBps).validate();

        ReserveVault vault = ledger.vault();
        vault.rebalance(targetWeightsBps, context.now());
        ledger.emit(GovernanceEventType.RESERVE_REBALANCED, agent, null, Map.of(
            "assets", targetWeightsBps.size()));
        log.info("Reserve rebalanced. agent={} assets={}", agent, targetWeightsBps.size());
        return vault.copy();
    }

    public ReserveVault current(LedgerView view) {
        return view.vault();
    }
}
