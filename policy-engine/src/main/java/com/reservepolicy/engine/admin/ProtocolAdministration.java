package com.reservepolicy.engine.admin;

import com.reservepolicy.common.event.GovernanceEventType;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.engine.auth.AgentAuthenticationGate;
import com.reservepolicy.engine.health.VaultHealthMonitor;
import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.substrate.InvocationContext;
import com.reservepolicy.engine.substrate.LedgerTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Creates the protocol singleton exactly once and lets the authority rewrite
 * its config fields afterwards.
 */
@Component
public class ProtocolAdministration {

    private static final Logger log = LoggerFactory.getLogger(ProtocolAdministration.class);

    private final AgentAuthenticationGate gate;
    private final VaultHealthMonitor healthMonitor;

    public ProtocolAdministration(AgentAuthenticationGate gate, VaultHealthMonitor healthMonitor) {
        this.gate          = gate;
        this.healthMonitor = healthMonitor;
    }

    public GlobalState initialize(InvocationContext context, ProtocolSettings settings) {
        gate.authenticate(context, settings.authority());
        LedgerTransaction ledger = context.ledger();
        PolicyEngineException.require(!ledger.isInitialized(), PolicyError.ALREADY_INITIALIZED);

        requireReference(settings.oracleAuthority(), "oracleAuthority", PolicyError.MALFORMED_PAYLOAD);
        requireReference(settings.settlementAuthority(), "settlementAuthority", PolicyError.MALFORMED_PAYLOAD);
        requireReference(settings.reserveVault(), "reserveVault", PolicyError.INVALID_RESERVE_VAULT);
        requireReference(settings.tokenMint(), "tokenMint", PolicyError.INVALID_RESERVE_VAULT);
        PolicyEngineException.require(!settings.reserveVault().equals(settings.tokenMint()),
            PolicyError.INVALID_RESERVE_VAULT, "reserve vault and token mint must differ");

        GlobalState state = new GlobalState(
            settings.authority(), settings.oracleAuthority(), settings.settlementAuthority(),
            settings.reserveVault(), settings.tokenMint(),
            settings.epochDurationSeconds(), settings.mintBurnCapBps(), settings.stabilityFeeBps(),
            settings.vhrWarningBps(), settings.vhrCriticalBps(),
            context.now(), context.slot());
        ledger.createGlobalState(state);

        ledger.emit(GovernanceEventType.PROTOCOL_INITIALIZED, settings.authority(), null, Map.of(
            "reserveVault", settings.reserveVault(),
            "tokenMint", settings.tokenMint(),
            "mintBurnCapBps", settings.mintBurnCapBps(),
            "vhrWarningBps", settings.vhrWarningBps(),
            "vhrCriticalBps", settings.vhrCriticalBps()));
        log.info("Protocol initialized. authority={} oracle={} vault={} mint={} slot={}",
                 settings.authority(), settings.oracleAuthority(), settings.reserveVault(),
                 settings.tokenMint(), context.slot());
        return state.copy();
    }

    public GlobalState updateConfig(InvocationContext context, String agent, ConfigUpdate update) {
        GlobalState state = context.ledger().globalState();
        gate.authenticateRole(context, agent, state.getAuthority());

        state.applyConfig(update.epochDurationSeconds(), update.mintBurnCapBps(), update.stabilityFeeBps(),
            update.vhrWarningBps(), update.vhrCriticalBps());
        context.ledger().emit(GovernanceEventType.CONFIG_UPDATED, agent, null, Map.of(
            "epochDurationSeconds", update.epochDurationSeconds(),
            "mintBurnCapBps", update.mintBurnCapBps(),
            "stabilityFeeBps", update.stabilityFeeBps(),
            "vhrWarningBps", update.vhrWarningBps(),
            "vhrCriticalBps", update.vhrCriticalBps()));
        log.info("Config updated. by={} capBps={} feeBps={} warnBps={} critBps={}",
                 agent, update.mintBurnCapBps(), update.stabilityFeeBps(),
                 update.vhrWarningBps(), update.vhrCriticalBps());

        // thresholds may have moved
        healthMonitor.recompute(context);
        return state.copy();
    }

    private static void requireReference(String value, String name, PolicyError error) {
        PolicyEngineException.require(value != null && !value.isBlank(), error, name + " is required");
    }
}
