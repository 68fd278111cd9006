package com.reservepolicy.engine.governance;

import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.health.VaultHealthCalculator;
import com.reservepolicy.common.math.StakeMath;
import com.reservepolicy.common.policy.BurnSupplyParams;
import com.reservepolicy.common.policy.MintSupplyParams;
import com.reservepolicy.common.policy.ParameterUpdateParams;
import com.reservepolicy.common.policy.PolicyParams;
import com.reservepolicy.common.policy.RebalanceParams;
import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.state.ReserveVault;
import com.reservepolicy.engine.substrate.InvocationContext;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Applies the effect of a passed policy payload to the staged ledger.
 *
 * <ul>
 *   <li>MINT_SUPPLY: raises liabilities, bounded by the mint/burn cap of the current reserve value</li>
 *   <li>BURN_SUPPLY: lowers liabilities, bounded by the cap of the outstanding liabilities</li>
 *   <li>REBALANCE: replaces the vault's target weights</li>
 *   <li>PARAMETER_UPDATE: rewrites one config field within its bounds</li>
 * </ul>
 *
 * Returns the attributes recorded on the execution event.
 */
@Component
public class PolicyExecutor {

    public Map<String, Object> apply(InvocationContext context, GlobalState state, PolicyParams params) {
        if (params instanceof MintSupplyParams mint) {
            return mint(context, state, mint);
        }
        if (params instanceof BurnSupplyParams burn) {
            return burn(context, state, burn);
        }
        if (params instanceof RebalanceParams rebalance) {
            context.ledger().vault().rebalance(rebalance.targetWeightsBps(), context.now());
            return Map.of("assets", rebalance.targetWeightsBps().size());
        }
        if (params instanceof ParameterUpdateParams update) {
            long previous = state.configValue(update.parameter());
            state.applyParameter(update.parameter(), update.value());
            return Map.of("parameter", update.parameter().name(), "previous", previous, "value", update.value());
        }
        throw new PolicyEngineException(PolicyError.MALFORMED_PAYLOAD,
            "unsupported payload " + params.getClass().getSimpleName());
    }

    private Map<String, Object> mint(InvocationContext context, GlobalState state, MintSupplyParams mint) {
        ReserveVault vault = context.ledger().vault();
        long reserveValue = VaultHealthCalculator.reserveValue(
            vault.getReserveUnits(), context.ledger().oracle().getIndexValue());
        long cap = StakeMath.applyBps(reserveValue, state.getMintBurnCapBps());
        PolicyEngineException.require(mint.amount() <= cap, PolicyError.MINT_BURN_CAP_EXCEEDED,
            "amount=" + mint.amount() + " cap=" + cap);

        vault.increaseLiabilities(mint.amount());
        return Map.of("amount", mint.amount(), "recipient", mint.recipient(), "liabilities", vault.getLiabilities());
    }

    private Map<String, Object> burn(InvocationContext context, GlobalState state, BurnSupplyParams burn) {
        ReserveVault vault = context.ledger().vault();
        long cap = StakeMath.applyBps(vault.getLiabilities(), state.getMintBurnCapBps());
        PolicyEngineException.require(burn.amount() <= cap, PolicyError.MINT_BURN_CAP_EXCEEDED,
            "amount=" + burn.amount() + " cap=" + cap);

        vault.decreaseLiabilities(burn.amount());
        return Map.of("amount", burn.amount(), "source", burn.source(), "liabilities", vault.getLiabilities());
    }
}
