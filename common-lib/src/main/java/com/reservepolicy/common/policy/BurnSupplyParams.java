package com.reservepolicy.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.model.PolicyType;

import java.util.Map;

/**
 * Burn reserve tokens held by {@code source}. Amount is 1e6-scaled USD.
 */
public record BurnSupplyParams(
    @JsonProperty("amount") long amount,
    @JsonProperty("source") String source
) implements PolicyParams {

    @Override
    public PolicyType policyType() {
        return PolicyType.BURN_SUPPLY;
    }

    @Override
    public void validate() {
        PolicyEngineException.require(amount > 0, PolicyError.MALFORMED_PAYLOAD, "burn amount must be positive");
        PolicyEngineException.require(source != null && !source.isBlank(),
            PolicyError.MALFORMED_PAYLOAD, "burn source is required");
    }

    @Override
    public Map<String, Object> signingFields() {
        return Map.of("type", policyType().name(), "amount", amount, "source", String.valueOf(source));
    }
}
