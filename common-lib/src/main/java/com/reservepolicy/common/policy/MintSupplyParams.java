package com.reservepolicy.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.model.PolicyType;

import java.util.Map;

/**
 * Mint new reserve tokens to {@code recipient}. Amount is 1e6-scaled USD.
 */
public record MintSupplyParams(
    @JsonProperty("amount")    long amount,
    @JsonProperty("recipient") String recipient
) implements PolicyParams {

    @Override
    public PolicyType policyType() {
        return PolicyType.MINT_SUPPLY;
    }

    @Override
    public void validate() {
        PolicyEngineException.require(amount > 0, PolicyError.MALFORMED_PAYLOAD, "mint amount must be positive");
        PolicyEngineException.require(recipient != null && !recipient.isBlank(),
            PolicyError.MALFORMED_PAYLOAD, "mint recipient is required");
    }

    @Override
    public Map<String, Object> signingFields() {
        return Map.of("type", policyType().name(), "amount", amount, "recipient", String.valueOf(recipient));
    }
}
