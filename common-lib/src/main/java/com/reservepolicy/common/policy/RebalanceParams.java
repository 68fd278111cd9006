package com.reservepolicy.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.model.PolicyType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Replace the reserve vault's target asset weights.
 *
 * <p>Schema: 1..{@value #MAX_ASSETS} assets, non-blank asset ids, each weight in
 * [0, 10000] bps, weights summing to exactly 10000 bps.
 */
public record RebalanceParams(
    @JsonProperty("targetWeightsBps") Map<String, Integer> targetWeightsBps
) implements PolicyParams {

    public static final int MAX_ASSETS = 16;
    public static final int FULL_WEIGHT_BPS = 10_000;

    public RebalanceParams {
        // null ids and weights survive the copy so validate() can reject them
        targetWeightsBps = targetWeightsBps == null ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(targetWeightsBps));
    }

    @Override
    public PolicyType policyType() {
        return PolicyType.REBALANCE;
    }

    @Override
    public void validate() {
        PolicyEngineException.require(targetWeightsBps != null && !targetWeightsBps.isEmpty(),
            PolicyError.MALFORMED_PAYLOAD, "at least one target weight is required");
        PolicyEngineException.require(targetWeightsBps.size() <= MAX_ASSETS,
            PolicyError.MALFORMED_PAYLOAD, "too many assets: " + targetWeightsBps.size());

        long total = 0;
        for (Map.Entry<String, Integer> e : targetWeightsBps.entrySet()) {
            PolicyEngineException.require(e.getKey() != null && !e.getKey().isBlank(),
                PolicyError.MALFORMED_PAYLOAD, "asset id is required");
            Integer weight = e.getValue();
            PolicyEngineException.require(weight != null && weight >= 0 && weight <= FULL_WEIGHT_BPS,
                PolicyError.MALFORMED_PAYLOAD, "weight out of range for " + e.getKey());
            total += weight;
        }
        PolicyEngineException.require(total == FULL_WEIGHT_BPS,
            PolicyError.MALFORMED_PAYLOAD, "weights sum to " + total + " bps, expected " + FULL_WEIGHT_BPS);
    }

    @Override
    public Map<String, Object> signingFields() {
        return Map.of("type", policyType().name(),
            "targetWeightsBps", targetWeightsBps == null ? Map.of() : targetWeightsBps);
    }
}
