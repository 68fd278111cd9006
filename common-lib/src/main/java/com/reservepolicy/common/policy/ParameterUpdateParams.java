package com.reservepolicy.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.model.ConfigParameter;
import com.reservepolicy.common.model.PolicyType;

import java.util.Map;

/**
 * Rewrite a single global configuration field.
 * The value must sit inside the parameter's own bounds.
 */
public record ParameterUpdateParams(
    @JsonProperty("parameter") ConfigParameter parameter,
    @JsonProperty("value")     long value
) implements PolicyParams {

    @Override
    public PolicyType policyType() {
        return PolicyType.PARAMETER_UPDATE;
    }

    @Override
    public void validate() {
        PolicyEngineException.require(parameter != null, PolicyError.MALFORMED_PAYLOAD, "parameter is required");
        PolicyEngineException.require(parameter.accepts(value), PolicyError.MALFORMED_PAYLOAD,
            parameter + "=" + value + " outside [" + parameter.min() + ", " + parameter.max() + "]");
    }

    @Override
    public Map<String, Object> signingFields() {
        return Map.of("type", policyType().name(), "parameter", String.valueOf(parameter), "value", value);
    }
}
