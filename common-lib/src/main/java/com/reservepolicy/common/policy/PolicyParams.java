package com.reservepolicy.common.policy;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.reservepolicy.common.model.PolicyType;

import java.util.Map;

/**
 * Typed payload of a policy proposal, one variant per {@link PolicyType}.
 *
 * <p>Variants validate their own schema through {@link #validate()}. The proposal
 * registry calls it at creation time, so a malformed payload never reaches the
 * voting stage. On the wire the variant is selected by the {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = MintSupplyParams.class,      name = "MINT_SUPPLY"),
    @JsonSubTypes.Type(value = BurnSupplyParams.class,      name = "BURN_SUPPLY"),
    @JsonSubTypes.Type(value = RebalanceParams.class,       name = "REBALANCE"),
    @JsonSubTypes.Type(value = ParameterUpdateParams.class, name = "PARAMETER_UPDATE")
})
public interface PolicyParams {

    PolicyType policyType();

    /**
     * @throws com.reservepolicy.common.exception.PolicyEngineException with
     *         {@code MALFORMED_PAYLOAD} when the payload violates its schema
     */
    void validate();

    /**
     * Payload fields as they appear in the canonical signed message of a
     * create-proposal call. Keys never collide with the call's own fields.
     */
    Map<String, Object> signingFields();
}
