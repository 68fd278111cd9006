package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservepolicy.common.model.HealthLevel;
import com.reservepolicy.engine.state.ReserveVault;

import java.util.Map;

public record VaultView(
    @JsonProperty("reserveUnits")     long reserveUnits,
    @JsonProperty("liabilities")      long liabilities,
    @JsonProperty("lastVhrBps")       long lastVhrBps,
    @JsonProperty("lastHealth")       HealthLevel lastHealth,
    @JsonProperty("targetWeightsBps") Map<String, Integer> targetWeightsBps,
    @JsonProperty("lastRebalanceAt")  Long lastRebalanceAt
) {
    public static VaultView from(ReserveVault v) {
        return new VaultView(v.getReserveUnits(), v.getLiabilities(), v.getLastVhrBps(), v.getLastHealth(),
            v.getTargetWeightsBps(), v.getLastRebalanceAt());
    }
}
