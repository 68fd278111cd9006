package com.reservepolicy.common.model;

import com.reservepolicy.common.exception.PolicyError;

/**
 * Global configuration fields that a {@code PARAMETER_UPDATE} policy may rewrite,
 * each with its own inclusive bounds and rejection code.
 *
 * <p>Cross-field rules (warning threshold above critical) are checked when the
 * update is applied, because they depend on the current value of the other field.
 */
public enum ConfigParameter {

    EPOCH_DURATION_SECONDS(1, 31_536_000L, PolicyError.INVALID_EPOCH_DURATION),
    MINT_BURN_CAP_BPS(0, 10_000, PolicyError.INVALID_MINT_BURN_CAP),
    STABILITY_FEE_BPS(0, 10_000, PolicyError.INVALID_STABILITY_FEE),
    VHR_WARNING_BPS(10_000, 100_000, PolicyError.INVALID_VHR_THRESHOLD),
    VHR_CRITICAL_BPS(10_000, 100_000, PolicyError.INVALID_VHR_THRESHOLD);

    private final long min;
    private final long max;
    private final PolicyError violation;

    ConfigParameter(long min, long max, PolicyError violation) {
        this.min       = min;
        this.max       = max;
        this.violation = violation;
    }

    public boolean accepts(long value) {
        return value >= min && value <= max;
    }

    public long min() {
        return min;
    }

    public long max() {
        return max;
    }

    public PolicyError violation() {
        return violation;
    }
}
