package com.reservepolicy.common.model;

/**
 * Solvency classification of the reserve vault against the configured VHR thresholds.
 */
public enum HealthLevel {
    HEALTHY,
    WARNING,
    CRITICAL
}
