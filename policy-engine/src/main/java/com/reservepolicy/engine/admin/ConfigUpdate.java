package com.reservepolicy.engine.admin;

/**
 * Full replacement of the authority-writable config fields.
 */
public record ConfigUpdate(
    long epochDurationSeconds,
    long mintBurnCapBps,
    long stabilityFeeBps,
    long vhrWarningBps,
    long vhrCriticalBps
) {}
