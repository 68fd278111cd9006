package com.reservepolicy.engine.admin;

/**
 * Arguments of the one-time initialization. {@code authority} is the signer.
 */
public record ProtocolSettings(
    String authority,
    String oracleAuthority,
    String settlementAuthority,
    String reserveVault,
    String tokenMint,
    long epochDurationSeconds,
    long mintBurnCapBps,
    long stabilityFeeBps,
    long vhrWarningBps,
    long vhrCriticalBps
) {}
