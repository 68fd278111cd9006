package com.reservepolicy.common.health;

import com.reservepolicy.common.model.HealthLevel;

import java.math.BigInteger;

/**
 * Pure vault health arithmetic.
 *
 * <pre>
 *   reserveValue = reserveUnits × indexValue / 1e6
 *   vhrBps       = reserveValue × 10000 / liabilities
 *
 *   vhrBps &lt; criticalBps → CRITICAL
 *   vhrBps &lt; warningBps  → WARNING
 *   otherwise             → HEALTHY
 * </pre>
 *
 * <p>Values that cannot be represented as a {@code long} saturate at
 * {@link Long#MAX_VALUE}; they are never wrapped.
 */
public final class VaultHealthCalculator {

    public static final long INDEX_SCALE = 1_000_000L;

    /** Ratio reported when the vault has no liabilities. */
    public static final long UNBOUNDED_VHR = Long.MAX_VALUE;

    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);
    private static final BigInteger BPS      = BigInteger.valueOf(10_000L);

    private VaultHealthCalculator() {}

    public static long reserveValue(long reserveUnits, long indexValue) {
        if (reserveUnits <= 0 || indexValue <= 0) {
            return 0L;
        }
        BigInteger value = BigInteger.valueOf(reserveUnits)
            .multiply(BigInteger.valueOf(indexValue))
            .divide(BigInteger.valueOf(INDEX_SCALE));
        return saturate(value);
    }

    public static long vhrBps(long reserveValue, long liabilities) {
        if (liabilities <= 0) {
            return UNBOUNDED_VHR;
        }
        BigInteger ratio = BigInteger.valueOf(Math.max(0L, reserveValue))
            .multiply(BPS)
            .divide(BigInteger.valueOf(liabilities));
        return saturate(ratio);
    }

    public static HealthLevel classify(long vhrBps, long warningBps, long criticalBps) {
        if (vhrBps < criticalBps) return HealthLevel.CRITICAL;
        if (vhrBps < warningBps)  return HealthLevel.WARNING;
        return HealthLevel.HEALTHY;
    }

    public static VaultHealthReport evaluate(long reserveUnits, long indexValue, long liabilities,
                                             long warningBps, long criticalBps,
                                             boolean oracleStale, long now) {
        long value = reserveValue(reserveUnits, indexValue);
        long vhr   = vhrBps(value, liabilities);
        return new VaultHealthReport(value, liabilities, vhr,
            classify(vhr, warningBps, criticalBps), oracleStale, now);
    }

    private static long saturate(BigInteger value) {
        return value.compareTo(LONG_MAX) > 0 ? Long.MAX_VALUE : value.longValue();
    }
}
