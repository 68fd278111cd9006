package com.reservepolicy.common.math;

import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.model.StakeWeighting;

import java.math.BigInteger;

/**
 * Checked stake arithmetic.
 *
 * <p>Accumulators are non-negative {@code long}s. Additions fail with
 * {@code ARITHMETIC_OVERFLOW} instead of wrapping; every product and ratio is
 * computed through a {@link BigInteger} intermediate so that only a truly
 * unrepresentable final value can fail.
 *
 * <p>No logging, no state. Thread-safe.
 */
public final class StakeMath {

    public static final long BPS_DENOMINATOR = 10_000L;

    /** Yes share (bps) a proposal must strictly exceed to pass. */
    public static final long PASS_THRESHOLD_BPS = 5_000L;

    private static final BigInteger BPS = BigInteger.valueOf(BPS_DENOMINATOR);

    private StakeMath() {}

    public static long checkedAdd(long a, long b) {
        requireNonNegative(a);
        requireNonNegative(b);
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new PolicyEngineException(PolicyError.ARITHMETIC_OVERFLOW, a + " + " + b, e);
        }
    }

    public static long checkedSub(long a, long b) {
        requireNonNegative(a);
        requireNonNegative(b);
        if (b > a) {
            throw new PolicyEngineException(PolicyError.ARITHMETIC_UNDERFLOW, a + " - " + b);
        }
        return a - b;
    }

    /**
     * {@code yes * 10000 / (yes + no)}, truncated. Zero when no stake was cast.
     * The sum and the product never leave {@link BigInteger}, so any pair of
     * non-negative {@code long}s is accepted.
     */
    public static long yesRatioBps(long yesStake, long noStake) {
        requireNonNegative(yesStake);
        requireNonNegative(noStake);
        BigInteger total = BigInteger.valueOf(yesStake).add(BigInteger.valueOf(noStake));
        if (total.signum() == 0) {
            return 0L;
        }
        return BigInteger.valueOf(yesStake).multiply(BPS).divide(total).longValueExact();
    }

    public static boolean passes(long ratioBps) {
        return ratioBps > PASS_THRESHOLD_BPS;
    }

    /** {@code amount * bps / 10000}, truncated; {@code bps} must be within [0, 10000]. */
    public static long applyBps(long amount, long bps) {
        requireNonNegative(amount);
        if (bps < 0 || bps > BPS_DENOMINATOR) {
            throw new PolicyEngineException(PolicyError.ARITHMETIC_OVERFLOW, "bps out of range: " + bps);
        }
        return BigInteger.valueOf(amount).multiply(BigInteger.valueOf(bps)).divide(BPS).longValueExact();
    }

    /**
     * Amount credited to the yes/no total for a stake.
     *
     * @throws PolicyEngineException {@code INVALID_STAKE_AMOUNT} when stake is not positive
     */
    public static long votingPower(long stake, StakeWeighting weighting) {
        PolicyEngineException.require(stake > 0, PolicyError.INVALID_STAKE_AMOUNT);
        return switch (weighting) {
            case LINEAR    -> stake;
            case QUADRATIC -> Math.max(1L, integerSqrt(stake));
        };
    }

    /** Floor of the square root of a non-negative value. */
    public static long integerSqrt(long value) {
        requireNonNegative(value);
        return BigInteger.valueOf(value).sqrt().longValueExact();
    }

    private static void requireNonNegative(long value) {
        if (value < 0) {
            throw new PolicyEngineException(PolicyError.ARITHMETIC_UNDERFLOW, "negative operand " + value);
        }
    }
}
