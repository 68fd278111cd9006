package com.reservepolicy.common.exception;

/**
 * Failure class of a rejected engine call.
 *
 * <p>Every category is fatal for the submission that raised it: the execution
 * substrate discards all staged writes. The category only tells the caller
 * whether a later resubmission can succeed.
 *
 * <ul>
 *   <li>{@link #AUTHENTICATION}: signature step missing or reporting another key</li>
 *   <li>{@link #AUTHORIZATION}: authenticated caller lacks the required role</li>
 *   <li>{@link #VALIDATION}: malformed input, out-of-bounds field, duplicate key</li>
 *   <li>{@link #TEMPORAL}: a window or delay has not elapsed yet; retry later</li>
 *   <li>{@link #ARITHMETIC}: an unrepresentable total</li>
 *   <li>{@link #STATE}: the call is not legal in the current lifecycle state</li>
 * </ul>
 */
public enum ErrorCategory {
    AUTHENTICATION,
    AUTHORIZATION,
    VALIDATION,
    TEMPORAL,
    ARITHMETIC,
    STATE
}
