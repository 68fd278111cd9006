package com.reservepolicy.common.exception;

/**
 * Raised by any engine entry point that rejects a call.
 *
 * <p>The substrate treats every instance as an abort signal: nothing the failing
 * submission staged is committed.
 */
public class PolicyEngineException extends RuntimeException {

    private final PolicyError error;

    public PolicyEngineException(PolicyError error) {
        super(error.name() + ": " + error.message());
        this.error = error;
    }

    public PolicyEngineException(PolicyError error, String detail) {
        super(error.name() + ": " + error.message() + " (" + detail + ")");
        this.error = error;
    }

    public PolicyEngineException(PolicyError error, String detail, Throwable cause) {
        super(error.name() + ": " + error.message() + " (" + detail + ")", cause);
        this.error = error;
    }

    public PolicyError getError() {
        return error;
    }

    public ErrorCategory getCategory() {
        return error.category();
    }

    /** Throws {@code error} unless {@code condition} holds. */
    public static void require(boolean condition, PolicyError error) {
        if (!condition) {
            throw new PolicyEngineException(error);
        }
    }

    public static void require(boolean condition, PolicyError error, String detail) {
        if (!condition) {
            throw new PolicyEngineException(error, detail);
        }
    }
}
