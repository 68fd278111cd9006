package com.reservepolicy.engine.substrate;

/**
 * A named engine entry point bound to its arguments, ready to run inside a submission.
 *
 * @param name   entry point name, used in logs
 * @param action the call body
 */
public record EngineCall<T>(String name, EngineAction<T> action) implements SubmissionStep {
}
