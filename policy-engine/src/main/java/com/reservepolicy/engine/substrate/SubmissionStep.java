package com.reservepolicy.engine.substrate;

/**
 * One ordered element of an atomic {@link Submission}: either a detached-signature
 * verification result or an engine call.
 */
public interface SubmissionStep {
}
