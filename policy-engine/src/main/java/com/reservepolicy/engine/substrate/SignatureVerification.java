package com.reservepolicy.engine.substrate;

/**
 * Outcome of a detached-signature check performed before the submission reached
 * the engine. The engine trusts it: it only compares {@code publicKey} with the
 * identity the next call claims, and {@code nonce} with the agent's last nonce.
 */
public record SignatureVerification(String publicKey, long nonce) implements SubmissionStep {
}
