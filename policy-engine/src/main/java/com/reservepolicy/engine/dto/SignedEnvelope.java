package com.reservepolicy.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Detached signature attached to every mutating request.
 *
 * <ul>
 *   <li>{@code publicKey}: Base64 raw Ed25519 key; this is the caller's identity</li>
 *   <li>{@code signature}: Base64 signature over the canonical action message</li>
 *   <li>{@code timestamp}: unix seconds at signing, part of the signed message</li>
 *   <li>{@code nonce}: strictly increasing per agent, part of the signed message</li>
 * </ul>
 */
public record SignedEnvelope(
    @JsonProperty("publicKey") String publicKey,
    @JsonProperty("signature") String signature,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("nonce")     long nonce
) {}
