package com.reservepolicy.engine.signature;

/**
 * Detached-signature verification. Implementations must not throw for malformed
 * keys or signatures; they report {@code false}.
 */
public interface SignatureProvider {

    /**
     * @param publicKey Base64 encoded raw public key
     * @param message   exact signed bytes
     * @param signature Base64 encoded signature
     */
    boolean verify(String publicKey, byte[] message, String signature);
}
