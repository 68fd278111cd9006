package com.reservepolicy.engine.signature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Ed25519 verification through the JDK provider.
 *
 * <p>Agent identities are raw 32-byte public keys, Base64 encoded. The raw key is
 * wrapped in the fixed X.509 SubjectPublicKeyInfo prefix before decoding.
 */
public class Ed25519SignatureProvider implements SignatureProvider {

    private static final Logger log = LoggerFactory.getLogger(Ed25519SignatureProvider.class);

    public static final String ALGORITHM = "Ed25519";
    public static final int PUBLIC_KEY_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 64;

    private static final byte[] X509_PREFIX = {
        0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x03, 0x21, 0x00
    };

    @Override
    public boolean verify(String publicKey, byte[] message, String signature) {
        if (publicKey == null || signature == null || message == null) {
            return false;
        }
        byte[] rawKey;
        byte[] rawSignature;
        try {
            rawKey       = Base64.getDecoder().decode(publicKey);
            rawSignature = Base64.getDecoder().decode(signature);
        } catch (IllegalArgumentException e) {
            log.debug("Rejected non-Base64 key or signature. key={}", publicKey);
            return false;
        }
        if (rawKey.length != PUBLIC_KEY_LENGTH || rawSignature.length != SIGNATURE_LENGTH) {
            log.debug("Rejected key or signature of wrong length. key={} keyLen={} sigLen={}",
                      publicKey, rawKey.length, rawSignature.length);
            return false;
        }

        try {
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(decodePublicKey(rawKey));
            verifier.update(message);
            return verifier.verify(rawSignature);
        } catch (GeneralSecurityException e) {
            log.warn("Ed25519 verification error. key={} reason={}", publicKey, e.getMessage());
            return false;
        }
    }

    /** Base64 of the raw 32-byte key inside an X.509 encoded Ed25519 public key. */
    public static String encodeRawKey(PublicKey key) {
        byte[] encoded = key.getEncoded();
        byte[] raw = new byte[PUBLIC_KEY_LENGTH];
        System.arraycopy(encoded, encoded.length - PUBLIC_KEY_LENGTH, raw, 0, PUBLIC_KEY_LENGTH);
        return Base64.getEncoder().encodeToString(raw);
    }

    private static PublicKey decodePublicKey(byte[] rawKey) throws GeneralSecurityException {
        byte[] encoded = new byte[X509_PREFIX.length + rawKey.length];
        System.arraycopy(X509_PREFIX, 0, encoded, 0, X509_PREFIX.length);
        System.arraycopy(rawKey, 0, encoded, X509_PREFIX.length, rawKey.length);
        return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
    }
}
