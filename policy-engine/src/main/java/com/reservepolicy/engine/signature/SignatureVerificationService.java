package com.reservepolicy.engine.signature;

import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.engine.clock.ChainClock;
import com.reservepolicy.engine.dto.SignedEnvelope;
import com.reservepolicy.engine.substrate.SignatureVerification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns a signed request envelope into the verification step the engine expects.
 *
 * <p>The canonical message is rebuilt server-side from the request fields, so a
 * signature only authorizes the exact action and arguments it was made for.
 */
@Component
public class SignatureVerificationService {

    private static final Logger log = LoggerFactory.getLogger(SignatureVerificationService.class);

    private final SignatureProvider provider;
    private final ChainClock clock;
    private final long maxAgeSeconds;

    public SignatureVerificationService(SignatureProvider provider,
                                        ChainClock clock,
                                        @Value("${policy.signature.max-age-seconds:300}") long maxAgeSeconds) {
        this.provider      = provider;
        this.clock         = clock;
        this.maxAgeSeconds = maxAgeSeconds;
    }

    /**
     * @param envelope the caller's key, signature, timestamp and nonce
     * @param message  canonical bytes the caller should have signed
     */
    public SignatureVerification verify(SignedEnvelope envelope, byte[] message) {
        PolicyEngineException.require(envelope != null && envelope.publicKey() != null && envelope.signature() != null,
            PolicyError.MISSING_SIGNATURE_VERIFICATION, "signed envelope is required");

        long now = clock.now();
        long timestamp = envelope.timestamp();
        PolicyEngineException.require(timestamp >= now - maxAgeSeconds && timestamp <= now + maxAgeSeconds,
            PolicyError.SIGNATURE_EXPIRED, "timestamp=" + timestamp + " now=" + now + " max=" + maxAgeSeconds + "s");

        if (!provider.verify(envelope.publicKey(), message, envelope.signature())) {
            log.warn("Signature rejected. agent={} nonce={}", envelope.publicKey(), envelope.nonce());
            throw new PolicyEngineException(PolicyError.SIGNATURE_VERIFICATION_FAILED, "agent=" + envelope.publicKey());
        }
        return new SignatureVerification(envelope.publicKey(), envelope.nonce());
    }
}
