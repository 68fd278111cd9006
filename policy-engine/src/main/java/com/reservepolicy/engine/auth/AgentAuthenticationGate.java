package com.reservepolicy.engine.auth;

import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.engine.substrate.InvocationContext;
import com.reservepolicy.engine.substrate.LedgerTransaction;
import com.reservepolicy.engine.substrate.SignatureVerification;
import com.reservepolicy.engine.substrate.SubmissionStep;
import org.springframework.stereotype.Component;

/**
 * The single authentication routine shared by every mutating entry point.
 *
 * <p>A call is authenticated when the step immediately before it in the same
 * submission is a {@link SignatureVerification} whose public key equals the
 * identity the call claims, and whose nonce is above the agent's last accepted
 * nonce. The nonce is recorded in the same transaction as the call, so a
 * rejected call does not consume it.
 *
 * <p>Stateless apart from the ledger it is handed; safe to share.
 */
@Component
public class AgentAuthenticationGate {

    public void authenticate(InvocationContext context, String claimedAgent) {
        SubmissionStep preceding = context.precedingStep().orElse(null);
        if (!(preceding instanceof SignatureVerification verification)) {
            throw new PolicyEngineException(PolicyError.MISSING_SIGNATURE_VERIFICATION,
                "call=" + context.callName());
        }
        PolicyEngineException.require(claimedAgent != null && claimedAgent.equals(verification.publicKey()),
            PolicyError.AGENT_MISMATCH, "call=" + context.callName() + " claimed=" + claimedAgent);

        LedgerTransaction ledger = context.ledger();
        long last = ledger.lastNonce(claimedAgent);
        PolicyEngineException.require(verification.nonce() > last, PolicyError.INVALID_NONCE,
            "nonce=" + verification.nonce() + " last=" + last);
        ledger.recordNonce(claimedAgent, verification.nonce());
    }

    /** Authenticates, then requires the caller to be {@code requiredIdentity}. */
    public void authenticateRole(InvocationContext context, String claimedAgent, String requiredIdentity) {
        authenticate(context, claimedAgent);
        PolicyEngineException.require(claimedAgent.equals(requiredIdentity), PolicyError.UNAUTHORIZED,
            "call=" + context.callName() + " caller=" + claimedAgent);
    }
}
