package com.timemarket.core.error;

/**
 * An input proof did not cover the imported handles, or a decryption proof did
 * not match the declassified handle list. The operation is aborted as a whole.
 */
public class ProofVerificationException extends MarketplaceException {

    public ProofVerificationException(String message) {
        super("MKT_PROOF_INVALID", message);
    }

    public ProofVerificationException(String message, Throwable cause) {
        super("MKT_PROOF_INVALID", message, cause);
    }
}
