package com.timemarket.core.fhe;

import java.math.BigInteger;
import java.util.List;

/**
 * Outcome of {@link DecryptionVerifier#verify}. Decoded values are only
 * reachable through {@link Verified}.
 */
public sealed interface VerificationResult permits VerificationResult.Verified, VerificationResult.Rejected {

    boolean isVerified();

    record Verified(List<BigInteger> values) implements VerificationResult {
        public Verified {
            values = List.copyOf(values);
        }

        @Override
        public boolean isVerified() {
            return true;
        }
    }

    record Rejected(String reason) implements VerificationResult {
        @Override
        public boolean isVerified() {
            return false;
        }
    }
}
