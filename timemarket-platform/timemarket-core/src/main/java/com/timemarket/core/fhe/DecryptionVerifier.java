package com.timemarket.core.fhe;

import java.util.List;

/**
 * Verification primitive for externally supplied cleartext. Callers must derive
 * {@code handles} from their own state, never from the party that supplies the
 * cleartext.
 */
public interface DecryptionVerifier {

    VerificationResult verify(List<EncryptedHandle> handles, byte[] cleartexts, byte[] decryptionProof);
}
