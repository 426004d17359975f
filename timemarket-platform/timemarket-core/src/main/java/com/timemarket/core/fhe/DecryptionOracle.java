package com.timemarket.core.fhe;

import java.util.List;

/**
 * Threshold decryption service. Produces cleartexts only for handles that were
 * marked publicly decryptable.
 */
public interface DecryptionOracle {

    /**
     * @throws com.timemarket.core.error.AuthorizationException if a handle is not publicly decryptable
     */
    DecryptionResult publicDecrypt(List<EncryptedHandle> handles);
}
