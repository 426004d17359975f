package com.timemarket.core.fhe;

import java.math.BigInteger;
import java.util.List;

/**
 * Output of a public decryption: the ABI-encoded cleartexts, the proof binding
 * them to the handles, and the decoded values in handle order.
 */
public record DecryptionResult(List<EncryptedHandle> handles, byte[] cleartexts,
                               byte[] decryptionProof, List<BigInteger> values) {

    public DecryptionResult {
        handles = List.copyOf(handles);
        values = List.copyOf(values);
        cleartexts = cleartexts.clone();
        decryptionProof = decryptionProof.clone();
    }

    @Override
    public byte[] cleartexts() {
        return cleartexts.clone();
    }

    @Override
    public byte[] decryptionProof() {
        return decryptionProof.clone();
    }
}
