package com.timemarket.core.fhe;

import java.math.BigInteger;

/**
 * Boundary to the homomorphic-encryption coprocessor: input encryption,
 * input-proof verification, trivial encryption and the ACL.
 */
public interface FheCoprocessor {

    /**
     * Opens a fresh encrypted input session for values that {@code userAddress}
     * will submit to {@code contractAddress}.
     */
    EncryptedInputBuilder createEncryptedInput(String contractAddress, String userAddress);

    /**
     * Checks that {@code handle} belongs to the bundle authenticated by
     * {@code proof} for the given contract and submitter, and that it has the
     * expected type. Returns the handle usable by the contract.
     *
     * @throws com.timemarket.core.error.ProofVerificationException on any mismatch
     */
    EncryptedHandle verifyInput(EncryptedHandle handle, InputProof proof,
                                String contractAddress, String userAddress, FheType expectedType);

    /**
     * Encrypts a plaintext known to the contract itself.
     */
    EncryptedHandle trivialEncrypt(BigInteger value, FheType type);

    AccessControlList acl();
}
