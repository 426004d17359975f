package com.timemarket.core.fhe;

import java.util.List;

/**
 * Seals a finalized bundle. Implemented by the coprocessor that issued the
 * session.
 */
@FunctionalInterface
interface InputEncryptor {

    EncryptedInput seal(String contractAddress, String userAddress, List<TypedValue> values);
}
