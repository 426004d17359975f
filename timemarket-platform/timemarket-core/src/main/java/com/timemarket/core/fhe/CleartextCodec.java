package com.timemarket.core.fhe;

import com.timemarket.core.error.ValidationException;
import com.timemarket.core.util.HexBytes;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * ABI-style cleartext encoding: one 32-byte big-endian word per value, in
 * handle order.
 */
public final class CleartextCodec {

    private CleartextCodec() {}

    public static byte[] encode(List<BigInteger> values) {
        byte[] out = new byte[values.size() * HexBytes.WORD_SIZE];
        for (int i = 0; i < values.size(); i++) {
            byte[] word = HexBytes.toWord(values.get(i));
            System.arraycopy(word, 0, out, i * HexBytes.WORD_SIZE, HexBytes.WORD_SIZE);
        }
        return out;
    }

    public static List<BigInteger> decode(byte[] blob, int expectedCount) {
        if (blob == null || blob.length != expectedCount * HexBytes.WORD_SIZE) {
            throw new ValidationException("Cleartext blob must hold exactly " + expectedCount + " words");
        }
        List<BigInteger> values = new ArrayList<>(expectedCount);
        for (int i = 0; i < expectedCount; i++) {
            values.add(HexBytes.fromWord(blob, i * HexBytes.WORD_SIZE));
        }
        return values;
    }
}
