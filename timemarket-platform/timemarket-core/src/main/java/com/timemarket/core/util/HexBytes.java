package com.timemarket.core.util;

import com.timemarket.core.error.ValidationException;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 0x-prefixed hex encoding and the fixed-width word helpers used by handles,
 * proofs and cleartext blobs.
 */
public final class HexBytes {

    public static final int WORD_SIZE = 32;

    private static final HexFormat HEX = HexFormat.of();

    private HexBytes() {}

    public static String toHex(byte[] bytes) {
        return "0x" + HEX.formatHex(bytes);
    }

    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw new ValidationException("Hex value cannot be null");
        }
        String body = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (body.length() % 2 != 0) {
            throw new ValidationException("Hex value has odd length: " + hex);
        }
        try {
            return HEX.parseHex(body);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed hex value: " + hex);
        }
    }

    /**
     * Left-pads an unsigned integer into a 32-byte big-endian word.
     */
    public static byte[] toWord(BigInteger value) {
        if (value.signum() < 0) {
            throw new ValidationException("Negative value cannot be encoded as a word: " + value);
        }
        byte[] raw = value.toByteArray();
        int offset = raw.length > 1 && raw[0] == 0 ? 1 : 0;
        int length = raw.length - offset;
        if (length > WORD_SIZE) {
            throw new ValidationException("Value exceeds 256 bits: " + value);
        }
        byte[] word = new byte[WORD_SIZE];
        System.arraycopy(raw, offset, word, WORD_SIZE - length, length);
        return word;
    }

    public static BigInteger fromWord(byte[] source, int offset) {
        byte[] word = new byte[WORD_SIZE];
        System.arraycopy(source, offset, word, 0, WORD_SIZE);
        return new BigInteger(1, word);
    }

    public static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] sha256(byte[]... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (byte[] part : parts) {
                digest.update(part);
            }
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
