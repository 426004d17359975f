package com.timemarket.core.fhe;

import com.timemarket.core.error.ValidationException;
import com.timemarket.core.util.HexBytes;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Opaque 32-byte reference to a ciphertext held by the coprocessor.
 *
 * <p>Layout: bytes 0-20 digest prefix, byte 21 index within the input bundle
 * (0xff for values computed on-chain), bytes 22-29 chain id, byte 30 type id,
 * byte 31 version.
 */
public record EncryptedHandle(String value) {

    public static final int LENGTH = 32;
    public static final int COMPUTED_INDEX = 0xff;

    private static final Pattern HANDLE = Pattern.compile("^0x[0-9a-f]{64}$");

    public EncryptedHandle {
        if (value == null) {
            throw new ValidationException("Encrypted handle cannot be null");
        }
        value = value.toLowerCase(Locale.ROOT);
        if (!HANDLE.matcher(value).matches()) {
            throw new ValidationException("Malformed encrypted handle: " + value);
        }
    }

    public static EncryptedHandle of(String hex) {
        return new EncryptedHandle(hex);
    }

    public static EncryptedHandle fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new ValidationException("Encrypted handle must be 32 bytes");
        }
        return new EncryptedHandle(HexBytes.toHex(bytes));
    }

    public byte[] toBytes() {
        return HexBytes.fromHex(value);
    }

    /**
     * Position of the value inside the input bundle it was encrypted with.
     */
    public int index() {
        return toBytes()[21] & 0xff;
    }

    public FheType type() {
        return FheType.fromTypeId(toBytes()[30] & 0xff);
    }

    public long chainId() {
        byte[] bytes = toBytes();
        long chainId = 0;
        for (int i = 22; i < 30; i++) {
            chainId = (chainId << 8) | (bytes[i] & 0xff);
        }
        return chainId;
    }

    @Override
    public String toString() {
        return value;
    }
}
