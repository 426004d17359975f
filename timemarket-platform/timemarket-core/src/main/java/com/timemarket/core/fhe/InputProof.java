package com.timemarket.core.fhe;

import com.timemarket.core.error.ValidationException;
import com.timemarket.core.util.HexBytes;

import java.util.Locale;

/**
 * Authentication token produced together with an input bundle's handles.
 * Held as 0x-prefixed hex so it can travel through JSON and ABI calls unchanged.
 */
public record InputProof(String value) {

    public InputProof {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Input proof cannot be empty");
        }
        value = value.toLowerCase(Locale.ROOT);
        if (!value.startsWith("0x") || value.length() < 4) {
            throw new ValidationException("Malformed input proof");
        }
    }

    public static InputProof fromBytes(byte[] bytes) {
        return new InputProof(HexBytes.toHex(bytes));
    }

    public byte[] toBytes() {
        return HexBytes.fromHex(value);
    }
}
