package com.timemarket.core.fhe;

import com.timemarket.core.error.ValidationException;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A plaintext value tagged with the encrypted type it will be imported as.
 */
public record TypedValue(FheType type, BigInteger value) {

    public TypedValue {
        Objects.requireNonNull(type, "Type cannot be null");
        if (!type.fits(value)) {
            throw new ValidationException("Value " + value + " does not fit " + type);
        }
    }

    public static TypedValue uint8(long value) {
        return new TypedValue(FheType.EUINT8, BigInteger.valueOf(value));
    }

    public static TypedValue uint16(long value) {
        return new TypedValue(FheType.EUINT16, BigInteger.valueOf(value));
    }

    public static TypedValue uint32(long value) {
        return new TypedValue(FheType.EUINT32, BigInteger.valueOf(value));
    }

    public static TypedValue uint64(BigInteger value) {
        return new TypedValue(FheType.EUINT64, value);
    }
}
