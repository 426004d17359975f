package com.timemarket.core.fhe;

import java.math.BigInteger;

/**
 * Encrypted integer types accepted by the coprocessor. The type id is the one
 * embedded in byte 30 of every handle.
 */
public enum FheType {
    EUINT8(8, 2),
    EUINT16(16, 3),
    EUINT32(32, 4),
    EUINT64(64, 5);

    private final int bits;
    private final int typeId;
    private final BigInteger maxValue;

    FheType(int bits, int typeId) {
        this.bits = bits;
        this.typeId = typeId;
        this.maxValue = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    }

    public int bits() {
        return bits;
    }

    public int typeId() {
        return typeId;
    }

    public BigInteger maxValue() {
        return maxValue;
    }

    public boolean fits(BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(maxValue) <= 0;
    }

    public static FheType fromTypeId(int typeId) {
        for (FheType type : values()) {
            if (type.typeId == typeId) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown FHE type id: " + typeId);
    }

    public static FheType fromBits(int bits) {
        for (FheType type : values()) {
            if (type.bits == bits) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported bit width: " + bits);
    }
}
