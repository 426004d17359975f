package com.timemarket.core.fhe;

import com.timemarket.core.error.ValidationException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One encrypted input session bound to (target contract, submitter).
 *
 * <p>Values are appended in order and sealed together by a single
 * {@link #encrypt()} call, which yields one handle per value and one proof over
 * the whole bundle. A session is single-use. It is not thread-safe: appends from
 * two logical batches must not be interleaved on the same instance (see
 * {@link EncryptedInputService} for a serializing front).
 */
public class EncryptedInputBuilder {

    /** Upper bound on the total plaintext bits of one bundle. */
    public static final int MAX_TOTAL_BITS = 2048;
    /** Upper bound on the number of values in one bundle. */
    public static final int MAX_VALUES = 255;

    private final String contractAddress;
    private final String userAddress;
    private final InputEncryptor encryptor;
    private final List<TypedValue> values = new ArrayList<>();
    private int totalBits;
    private boolean sealed;

    EncryptedInputBuilder(String contractAddress, String userAddress, InputEncryptor encryptor) {
        this.contractAddress = Objects.requireNonNull(contractAddress, "Contract address cannot be null");
        this.userAddress = Objects.requireNonNull(userAddress, "User address cannot be null");
        this.encryptor = Objects.requireNonNull(encryptor, "Encryptor cannot be null");
    }

    public EncryptedInputBuilder add8(long value) {
        return add(new TypedValue(FheType.EUINT8, BigInteger.valueOf(value)));
    }

    public EncryptedInputBuilder add16(long value) {
        return add(new TypedValue(FheType.EUINT16, BigInteger.valueOf(value)));
    }

    public EncryptedInputBuilder add32(long value) {
        return add(new TypedValue(FheType.EUINT32, BigInteger.valueOf(value)));
    }

    public EncryptedInputBuilder add64(long value) {
        return add(new TypedValue(FheType.EUINT64, BigInteger.valueOf(value)));
    }

    public EncryptedInputBuilder add64(BigInteger value) {
        return add(new TypedValue(FheType.EUINT64, value));
    }

    public EncryptedInputBuilder add(TypedValue value) {
        Objects.requireNonNull(value, "Value cannot be null");
        ensureOpen();
        if (values.size() >= MAX_VALUES) {
            throw new ValidationException("Encrypted input cannot hold more than " + MAX_VALUES + " values");
        }
        if (totalBits + value.type().bits() > MAX_TOTAL_BITS) {
            throw new ValidationException("Encrypted input exceeds " + MAX_TOTAL_BITS + " bits");
        }
        values.add(value);
        totalBits += value.type().bits();
        return this;
    }

    /**
     * Seals the bundle. After this call the session accepts no more values.
     */
    public EncryptedInput encrypt() {
        ensureOpen();
        if (values.isEmpty()) {
            throw new IllegalStateException("Cannot encrypt an empty input");
        }
        sealed = true;
        return encryptor.seal(contractAddress, userAddress, Collections.unmodifiableList(values));
    }

    public boolean isSealed() {
        return sealed;
    }

    public int size() {
        return values.size();
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public String getUserAddress() {
        return userAddress;
    }

    private void ensureOpen() {
        if (sealed) {
            throw new IllegalStateException("Encrypted input session already finalized");
        }
    }
}
