package com.timemarket.core.fhe;

import com.timemarket.core.error.ValidationException;
import com.timemarket.core.util.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Builds encrypted input batches, one fresh session per call, serialized per
 * (contract, submitter) pair so that two batches for the same pair never share
 * or interleave a session. Batches for different pairs run concurrently.
 */
public class EncryptedInputService {

    private static final Logger log = LoggerFactory.getLogger(EncryptedInputService.class);

    private final FheCoprocessor coprocessor;
    private final Map<SessionKey, SessionLock> sessionLocks = new ConcurrentHashMap<>();

    public EncryptedInputService(FheCoprocessor coprocessor) {
        this.coprocessor = Objects.requireNonNull(coprocessor, "Coprocessor cannot be null");
    }

    /**
     * Encrypts all values under one proof. {@code handles[i]} of the result
     * corresponds to {@code values[i]}.
     */
    public EncryptedInput encryptBatch(String contractAddress, String userAddress, List<TypedValue> values) {
        if (values == null || values.isEmpty()) {
            throw new ValidationException("At least one value is required");
        }
        SessionKey key = new SessionKey(Addresses.normalize(contractAddress), Addresses.normalize(userAddress));
        SessionLock sessionLock = acquire(key);
        sessionLock.lock.lock();
        try {
            EncryptedInputBuilder session = coprocessor.createEncryptedInput(key.contractAddress(), key.userAddress());
            values.forEach(session::add);
            EncryptedInput input = session.encrypt();
            log.debug("Encrypted batch of {} values for {}", input.size(), key);
            return input;
        } finally {
            sessionLock.lock.unlock();
            release(key);
        }
    }

    /**
     * Encrypts a single value. The returned input carries exactly one handle.
     */
    public EncryptedInput encryptValue(String contractAddress, String userAddress, TypedValue value) {
        return encryptBatch(contractAddress, userAddress, List.of(value));
    }

    int activeSessionLocks() {
        return sessionLocks.size();
    }

    // A pair's lock lives only while some thread holds or waits for it.
    private SessionLock acquire(SessionKey key) {
        return sessionLocks.compute(key, (k, existing) -> {
            SessionLock sessionLock = existing == null ? new SessionLock() : existing;
            sessionLock.users++;
            return sessionLock;
        });
    }

    private void release(SessionKey key) {
        sessionLocks.computeIfPresent(key, (k, sessionLock) -> --sessionLock.users == 0 ? null : sessionLock);
    }

    record SessionKey(String contractAddress, String userAddress) {}

    private static final class SessionLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
