package com.timemarket.core.fhe;

import com.timemarket.core.error.AuthorizationException;
import com.timemarket.core.error.ProofVerificationException;
import com.timemarket.core.error.ValidationException;
import com.timemarket.core.util.HexBytes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process stand-in for the encryption coprocessor, the decryption oracle and
 * the decryption-proof verifier.
 *
 * <p>It does not encrypt anything: plaintexts are kept in memory keyed by
 * handle. What it reproduces faithfully is the binding discipline. Input proofs
 * are HMAC-SHA256 tags over (contract, submitter, ordered handles) under a
 * coprocessor key, and decryption proofs are SHA256withECDSA signatures of a KMS
 * key over (handles, cleartexts).
 *
 * <p>Proof layout: {@code count(1) || handle(32) * count || tag(32)}.
 */
public class LocalFheCoprocessor implements FheCoprocessor, DecryptionOracle, DecryptionVerifier {

    private static final Logger log = LoggerFactory.getLogger(LocalFheCoprocessor.class);

    private static final String MAC_ALGORITHM = "HmacSHA256";
    private static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";
    private static final int TAG_LENGTH = 32;
    private static final byte HANDLE_VERSION = 0;

    private final byte[] coprocessorKey;
    private final long chainId;
    private final KeyPair kmsKeyPair;
    private final SecureRandom random = new SecureRandom();
    private final AccessControlList acl = new AccessControlList();
    private final Map<EncryptedHandle, BigInteger> plaintexts = new ConcurrentHashMap<>();
    private final AtomicLong computedCounter = new AtomicLong();

    public LocalFheCoprocessor(byte[] coprocessorKey, long chainId) {
        Objects.requireNonNull(coprocessorKey, "Coprocessor key cannot be null");
        if (coprocessorKey.length < 16) {
            throw new IllegalArgumentException("Coprocessor key must be at least 16 bytes");
        }
        this.coprocessorKey = coprocessorKey.clone();
        this.chainId = chainId;
        this.kmsKeyPair = generateKmsKeyPair();
    }

    /**
     * Creates a coprocessor with a random key.
     */
    public static LocalFheCoprocessor create(long chainId) {
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        return new LocalFheCoprocessor(key, chainId);
    }

    // ==================== Encryption ====================

    @Override
    public EncryptedInputBuilder createEncryptedInput(String contractAddress, String userAddress) {
        return new EncryptedInputBuilder(contractAddress, userAddress, this::seal);
    }

    private EncryptedInput seal(String contractAddress, String userAddress, List<TypedValue> values) {
        List<TypedValue> bundle = List.copyOf(values);
        byte[] nonce = new byte[32];
        random.nextBytes(nonce);

        ByteBuffer serialized = ByteBuffer.allocate(bundle.size() * (1 + HexBytes.WORD_SIZE));
        for (TypedValue value : bundle) {
            serialized.put((byte) value.type().typeId());
            serialized.put(HexBytes.toWord(value.value()));
        }
        byte[] bundleDigest = HexBytes.sha256(
                HexBytes.utf8(lower(contractAddress)),
                HexBytes.utf8(lower(userAddress)),
                nonce,
                serialized.array());

        List<EncryptedHandle> handles = new ArrayList<>(bundle.size());
        for (int i = 0; i < bundle.size(); i++) {
            TypedValue value = bundle.get(i);
            byte[] seed = HexBytes.sha256(bundleDigest, new byte[] {(byte) i, (byte) value.type().typeId()});
            EncryptedHandle handle = buildHandle(seed, i, value.type());
            handles.add(handle);
            plaintexts.put(handle, value.value());
        }

        byte[] tag = inputTag(contractAddress, userAddress, handles);
        ByteBuffer proof = ByteBuffer.allocate(1 + handles.size() * EncryptedHandle.LENGTH + TAG_LENGTH);
        proof.put((byte) handles.size());
        handles.forEach(h -> proof.put(h.toBytes()));
        proof.put(tag);

        log.debug("Sealed encrypted input of {} values for contract {} and user {}",
                handles.size(), contractAddress, userAddress);
        return new EncryptedInput(handles, InputProof.fromBytes(proof.array()));
    }

    @Override
    public EncryptedHandle verifyInput(EncryptedHandle handle, InputProof proof,
                                       String contractAddress, String userAddress, FheType expectedType) {
        Objects.requireNonNull(handle, "Handle cannot be null");
        Objects.requireNonNull(proof, "Proof cannot be null");

        byte[] raw = proof.toBytes();
        if (raw.length < 1 + EncryptedHandle.LENGTH + TAG_LENGTH) {
            throw new ProofVerificationException("Input proof is truncated");
        }
        int count = raw[0] & 0xff;
        if (count == 0 || raw.length != 1 + count * EncryptedHandle.LENGTH + TAG_LENGTH) {
            throw new ProofVerificationException("Input proof length does not match its handle count");
        }

        List<EncryptedHandle> covered = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte[] bytes = new byte[EncryptedHandle.LENGTH];
            System.arraycopy(raw, 1 + i * EncryptedHandle.LENGTH, bytes, 0, EncryptedHandle.LENGTH);
            covered.add(EncryptedHandle.fromBytes(bytes));
        }
        byte[] tag = new byte[TAG_LENGTH];
        System.arraycopy(raw, raw.length - TAG_LENGTH, tag, 0, TAG_LENGTH);

        if (!MessageDigest.isEqual(tag, inputTag(contractAddress, userAddress, covered))) {
            throw new ProofVerificationException(
                    "Input proof was not issued for contract " + contractAddress + " and user " + userAddress);
        }
        int index = handle.index();
        if (index >= count || !covered.get(index).equals(handle)) {
            throw new ProofVerificationException("Handle " + handle + " is not covered by the input proof");
        }
        if (handle.chainId() != chainId) {
            throw new ProofVerificationException("Handle " + handle + " belongs to chain " + handle.chainId());
        }
        if (handle.type() != expectedType) {
            throw new ProofVerificationException(
                    "Handle " + handle + " has type " + handle.type() + ", expected " + expectedType);
        }
        if (!plaintexts.containsKey(handle)) {
            throw new ProofVerificationException("No ciphertext registered for handle " + handle);
        }
        return handle;
    }

    @Override
    public EncryptedHandle trivialEncrypt(BigInteger value, FheType type) {
        if (!type.fits(value)) {
            throw new ValidationException("Value " + value + " does not fit " + type);
        }
        byte[] salt = new byte[16];
        random.nextBytes(salt);
        byte[] seed = HexBytes.sha256(
                HexBytes.toWord(BigInteger.valueOf(computedCounter.incrementAndGet())),
                salt,
                HexBytes.toWord(value));
        EncryptedHandle handle = buildHandle(seed, EncryptedHandle.COMPUTED_INDEX, type);
        plaintexts.put(handle, value);
        return handle;
    }

    @Override
    public AccessControlList acl() {
        return acl;
    }

    // ==================== Decryption ====================

    @Override
    public DecryptionResult publicDecrypt(List<EncryptedHandle> handles) {
        if (handles == null || handles.isEmpty()) {
            throw new ValidationException("At least one handle is required");
        }
        List<BigInteger> values = new ArrayList<>(handles.size());
        for (EncryptedHandle handle : handles) {
            if (!acl.isPubliclyDecryptable(handle)) {
                throw new AuthorizationException("Handle " + handle + " is not publicly decryptable");
            }
            values.add(plaintextOf(handle));
        }
        byte[] cleartexts = CleartextCodec.encode(values);
        byte[] signature = sign(decryptionDigest(handles, cleartexts));
        log.debug("Publicly decrypted {} handles", handles.size());
        return new DecryptionResult(handles, cleartexts, signature, values);
    }

    /**
     * Decrypts a single handle for a subject holding an ACL grant on it.
     */
    public BigInteger userDecrypt(EncryptedHandle handle, String userAddress) {
        if (!acl.isAllowed(handle, userAddress)) {
            throw new AuthorizationException(userAddress + " is not allowed to decrypt " + handle);
        }
        return plaintextOf(handle);
    }

    @Override
    public VerificationResult verify(List<EncryptedHandle> handles, byte[] cleartexts, byte[] decryptionProof) {
        if (handles == null || handles.isEmpty()) {
            return new VerificationResult.Rejected("No handles to verify against");
        }
        if (cleartexts == null || cleartexts.length != handles.size() * HexBytes.WORD_SIZE) {
            return new VerificationResult.Rejected("Cleartext length does not match " + handles.size() + " handles");
        }
        if (decryptionProof == null || decryptionProof.length == 0) {
            return new VerificationResult.Rejected("Missing decryption proof");
        }
        try {
            Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
            verifier.initVerify(kmsKeyPair.getPublic());
            verifier.update(decryptionDigest(handles, cleartexts));
            if (!verifier.verify(decryptionProof)) {
                return new VerificationResult.Rejected("Decryption proof does not match handles and cleartexts");
            }
        } catch (GeneralSecurityException e) {
            return new VerificationResult.Rejected("Malformed decryption proof: " + e.getMessage());
        }
        return new VerificationResult.Verified(CleartextCodec.decode(cleartexts, handles.size()));
    }

    public PublicKey kmsPublicKey() {
        return kmsKeyPair.getPublic();
    }

    public long getChainId() {
        return chainId;
    }

    // ==================== Private Helper Methods ====================

    private EncryptedHandle buildHandle(byte[] seed, int index, FheType type) {
        byte[] bytes = new byte[EncryptedHandle.LENGTH];
        System.arraycopy(seed, 0, bytes, 0, 21);
        bytes[21] = (byte) index;
        for (int i = 0; i < 8; i++) {
            bytes[29 - i] = (byte) (chainId >>> (8 * i));
        }
        bytes[30] = (byte) type.typeId();
        bytes[31] = HANDLE_VERSION;
        return EncryptedHandle.fromBytes(bytes);
    }

    private BigInteger plaintextOf(EncryptedHandle handle) {
        BigInteger value = plaintexts.get(handle);
        if (value == null) {
            throw new ValidationException("Unknown ciphertext handle: " + handle);
        }
        return value;
    }

    private byte[] inputTag(String contractAddress, String userAddress, List<EncryptedHandle> handles) {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(new SecretKeySpec(coprocessorKey, MAC_ALGORITHM));
            mac.update(HexBytes.utf8(lower(contractAddress)));
            mac.update(HexBytes.utf8(lower(userAddress)));
            for (EncryptedHandle handle : handles) {
                mac.update(handle.toBytes());
            }
            return mac.doFinal();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute input proof tag", e);
        }
    }

    private static byte[] decryptionDigest(List<EncryptedHandle> handles, byte[] cleartexts) {
        ByteBuffer buffer = ByteBuffer.allocate(handles.size() * EncryptedHandle.LENGTH + cleartexts.length);
        handles.forEach(h -> buffer.put(h.toBytes()));
        buffer.put(cleartexts);
        return HexBytes.sha256(buffer.array());
    }

    private byte[] sign(byte[] digest) {
        try {
            Signature signature = Signature.getInstance(SIGNATURE_ALGORITHM);
            signature.initSign(kmsKeyPair.getPrivate());
            signature.update(digest);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign decryption result", e);
        }
    }

    private static KeyPair generateKmsKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec("secp256r1"), new SecureRandom());
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to generate KMS keypair", e);
        }
    }

    private static String lower(String address) {
        return address == null ? "" : address.toLowerCase(Locale.ROOT);
    }
}
