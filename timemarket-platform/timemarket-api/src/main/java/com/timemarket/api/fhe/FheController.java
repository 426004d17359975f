package com.timemarket.api.fhe;

import com.timemarket.core.fhe.DecryptionOracle;
import com.timemarket.core.fhe.DecryptionResult;
import com.timemarket.core.fhe.EncryptedHandle;
import com.timemarket.core.fhe.EncryptedInput;
import com.timemarket.core.fhe.EncryptedInputService;
import com.timemarket.core.fhe.FheType;
import com.timemarket.core.fhe.TypedValue;
import com.timemarket.core.error.ValidationException;
import com.timemarket.core.ledger.OfferLedger;
import com.timemarket.core.util.HexBytes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;

/**
 * Client-side helpers of the local coprocessor: batch encryption of inputs
 * and public decryption of revealed handles.
 */
@RestController
@RequestMapping("/api/v1/fhe")
public class FheController {

    private final EncryptedInputService inputService;
    private final DecryptionOracle decryptionOracle;
    private final OfferLedger ledger;

    public FheController(EncryptedInputService inputService, DecryptionOracle decryptionOracle, OfferLedger ledger) {
        this.inputService = inputService;
        this.decryptionOracle = decryptionOracle;
        this.ledger = ledger;
    }

    /**
     * Encrypt values in one bundle bound to (contract, user).
     * POST /api/v1/fhe/encrypt
     */
    @PostMapping("/encrypt")
    public ResponseEntity<EncryptResponse> encrypt(@Valid @RequestBody EncryptRequest request) {
        String contract = request.contractAddress() == null ? ledger.getContractAddress() : request.contractAddress();
        List<TypedValue> values = request.values().stream().map(FheController::toTypedValue).toList();

        EncryptedInput input = inputService.encryptBatch(contract, request.userAddress(), values);

        return ResponseEntity.ok(new EncryptResponse(
                input.handles().stream().map(EncryptedHandle::value).toList(),
                input.proof().value()));
    }

    /**
     * Decrypt publicly decryptable handles.
     * POST /api/v1/fhe/public-decrypt
     */
    @PostMapping("/public-decrypt")
    public ResponseEntity<DecryptResponse> publicDecrypt(@Valid @RequestBody DecryptRequest request) {
        DecryptionResult result = decryptionOracle.publicDecrypt(
                request.handles().stream().map(EncryptedHandle::of).toList());
        return ResponseEntity.ok(new DecryptResponse(
                result.values(),
                HexBytes.toHex(result.cleartexts()),
                HexBytes.toHex(result.decryptionProof())));
    }

    private static TypedValue toTypedValue(ValueRequest value) {
        FheType type;
        try {
            type = FheType.valueOf(value.type().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unsupported encrypted type: " + value.type());
        }
        return new TypedValue(type, value.value());
    }

    // DTOs
    public record ValueRequest(@NotBlank String type, @NotNull BigInteger value) {}

    public record EncryptRequest(
        String contractAddress,
        @NotBlank String userAddress,
        @NotEmpty List<@Valid ValueRequest> values
    ) {}

    public record EncryptResponse(List<String> handles, String inputProof) {}

    public record DecryptRequest(@NotEmpty List<String> handles) {}

    public record DecryptResponse(List<BigInteger> values, String cleartexts, String decryptionProof) {}
}
