package com.timemarket.api.offer;

import com.timemarket.api.TransactionResponse;
import com.timemarket.core.domain.RevealedValues;
import com.timemarket.core.fhe.EncryptedHandle;
import com.timemarket.core.fhe.InputProof;
import com.timemarket.core.ledger.OfferLedger;
import com.timemarket.core.util.HexBytes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * Offer lifecycle REST API.
 *
 * <p>The calling account is taken from the {@code X-Caller-Address} header.
 */
@RestController
@RequestMapping("/api/v1/offers")
public class OfferController {

    static final String CALLER = "X-Caller-Address";

    private final OfferLedger ledger;

    public OfferController(OfferLedger ledger) {
        this.ledger = ledger;
    }

    /**
     * Create an offer from plaintext values.
     * POST /api/v1/offers
     */
    @PostMapping
    public ResponseEntity<TransactionResponse> createOffer(
            @RequestHeader(CALLER) String caller,
            @Valid @RequestBody CreateOfferRequest request) {
        var receipt = ledger.createOffer(caller, request.title(), request.description(),
                request.price(), request.durationDays(), request.slots());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(receipt));
    }

    /**
     * Create an offer from a client-side encrypted bundle.
     * POST /api/v1/offers/encrypted
     */
    @PostMapping("/encrypted")
    public ResponseEntity<TransactionResponse> createEncryptedOffer(
            @RequestHeader(CALLER) String caller,
            @Valid @RequestBody CreateEncryptedOfferRequest request) {
        var receipt = ledger.createOfferEncrypted(caller, request.title(), request.description(),
                request.displayPrice(), request.durationDays(), request.slots(),
                EncryptedHandle.of(request.priceHandle()),
                EncryptedHandle.of(request.durationHandle()),
                EncryptedHandle.of(request.slotsHandle()),
                new InputProof(request.inputProof()));
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(receipt));
    }

    @PostMapping("/{offerId}/purchase")
    public ResponseEntity<TransactionResponse> purchaseOffer(
            @RequestHeader(CALLER) String caller,
            @PathVariable long offerId,
            @Valid @RequestBody PurchaseRequest request) {
        var receipt = ledger.purchaseOffer(caller, offerId, request.quantity(), request.payment());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(receipt));
    }

    @PostMapping("/{offerId}/deactivate")
    public ResponseEntity<TransactionResponse> deactivateOffer(
            @RequestHeader(CALLER) String caller,
            @PathVariable long offerId) {
        return ResponseEntity.ok(TransactionResponse.from(ledger.deactivateOffer(caller, offerId)));
    }

    /**
     * Make the offer's price and slot handles publicly decryptable.
     * POST /api/v1/offers/{offerId}/reveal
     */
    @PostMapping("/{offerId}/reveal")
    public ResponseEntity<TransactionResponse> requestReveal(
            @RequestHeader(CALLER) String caller,
            @PathVariable long offerId) {
        return ResponseEntity.ok(TransactionResponse.from(ledger.requestReveal(caller, offerId)));
    }

    /**
     * Submit decrypted cleartexts with the oracle's proof.
     * POST /api/v1/offers/{offerId}/callback
     */
    @PostMapping("/{offerId}/callback")
    public ResponseEntity<TransactionResponse> resolveCallback(
            @RequestHeader(CALLER) String caller,
            @PathVariable long offerId,
            @Valid @RequestBody CallbackRequest request) {
        var receipt = ledger.resolveCallback(caller, offerId,
                HexBytes.fromHex(request.cleartexts()), HexBytes.fromHex(request.decryptionProof()));
        return ResponseEntity.ok(TransactionResponse.from(receipt));
    }

    @GetMapping("/{offerId}")
    public ResponseEntity<OfferResponse> getOffer(@PathVariable long offerId) {
        return ResponseEntity.ok(OfferResponse.from(ledger.getOffer(offerId)));
    }

    @GetMapping("/{offerId}/handles")
    public ResponseEntity<OfferResponse.HandlesResponse> getEncryptedOfferData(@PathVariable long offerId) {
        return ResponseEntity.ok(OfferResponse.HandlesResponse.from(ledger.getEncryptedOfferData(offerId)));
    }

    @GetMapping("/{offerId}/revealed")
    public ResponseEntity<RevealedValues> getRevealedValues(@PathVariable long offerId) {
        return ledger.getRevealedValues(offerId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/active")
    public ResponseEntity<List<OfferResponse>> getActiveOffers() {
        return ResponseEntity.ok(ledger.getActiveOffers().stream().map(OfferResponse::from).toList());
    }

    @GetMapping("/creator/{address}")
    public ResponseEntity<List<OfferResponse>> getOffersByCreator(@PathVariable String address) {
        return ResponseEntity.ok(ledger.getOffersByCreator(address).stream().map(OfferResponse::from).toList());
    }

    // DTOs
    public record CreateOfferRequest(
        @NotBlank String title,
        @NotBlank String description,
        @NotNull BigInteger price,
        long durationDays,
        long slots
    ) {}

    public record CreateEncryptedOfferRequest(
        @NotBlank String title,
        @NotBlank String description,
        @NotNull BigInteger displayPrice,
        long durationDays,
        long slots,
        @NotBlank String priceHandle,
        @NotBlank String durationHandle,
        @NotBlank String slotsHandle,
        @NotBlank String inputProof
    ) {}

    public record PurchaseRequest(long quantity, @NotNull BigInteger payment) {}

    public record CallbackRequest(@NotBlank String cleartexts, @NotBlank String decryptionProof) {}
}
