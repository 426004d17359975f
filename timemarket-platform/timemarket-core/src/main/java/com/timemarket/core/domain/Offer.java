package com.timemarket.core.domain;

import com.timemarket.core.fhe.EncryptedHandle;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Read model of a marketplace offer as held by the ledger at the time of the
 * read. Timestamps have second precision.
 */
public record Offer(
        long id,
        String creator,
        String title,
        String description,
        BigInteger publicPrice,
        long duration,
        long slots,
        long availableSlots,
        boolean active,
        Instant createdAt,
        Instant expiresAt,
        EncryptedHandle encryptedPrice,
        EncryptedHandle encryptedDuration,
        EncryptedHandle encryptedSlots,
        RevealState revealState
) {

    public OfferStatus status() {
        if (active) {
            return OfferStatus.ACTIVE;
        }
        return availableSlots == 0 ? OfferStatus.EXHAUSTED : OfferStatus.DEACTIVATED;
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public OfferHandles handles() {
        return new OfferHandles(encryptedPrice, encryptedDuration, encryptedSlots);
    }

    public BigInteger priceFor(long quantity) {
        return publicPrice.multiply(BigInteger.valueOf(quantity));
    }
}
