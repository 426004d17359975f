package com.timemarket.core.domain;

import com.timemarket.core.fhe.EncryptedHandle;

import java.util.List;

/**
 * The three encrypted fields of an offer.
 */
public record OfferHandles(EncryptedHandle price, EncryptedHandle duration, EncryptedHandle slots) {

    /**
     * Handles declassified by a reveal, in the order their cleartexts are encoded.
     */
    public List<EncryptedHandle> revealable() {
        return List.of(price, slots);
    }
}
