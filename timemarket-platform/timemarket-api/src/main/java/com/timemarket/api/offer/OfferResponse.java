package com.timemarket.api.offer;

import com.timemarket.core.domain.Offer;
import com.timemarket.core.domain.OfferHandles;
import com.timemarket.core.domain.OfferStatus;
import com.timemarket.core.domain.RevealState;

import java.math.BigInteger;
import java.time.Instant;

public record OfferResponse(
        long id,
        String creator,
        String title,
        String description,
        BigInteger publicPrice,
        long duration,
        long slots,
        long availableSlots,
        boolean active,
        OfferStatus status,
        Instant createdAt,
        Instant expiresAt,
        RevealState revealState,
        HandlesResponse handles
) {

    public static OfferResponse from(Offer offer) {
        return new OfferResponse(
                offer.id(),
                offer.creator(),
                offer.title(),
                offer.description(),
                offer.publicPrice(),
                offer.duration(),
                offer.slots(),
                offer.availableSlots(),
                offer.active(),
                offer.status(),
                offer.createdAt(),
                offer.expiresAt(),
                offer.revealState(),
                HandlesResponse.from(offer.handles()));
    }

    public record HandlesResponse(String price, String duration, String slots) {

        public static HandlesResponse from(OfferHandles handles) {
            return new HandlesResponse(handles.price().value(), handles.duration().value(), handles.slots().value());
        }
    }
}
