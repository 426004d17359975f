package com.timemarket.core.error;

public class OfferNotFoundException extends ValidationException {

    private final long offerId;

    public OfferNotFoundException(long offerId) {
        super("MKT_OFFER_NOT_FOUND", "Offer not found: " + offerId);
        this.offerId = offerId;
    }

    public long getOfferId() {
        return offerId;
    }
}
