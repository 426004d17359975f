package com.timemarket.core.domain;

/**
 * Purchasing state of an offer. EXHAUSTED and DEACTIVATED are terminal.
 * Expiry is not a state: it is checked at purchase time.
 */
public enum OfferStatus {
    ACTIVE,
    EXHAUSTED,
    DEACTIVATED
}
