package com.timemarket.core.reconcile;

import com.timemarket.core.domain.Purchase;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Correlation key between a purchase record and its log: neither carries the
 * other's identity, so they are matched on content and block time.
 */
record PurchaseKey(long offerId, long slots, BigInteger totalPrice, long epochSecond) {

    static PurchaseKey of(Purchase purchase) {
        return new PurchaseKey(purchase.offerId(), purchase.slots(), purchase.totalPrice(),
                purchase.timestamp().getEpochSecond());
    }

    static PurchaseKey of(PurchaseLog log, Instant blockTimestamp) {
        return new PurchaseKey(log.offerId(), log.slots(), log.totalPrice(), blockTimestamp.getEpochSecond());
    }
}
