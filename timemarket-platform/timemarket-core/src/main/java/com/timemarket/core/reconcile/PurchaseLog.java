package com.timemarket.core.reconcile;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * One decoded {@code OfferPurchased} log entry.
 */
public record PurchaseLog(
        long offerId,
        String buyer,
        long slots,
        BigInteger totalPrice,
        long blockNumber,
        int logIndex,
        String transactionHash
) {

    public static final Comparator<PurchaseLog> CHAIN_ORDER =
            Comparator.comparingLong(PurchaseLog::blockNumber).thenComparingInt(PurchaseLog::logIndex);
}
