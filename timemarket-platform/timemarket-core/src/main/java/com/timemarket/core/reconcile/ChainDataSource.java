package com.timemarket.core.reconcile;

import com.timemarket.core.domain.Offer;
import com.timemarket.core.domain.Purchase;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of marketplace state and its historical purchase logs.
 * Implementations may be eventually consistent: logs can lag behind state.
 * Failures surface as unchecked exceptions, typically
 * {@link com.timemarket.core.error.ReconciliationException}.
 */
public interface ChainDataSource {

    List<Long> getUserPurchases(String buyer);

    Purchase getPurchase(long purchaseId);

    Offer getOffer(long offerId);

    /**
     * {@code OfferPurchased} logs whose buyer is {@code buyer}.
     */
    List<PurchaseLog> fetchPurchaseLogs(String buyer);

    Instant blockTimestamp(long blockNumber);
}
