package com.timemarket.core.reconcile;

import java.util.List;

/**
 * A buyer's reconciled purchases. {@code complete} is false when the purchase
 * list could not be read or some purchase could not be loaded, so
 * {@code items} may be missing records.
 */
public record PurchaseHistory(List<PurchaseHistoryItem> items, boolean complete) {

    public PurchaseHistory {
        items = List.copyOf(items);
    }

    public static PurchaseHistory unavailable() {
        return new PurchaseHistory(List.of(), false);
    }

    public PurchaseHistorySummary summary() {
        return PurchaseHistorySummary.of(items, complete);
    }
}
