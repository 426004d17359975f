package com.timemarket.core.reconcile;

import java.math.BigInteger;
import java.util.List;

public record PurchaseHistorySummary(
        int purchaseCount,
        long totalSlots,
        BigInteger totalSpent,
        int reconciledCount,
        boolean complete
) {

    public static PurchaseHistorySummary of(List<PurchaseHistoryItem> items, boolean complete) {
        long slots = 0;
        BigInteger spent = BigInteger.ZERO;
        int reconciled = 0;
        for (PurchaseHistoryItem item : items) {
            slots += item.purchase().slots();
            spent = spent.add(item.purchase().totalPrice());
            if (item.isReconciled()) {
                reconciled++;
            }
        }
        return new PurchaseHistorySummary(items.size(), slots, spent, reconciled, complete);
    }
}
