package com.timemarket.core.reconcile;

import com.timemarket.core.domain.Offer;
import com.timemarket.core.domain.Purchase;

import java.util.Optional;

/**
 * A purchase joined with its offer and, when a matching log was found, the
 * hash of the transaction that made it.
 */
public record PurchaseHistoryItem(
        long purchaseId,
        Purchase purchase,
        Optional<Offer> offer,
        Optional<String> transactionHash
) {

    public boolean isReconciled() {
        return transactionHash.isPresent();
    }
}
