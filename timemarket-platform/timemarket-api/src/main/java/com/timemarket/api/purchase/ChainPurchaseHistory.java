package com.timemarket.api.purchase;

import com.timemarket.core.reconcile.ChainDataSource;
import com.timemarket.core.reconcile.PurchaseHistory;
import com.timemarket.core.reconcile.PurchaseHistoryItem;
import com.timemarket.core.reconcile.PurchaseReconciliationService;

import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Purchase history read from the deployed contract, kept apart from the
 * history of the in-process ledger. Empty when the blockchain integration is
 * disabled.
 */
public class ChainPurchaseHistory {

    private final Optional<PurchaseReconciliationService> reconciler;

    public ChainPurchaseHistory(Optional<ChainDataSource> source, Executor executor, Duration lookupTimeout) {
        this.reconciler = source.map(s -> new PurchaseReconciliationService(s, executor, lookupTimeout));
    }

    public boolean isAvailable() {
        return reconciler.isPresent();
    }

    public Optional<PurchaseHistory> history(String buyer, Comparator<PurchaseHistoryItem> order) {
        return reconciler.map(service -> service.history(buyer, order));
    }
}
