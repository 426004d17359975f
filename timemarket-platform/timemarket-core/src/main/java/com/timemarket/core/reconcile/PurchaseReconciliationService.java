package com.timemarket.core.reconcile;

import com.timemarket.core.domain.Offer;
import com.timemarket.core.domain.Purchase;
import com.timemarket.core.error.ReconciliationException;
import com.timemarket.core.util.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Builds a buyer's purchase history from a {@link ChainDataSource}.
 *
 * <p>Purchases, offers, logs and block timestamps are fetched in parallel on
 * the given executor, each lookup bounded by the configured timeout. A failed
 * lookup never fails the call: it degrades the records that depend on it
 * (missing offer, missing tx hash, or a purchase left out), and a history with
 * missing records is reported as incomplete. If the purchase list itself
 * cannot be read, the history is empty and incomplete.
 *
 * <p>Each log matches at most one purchase. When several purchases share a
 * key, logs are handed out in chain order to purchases in id order.
 */
public class PurchaseReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PurchaseReconciliationService.class);

    public static final Duration DEFAULT_LOOKUP_TIMEOUT = Duration.ofSeconds(10);

    private static final Comparator<PurchaseHistoryItem> BY_PURCHASE_ID =
            Comparator.comparingLong(PurchaseHistoryItem::purchaseId);

    private final ChainDataSource source;
    private final Executor executor;
    private final Duration lookupTimeout;

    public PurchaseReconciliationService(ChainDataSource source, Executor executor, Duration lookupTimeout) {
        this.source = Objects.requireNonNull(source, "Chain data source cannot be null");
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.lookupTimeout = Objects.requireNonNull(lookupTimeout, "Lookup timeout cannot be null");
        if (lookupTimeout.isNegative() || lookupTimeout.isZero()) {
            throw new IllegalArgumentException("Lookup timeout must be positive");
        }
    }

    public List<PurchaseHistoryItem> reconcile(String buyer) {
        return history(buyer, BY_PURCHASE_ID).items();
    }

    public List<PurchaseHistoryItem> reconcile(String buyer, Comparator<PurchaseHistoryItem> order) {
        return history(buyer, order).items();
    }

    public PurchaseHistory history(String buyer) {
        return history(buyer, BY_PURCHASE_ID);
    }

    public PurchaseHistory history(String buyer, Comparator<PurchaseHistoryItem> order) {
        String account = Addresses.normalize(buyer);
        Objects.requireNonNull(order, "Order cannot be null");

        List<Long> purchaseIds;
        try {
            purchaseIds = await(lookup(() -> source.getUserPurchases(account)));
        } catch (RuntimeException e) {
            log.warn("Purchases of {} could not be listed, history is unavailable: {}", account, describe(e));
            return PurchaseHistory.unavailable();
        }
        if (purchaseIds.isEmpty()) {
            return new PurchaseHistory(List.of(), true);
        }

        CompletableFuture<List<PurchaseLog>> logsFuture = lookup(() -> source.fetchPurchaseLogs(account));
        Map<Long, CompletableFuture<Purchase>> purchaseFutures = new LinkedHashMap<>();
        for (Long id : purchaseIds) {
            purchaseFutures.putIfAbsent(id, lookup(() -> source.getPurchase(id)));
        }

        List<Purchase> purchases = new ArrayList<>();
        purchaseFutures.forEach((id, future) -> {
            try {
                purchases.add(await(future));
            } catch (RuntimeException e) {
                log.warn("Purchase {} of {} could not be loaded and is omitted: {}",
                        id, account, describe(e));
            }
        });
        boolean complete = purchases.size() == purchaseFutures.size();
        purchases.sort(Comparator.comparingLong(Purchase::id));

        Map<Long, CompletableFuture<Offer>> offerFutures = new HashMap<>();
        for (Purchase purchase : purchases) {
            offerFutures.computeIfAbsent(purchase.offerId(), offerId -> lookup(() -> source.getOffer(offerId)));
        }

        Map<PurchaseKey, Deque<PurchaseLog>> logsByKey = indexLogs(account, logsFuture);

        Map<Long, Optional<Offer>> offers = new HashMap<>();
        offerFutures.forEach((offerId, future) -> {
            try {
                offers.put(offerId, Optional.of(await(future)));
            } catch (RuntimeException e) {
                log.warn("Offer {} could not be loaded: {}", offerId, describe(e));
                offers.put(offerId, Optional.empty());
            }
        });

        List<PurchaseHistoryItem> items = new ArrayList<>(purchases.size());
        for (Purchase purchase : purchases) {
            Deque<PurchaseLog> candidates = logsByKey.get(PurchaseKey.of(purchase));
            Optional<String> txHash = candidates == null || candidates.isEmpty()
                    ? Optional.empty()
                    : Optional.of(candidates.pollFirst().transactionHash());
            items.add(new PurchaseHistoryItem(purchase.id(), purchase,
                    offers.getOrDefault(purchase.offerId(), Optional.empty()), txHash));
        }
        items.sort(order);

        long reconciled = items.stream().filter(PurchaseHistoryItem::isReconciled).count();
        log.debug("Reconciled {} of {} purchases of {}", reconciled, items.size(), account);
        return new PurchaseHistory(items, complete);
    }

    public PurchaseHistorySummary summarize(String buyer) {
        return history(buyer).summary();
    }

    private Map<PurchaseKey, Deque<PurchaseLog>> indexLogs(String account,
                                                           CompletableFuture<List<PurchaseLog>> logsFuture) {
        List<PurchaseLog> logs;
        try {
            logs = new ArrayList<>(await(logsFuture));
        } catch (RuntimeException e) {
            log.warn("Purchase logs of {} unavailable, history has no transaction hashes: {}",
                    account, describe(e));
            return Map.of();
        }
        logs.sort(PurchaseLog.CHAIN_ORDER);

        Map<Long, CompletableFuture<Instant>> timestampFutures = new HashMap<>();
        for (PurchaseLog entry : logs) {
            timestampFutures.computeIfAbsent(entry.blockNumber(),
                    block -> lookup(() -> source.blockTimestamp(block)));
        }
        Map<Long, Instant> timestamps = new HashMap<>();
        timestampFutures.forEach((block, future) -> {
            try {
                timestamps.put(block, await(future));
            } catch (RuntimeException e) {
                log.warn("Timestamp of block {} unavailable, its logs are skipped: {}", block, describe(e));
            }
        });

        Map<PurchaseKey, Deque<PurchaseLog>> index = new HashMap<>();
        for (PurchaseLog entry : logs) {
            Instant timestamp = timestamps.get(entry.blockNumber());
            if (timestamp != null) {
                index.computeIfAbsent(PurchaseKey.of(entry, timestamp), k -> new ArrayDeque<>()).addLast(entry);
            }
        }
        return index;
    }

    private <T> CompletableFuture<T> lookup(Supplier<T> call) {
        return CompletableFuture.supplyAsync(call, executor)
                .orTimeout(lookupTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static <T> T await(CompletableFuture<T> future) {
        T value = future.join();
        if (value == null) {
            throw new ReconciliationException("Lookup returned no value");
        }
        return value;
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }

    private static String describe(Throwable e) {
        Throwable cause = unwrap(e);
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
