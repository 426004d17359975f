package com.timemarket.api.purchase;

import com.timemarket.api.offer.OfferResponse;
import com.timemarket.core.domain.Purchase;
import com.timemarket.core.ledger.OfferLedger;
import com.timemarket.core.reconcile.PurchaseHistory;
import com.timemarket.core.reconcile.PurchaseHistoryItem;
import com.timemarket.core.reconcile.PurchaseHistorySummary;
import com.timemarket.core.reconcile.PurchaseReconciliationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;

/**
 * Purchase records and the reconciled purchase history of a buyer.
 */
@RestController
@RequestMapping("/api/v1/purchases")
public class PurchaseController {

    private static final Comparator<PurchaseHistoryItem> NEWEST_FIRST =
            Comparator.comparing((PurchaseHistoryItem item) -> item.purchase().timestamp())
                    .thenComparingLong(PurchaseHistoryItem::purchaseId)
                    .reversed();

    private final OfferLedger ledger;
    private final PurchaseReconciliationService reconciliationService;
    private final ChainPurchaseHistory chainHistory;

    public PurchaseController(OfferLedger ledger, PurchaseReconciliationService reconciliationService,
                              ChainPurchaseHistory chainHistory) {
        this.ledger = ledger;
        this.reconciliationService = reconciliationService;
        this.chainHistory = chainHistory;
    }

    @GetMapping("/{purchaseId}")
    public ResponseEntity<Purchase> getPurchase(@PathVariable long purchaseId) {
        return ResponseEntity.ok(ledger.getPurchase(purchaseId));
    }

    @GetMapping("/buyer/{address}")
    public ResponseEntity<List<Purchase>> getPurchasesByBuyer(@PathVariable String address) {
        return ResponseEntity.ok(ledger.getPurchasesByBuyer(address));
    }

    /**
     * Purchase history joined with offers and transaction hashes, newest first.
     * GET /api/v1/purchases/buyer/{address}/history
     */
    @GetMapping("/buyer/{address}/history")
    public ResponseEntity<HistoryResponse> getHistory(@PathVariable String address) {
        return ResponseEntity.ok(HistoryResponse.from(reconciliationService.history(address, NEWEST_FIRST)));
    }

    /**
     * The same history read from the deployed contract; 404 when the
     * blockchain integration is disabled.
     */
    @GetMapping("/buyer/{address}/chain-history")
    public ResponseEntity<HistoryResponse> getChainHistory(@PathVariable String address) {
        return chainHistory.history(address, NEWEST_FIRST)
                .map(history -> ResponseEntity.ok(HistoryResponse.from(history)))
                .orElse(ResponseEntity.notFound().build());
    }

    // DTOs
    public record HistoryResponse(List<HistoryEntry> purchases, PurchaseHistorySummary summary) {
        static HistoryResponse from(PurchaseHistory history) {
            return new HistoryResponse(history.items().stream().map(HistoryEntry::from).toList(),
                    history.summary());
        }
    }

    public record HistoryEntry(
        Purchase purchase,
        OfferResponse offer,
        String transactionHash,
        boolean reconciled
    ) {
        static HistoryEntry from(PurchaseHistoryItem item) {
            return new HistoryEntry(
                item.purchase(),
                item.offer().map(OfferResponse::from).orElse(null),
                item.transactionHash().orElse(null),
                item.isReconciled());
        }
    }
}
