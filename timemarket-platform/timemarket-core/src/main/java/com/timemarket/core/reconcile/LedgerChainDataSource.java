package com.timemarket.core.reconcile;

import com.timemarket.core.domain.Offer;
import com.timemarket.core.domain.Purchase;
import com.timemarket.core.error.ReconciliationException;
import com.timemarket.core.event.EventLog;
import com.timemarket.core.event.LoggedEvent;
import com.timemarket.core.event.MarketplaceEvent;
import com.timemarket.core.ledger.OfferLedger;
import com.timemarket.core.util.Addresses;

import java.time.Instant;
import java.util.List;

/**
 * Chain data source over an in-process {@link OfferLedger} and its event log.
 */
public class LedgerChainDataSource implements ChainDataSource {

    private final OfferLedger ledger;
    private final EventLog eventLog;

    public LedgerChainDataSource(OfferLedger ledger) {
        this.ledger = ledger;
        this.eventLog = ledger.getEventLog();
    }

    @Override
    public List<Long> getUserPurchases(String buyer) {
        return ledger.getUserPurchases(buyer);
    }

    @Override
    public Purchase getPurchase(long purchaseId) {
        return ledger.getPurchase(purchaseId);
    }

    @Override
    public Offer getOffer(long offerId) {
        return ledger.getOffer(offerId);
    }

    @Override
    public List<PurchaseLog> fetchPurchaseLogs(String buyer) {
        String account = Addresses.normalize(buyer);
        return eventLog.query(MarketplaceEvent.OfferPurchased.class, e -> Addresses.same(e.buyer(), account))
                .stream()
                .map(LedgerChainDataSource::toPurchaseLog)
                .toList();
    }

    @Override
    public Instant blockTimestamp(long blockNumber) {
        return eventLog.blockTimestamp(blockNumber)
                .orElseThrow(() -> new ReconciliationException("Unknown block " + blockNumber));
    }

    private static PurchaseLog toPurchaseLog(LoggedEvent logged) {
        MarketplaceEvent.OfferPurchased event = (MarketplaceEvent.OfferPurchased) logged.event();
        return new PurchaseLog(event.offerId(), event.buyer(), event.slots(), event.totalPrice(),
                logged.blockNumber(), logged.logIndex(), logged.transactionHash());
    }
}
