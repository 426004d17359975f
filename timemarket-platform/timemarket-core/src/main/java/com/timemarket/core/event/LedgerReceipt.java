package com.timemarket.core.event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Receipt of one committed ledger transaction.
 *
 * @param createdId id of the offer or purchase created by the transaction, 0 if none
 */
public record LedgerReceipt(
        String transactionHash,
        long blockNumber,
        Instant blockTimestamp,
        List<LoggedEvent> logs,
        long createdId
) {

    public LedgerReceipt {
        logs = List.copyOf(logs);
    }

    public <E extends MarketplaceEvent> Optional<E> firstEvent(Class<E> type) {
        return logs.stream()
                .map(LoggedEvent::event)
                .filter(type::isInstance)
                .map(type::cast)
                .findFirst();
    }
}
