package com.timemarket.core.event;

import java.time.Instant;

/**
 * An event as stored in the log, with the identity of the transaction that
 * emitted it.
 */
public record LoggedEvent(
        long blockNumber,
        Instant blockTimestamp,
        String transactionHash,
        int logIndex,
        MarketplaceEvent event
) {}
