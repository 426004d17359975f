package com.timemarket.api;

import com.timemarket.core.event.LedgerReceipt;

import java.time.Instant;

/**
 * Receipt of a committed ledger transaction as returned by the API.
 *
 * @param createdId id of the created offer or purchase, 0 if the call created nothing
 */
public record TransactionResponse(
        String transactionHash,
        long blockNumber,
        Instant blockTimestamp,
        long createdId,
        int eventCount
) {

    public static TransactionResponse from(LedgerReceipt receipt) {
        return new TransactionResponse(receipt.transactionHash(), receipt.blockNumber(),
                receipt.blockTimestamp(), receipt.createdId(), receipt.logs().size());
    }
}
