package com.timemarket.core.error;

/**
 * The chain data source could not be read or returned a malformed log entry.
 * The reconciliation indexer catches it and degrades the affected record.
 */
public class ReconciliationException extends MarketplaceException {

    public ReconciliationException(String message) {
        super("MKT_RECONCILIATION", message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super("MKT_RECONCILIATION", message, cause);
    }
}
