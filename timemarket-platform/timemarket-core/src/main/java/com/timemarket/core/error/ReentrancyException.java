package com.timemarket.core.error;

/**
 * A ledger operation was invoked while a value-moving operation was still in
 * progress on the same ledger.
 */
public class ReentrancyException extends PaymentException {

    public ReentrancyException(String message) {
        super("MKT_REENTRANT_CALL", message);
    }
}
