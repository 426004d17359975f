package com.timemarket.core.error;

/**
 * Payment was insufficient or a transfer leg failed. Nothing from the
 * enclosing operation is persisted.
 */
public class PaymentException extends MarketplaceException {

    public PaymentException(String message) {
        super("MKT_PAYMENT", message);
    }

    public PaymentException(String message, Throwable cause) {
        super("MKT_PAYMENT", message, cause);
    }

    protected PaymentException(String code, String message) {
        super(code, message);
    }
}
