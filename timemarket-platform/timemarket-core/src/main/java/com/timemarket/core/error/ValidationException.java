package com.timemarket.core.error;

/**
 * Input or state precondition failed. Raised before any state change or
 * encrypted import, so a rejected call has no side effects.
 */
public class ValidationException extends MarketplaceException {

    public ValidationException(String message) {
        super("MKT_VALIDATION", message);
    }

    protected ValidationException(String code, String message) {
        super(code, message);
    }
}
