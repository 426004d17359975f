package com.timemarket.core.error;

/**
 * Caller is not allowed to perform the operation (wrong creator, not the owner).
 */
public class AuthorizationException extends MarketplaceException {

    public AuthorizationException(String message) {
        super("MKT_UNAUTHORIZED", message);
    }
}
