package com.timemarket.core.error;

/**
 * Base type of every failure raised by the marketplace core.
 * Callers that only need to know "the operation was rejected" can catch this;
 * the subclasses carry the reason category.
 */
public class MarketplaceException extends RuntimeException {

    private final String code;

    public MarketplaceException(String code, String message) {
        super(message);
        this.code = code;
    }

    public MarketplaceException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Stable machine-readable error code, e.g. {@code MKT_VALIDATION}.
     */
    public String getCode() {
        return code;
    }
}
