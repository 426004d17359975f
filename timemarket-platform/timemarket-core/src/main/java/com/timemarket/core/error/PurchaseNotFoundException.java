package com.timemarket.core.error;

public class PurchaseNotFoundException extends ValidationException {

    private final long purchaseId;

    public PurchaseNotFoundException(long purchaseId) {
        super("MKT_PURCHASE_NOT_FOUND", "Purchase not found: " + purchaseId);
        this.purchaseId = purchaseId;
    }

    public long getPurchaseId() {
        return purchaseId;
    }
}
