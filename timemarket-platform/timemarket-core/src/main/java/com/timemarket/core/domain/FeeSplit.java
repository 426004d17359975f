package com.timemarket.core.domain;

import com.timemarket.core.error.ValidationException;

import java.math.BigInteger;

/**
 * Division of a purchase price between the platform treasury and the creator.
 * The fee is rounded down, so {@code fee + creatorAmount == totalPrice} always.
 */
public record FeeSplit(BigInteger totalPrice, BigInteger fee, BigInteger creatorAmount) {

    public static final int BPS_DENOMINATOR = 10_000;
    public static final int MAX_FEE_BPS = 1_000;

    public static FeeSplit of(BigInteger totalPrice, int feeBps) {
        requireValidFee(feeBps);
        if (totalPrice == null || totalPrice.signum() < 0) {
            throw new ValidationException("Total price must be non-negative");
        }
        BigInteger fee = totalPrice.multiply(BigInteger.valueOf(feeBps)).divide(BigInteger.valueOf(BPS_DENOMINATOR));
        return new FeeSplit(totalPrice, fee, totalPrice.subtract(fee));
    }

    public static void requireValidFee(int feeBps) {
        if (feeBps < 0 || feeBps > MAX_FEE_BPS) {
            throw new ValidationException("Platform fee must be between 0 and " + MAX_FEE_BPS + " bps, got " + feeBps);
        }
    }
}
