package com.timemarket.core.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Immutable record of one purchase. {@code timestamp} is the block timestamp
 * of the purchasing transaction.
 */
public record Purchase(
        long id,
        long offerId,
        String buyer,
        long slots,
        BigInteger totalPrice,
        Instant timestamp
) {}
