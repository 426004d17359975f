package com.timemarket.core.domain;

import java.math.BigInteger;

public record ContractStats(
        long totalOffersCreated,
        long totalPurchases,
        BigInteger totalVolume,
        long activeOffersCount
) {}
