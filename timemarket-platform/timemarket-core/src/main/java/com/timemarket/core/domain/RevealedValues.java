package com.timemarket.core.domain;

import java.math.BigInteger;

public record RevealedValues(long offerId, BigInteger price, long slots) {}
