package com.timemarket.core.domain;

/**
 * Declassification progress of an offer's encrypted price and slots.
 */
public enum RevealState {
    SEALED,
    DECLASSIFIED,
    RESOLVED
}
