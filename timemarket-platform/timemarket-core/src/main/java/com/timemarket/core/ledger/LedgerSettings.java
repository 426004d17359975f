package com.timemarket.core.ledger;

import com.timemarket.core.domain.FeeSplit;
import com.timemarket.core.util.Addresses;

/**
 * Initial platform settings of a ledger.
 *
 * @param contractAddress address the ledger is deployed at; encrypted inputs are bound to it
 * @param owner           platform owner, allowed to run admin operations
 * @param treasury        receiver of platform fees
 * @param platformFeeBps  fee in basis points, at most {@link FeeSplit#MAX_FEE_BPS}
 */
public record LedgerSettings(String contractAddress, String owner, String treasury, int platformFeeBps) {

    public static final int DEFAULT_FEE_BPS = 250;

    public LedgerSettings {
        contractAddress = Addresses.requireNonZero(contractAddress, "Contract address");
        owner = Addresses.requireNonZero(owner, "Owner");
        treasury = Addresses.requireNonZero(treasury, "Treasury");
        FeeSplit.requireValidFee(platformFeeBps);
    }
}
