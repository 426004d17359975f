package com.timemarket.core.ledger;

import java.math.BigInteger;

/**
 * Value held and moved by the ledger contract. A failing movement throws
 * {@link com.timemarket.core.error.PaymentException}; callers undo earlier
 * movements of the same operation with {@link #revertTo(Checkpoint)} or keep
 * them with {@link #release(Checkpoint)}.
 */
public interface FundsCustody {

    /**
     * Moves {@code amount} from {@code from} into the contract balance (the
     * value attached to a call).
     */
    void collect(String from, BigInteger amount);

    /**
     * Moves {@code amount} from the contract balance to {@code to}.
     */
    void pay(String to, BigInteger amount);

    BigInteger contractBalance();

    Checkpoint checkpoint();

    void revertTo(Checkpoint checkpoint);

    /**
     * Keeps the movements made since {@code checkpoint}.
     */
    void release(Checkpoint checkpoint);

    /**
     * Opaque marker of balances at a point in time.
     */
    interface Checkpoint {}
}
