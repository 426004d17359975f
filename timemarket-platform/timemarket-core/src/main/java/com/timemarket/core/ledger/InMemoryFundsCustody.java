package com.timemarket.core.ledger;

import com.timemarket.core.error.PaymentException;
import com.timemarket.core.util.Addresses;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * Account balances kept in memory, for a local ledger and for tests.
 *
 * <p>Recipients can be configured to reject payments, and a payment hook runs
 * after each credit the way a recipient's fallback code would on chain.
 */
public class InMemoryFundsCustody implements FundsCustody {

    private final String contractAddress;
    private final Map<String, BigInteger> balances = new HashMap<>();
    private final List<Journal> openJournals = new ArrayList<>();
    private final Set<String> rejectingRecipients = ConcurrentHashMap.newKeySet();
    private volatile BiConsumer<String, BigInteger> paymentHook = (to, amount) -> {};

    public InMemoryFundsCustody(String contractAddress) {
        this.contractAddress = Addresses.normalize(contractAddress);
    }

    /**
     * Credits an external account, e.g. to fund a buyer's wallet.
     */
    public synchronized void deposit(String account, BigInteger amount) {
        requirePositive(amount);
        credit(Addresses.normalize(account), amount);
    }

    public synchronized BigInteger balanceOf(String account) {
        return balances.getOrDefault(Addresses.normalize(account), BigInteger.ZERO);
    }

    public void rejectPaymentsTo(String account) {
        rejectingRecipients.add(Addresses.normalize(account));
    }

    public void acceptPaymentsTo(String account) {
        rejectingRecipients.remove(Addresses.normalize(account));
    }

    public void setPaymentHook(BiConsumer<String, BigInteger> hook) {
        this.paymentHook = Objects.requireNonNull(hook, "Hook cannot be null");
    }

    @Override
    public void collect(String from, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        synchronized (this) {
            String payer = Addresses.normalize(from);
            BigInteger available = balances.getOrDefault(payer, BigInteger.ZERO);
            if (available.compareTo(amount) < 0) {
                throw new PaymentException("Insufficient balance for " + payer + ": has " + available + ", needs " + amount);
            }
            debit(payer, available, amount);
            credit(contractAddress, amount);
        }
    }

    @Override
    public void pay(String to, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        String recipient = Addresses.normalize(to);
        synchronized (this) {
            if (rejectingRecipients.contains(recipient)) {
                throw new PaymentException("Transfer to " + recipient + " failed");
            }
            BigInteger held = balances.getOrDefault(contractAddress, BigInteger.ZERO);
            if (held.compareTo(amount) < 0) {
                throw new PaymentException("Contract balance " + held + " cannot cover transfer of " + amount);
            }
            debit(contractAddress, held, amount);
            credit(recipient, amount);
        }
        paymentHook.accept(recipient, amount);
    }

    @Override
    public synchronized BigInteger contractBalance() {
        return balances.getOrDefault(contractAddress, BigInteger.ZERO);
    }

    /**
     * Opens a journal that records the prior balance of each account the
     * following movements touch, until it is reverted or released.
     */
    @Override
    public synchronized Checkpoint checkpoint() {
        Journal journal = new Journal();
        openJournals.add(journal);
        return journal;
    }

    @Override
    public synchronized void revertTo(Checkpoint checkpoint) {
        Journal journal = close(checkpoint);
        journal.previous.forEach((account, balance) -> {
            if (balance == null) {
                balances.remove(account);
            } else {
                balances.put(account, balance);
            }
        });
    }

    @Override
    public synchronized void release(Checkpoint checkpoint) {
        close(checkpoint);
    }

    int openCheckpoints() {
        return openJournals.size();
    }

    /**
     * Removes the journal and any journal opened after it.
     */
    private Journal close(Checkpoint checkpoint) {
        int position = checkpoint instanceof Journal ? openJournals.indexOf(checkpoint) : -1;
        if (position < 0) {
            throw new IllegalArgumentException("Checkpoint is not open in this custody");
        }
        Journal journal = openJournals.get(position);
        openJournals.subList(position, openJournals.size()).clear();
        return journal;
    }

    private void credit(String account, BigInteger amount) {
        remember(account);
        balances.merge(account, amount, BigInteger::add);
    }

    private void debit(String account, BigInteger current, BigInteger amount) {
        remember(account);
        balances.put(account, current.subtract(amount));
    }

    private void remember(String account) {
        for (Journal journal : openJournals) {
            if (!journal.previous.containsKey(account)) {
                journal.previous.put(account, balances.get(account));
            }
        }
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }

    private static final class Journal implements Checkpoint {
        private final Map<String, BigInteger> previous = new HashMap<>();
    }
}
