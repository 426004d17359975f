package com.timemarket.core.event;

import com.timemarket.core.util.HexBytes;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Append-only event log of a local ledger. Every committed transaction gets its
 * own block, so block numbers and transaction hashes are one-to-one.
 * Transaction hashes are hash-chained over the previous hash.
 */
public class EventLog {

    private static final String GENESIS_HASH = "0x0000000000000000000000000000000000000000000000000000000000000000";

    private final List<LoggedEvent> entries = new CopyOnWriteArrayList<>();
    private final Map<Long, Instant> blockTimestamps = new ConcurrentHashMap<>();
    private long lastBlock;
    private String lastTransactionHash = GENESIS_HASH;

    /**
     * Commits the events of one transaction and returns its receipt. An empty
     * event list still produces a block.
     */
    public synchronized LedgerReceipt commit(String from, String function, Instant timestamp,
                                             List<MarketplaceEvent> events, long createdId) {
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        long blockNumber = ++lastBlock;
        String txHash = HexBytes.toHex(HexBytes.sha256(String.join("|",
                lastTransactionHash,
                Long.toString(blockNumber),
                String.valueOf(from),
                function,
                Long.toString(timestamp.getEpochSecond())).getBytes(StandardCharsets.UTF_8)));

        List<LoggedEvent> logs = new ArrayList<>(events.size());
        for (MarketplaceEvent event : events) {
            LoggedEvent logged = new LoggedEvent(blockNumber, timestamp, txHash, entries.size(), event);
            entries.add(logged);
            logs.add(logged);
        }
        blockTimestamps.put(blockNumber, timestamp);
        lastTransactionHash = txHash;
        return new LedgerReceipt(txHash, blockNumber, timestamp, logs, createdId);
    }

    public List<LoggedEvent> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public <E extends MarketplaceEvent> List<LoggedEvent> query(Class<E> type, Predicate<E> filter) {
        return entries.stream()
                .filter(e -> type.isInstance(e.event()))
                .filter(e -> filter.test(type.cast(e.event())))
                .toList();
    }

    public Optional<Instant> blockTimestamp(long blockNumber) {
        return Optional.ofNullable(blockTimestamps.get(blockNumber));
    }

    public synchronized long latestBlock() {
        return lastBlock;
    }

    public int size() {
        return entries.size();
    }
}
