package com.timemarket.core.ledger;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Undo log of in-memory ledger writes made by one operation, replayed in
 * reverse when a later step of the operation fails.
 */
final class LedgerJournal {

    private final Deque<Runnable> undo = new ArrayDeque<>();

    void record(Runnable undoAction) {
        undo.push(undoAction);
    }

    void rollback() {
        while (!undo.isEmpty()) {
            undo.pop().run();
        }
    }
}
