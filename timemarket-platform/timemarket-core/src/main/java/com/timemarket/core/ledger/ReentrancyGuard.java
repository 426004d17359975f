package com.timemarket.core.ledger;

import com.timemarket.core.error.ReentrancyException;

/**
 * Scoped non-reentrancy lock for value-moving operations. Use with
 * try-with-resources so the lock is released on every exit path.
 */
public class ReentrancyGuard {

    private boolean entered;

    public synchronized Scope enter() {
        if (entered) {
            throw new ReentrancyException("Reentrant call rejected");
        }
        entered = true;
        return new Scope();
    }

    /**
     * Rejects a call made while a guarded operation is in progress.
     */
    public synchronized void ensureNotEntered() {
        if (entered) {
            throw new ReentrancyException("Ledger is busy with a value transfer");
        }
    }

    public synchronized boolean isEntered() {
        return entered;
    }

    private synchronized void release() {
        entered = false;
    }

    public final class Scope implements AutoCloseable {

        private boolean closed;

        private Scope() {}

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                release();
            }
        }
    }
}
