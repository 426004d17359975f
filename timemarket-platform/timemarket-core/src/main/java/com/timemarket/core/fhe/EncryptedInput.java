package com.timemarket.core.fhe;

import java.util.List;

/**
 * Result of finalizing one encrypted input session: one handle per appended
 * value, in append order, and the single proof that covers all of them.
 */
public record EncryptedInput(List<EncryptedHandle> handles, InputProof proof) {

    public EncryptedInput {
        handles = List.copyOf(handles);
    }

    public EncryptedHandle handle(int index) {
        return handles.get(index);
    }

    public int size() {
        return handles.size();
    }
}
