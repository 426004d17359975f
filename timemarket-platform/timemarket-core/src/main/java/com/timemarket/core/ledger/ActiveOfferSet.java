package com.timemarket.core.ledger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ids of purchasable offers. Add and remove are O(1); removal swaps the last id
 * into the freed position, so iteration order is not creation order.
 */
class ActiveOfferSet {

    private final List<Long> ids = new ArrayList<>();
    private final Map<Long, Integer> positions = new HashMap<>();

    void add(long offerId) {
        if (positions.containsKey(offerId)) {
            throw new IllegalStateException("Offer " + offerId + " is already active");
        }
        positions.put(offerId, ids.size());
        ids.add(offerId);
    }

    /**
     * Removes the id and returns the position it occupied, for {@link #restore}.
     */
    int remove(long offerId) {
        Integer position = positions.remove(offerId);
        if (position == null) {
            throw new IllegalStateException("Offer " + offerId + " is not active");
        }
        int lastIndex = ids.size() - 1;
        long last = ids.remove(lastIndex);
        if (position != lastIndex) {
            ids.set(position, last);
            positions.put(last, position);
        }
        return position;
    }

    /**
     * Undoes {@link #remove}: puts the id back at its former position.
     */
    void restore(long offerId, int position) {
        if (position == ids.size()) {
            add(offerId);
            return;
        }
        long displaced = ids.get(position);
        positions.put(displaced, ids.size());
        ids.add(displaced);
        ids.set(position, offerId);
        positions.put(offerId, position);
    }

    boolean contains(long offerId) {
        return positions.containsKey(offerId);
    }

    int size() {
        return ids.size();
    }

    List<Long> snapshot() {
        return List.copyOf(ids);
    }
}
