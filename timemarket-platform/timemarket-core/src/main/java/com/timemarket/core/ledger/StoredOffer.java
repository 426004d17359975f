package com.timemarket.core.ledger;

import com.timemarket.core.domain.Offer;
import com.timemarket.core.domain.OfferHandles;
import com.timemarket.core.domain.RevealState;
import com.timemarket.core.domain.RevealedValues;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;

/**
 * Mutable ledger-side state of an offer. Only {@link OfferLedger} touches it;
 * everything else sees {@link Offer} snapshots.
 */
final class StoredOffer {

    private final long id;
    private final String creator;
    private final String title;
    private final String description;
    private final BigInteger publicPrice;
    private final long duration;
    private final long slots;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final OfferHandles handles;
    private long availableSlots;
    private boolean active;
    private RevealState revealState;
    private BigInteger revealedPrice;
    private long revealedSlots;

    StoredOffer(long id, String creator, String title, String description, BigInteger publicPrice,
                long duration, long slots, Instant createdAt, Instant expiresAt, OfferHandles handles) {
        this.id = id;
        this.creator = creator;
        this.title = title;
        this.description = description;
        this.publicPrice = publicPrice;
        this.duration = duration;
        this.slots = slots;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.handles = handles;
        this.availableSlots = slots;
        this.active = true;
        this.revealState = RevealState.SEALED;
    }

    /**
     * Takes {@code quantity} slots. Returns true if this exhausted the offer.
     */
    boolean consume(long quantity) {
        if (quantity > availableSlots) {
            throw new IllegalStateException("Cannot consume " + quantity + " of " + availableSlots + " slots");
        }
        availableSlots -= quantity;
        if (availableSlots == 0) {
            active = false;
            return true;
        }
        return false;
    }

    void unconsume(long quantity, boolean wasActive) {
        availableSlots += quantity;
        active = wasActive;
    }

    void deactivate() {
        active = false;
    }

    void declassify() {
        revealState = RevealState.DECLASSIFIED;
    }

    void resolve(BigInteger price, long slotsValue) {
        revealedPrice = price;
        revealedSlots = slotsValue;
        revealState = RevealState.RESOLVED;
    }

    long id() {
        return id;
    }

    String creator() {
        return creator;
    }

    BigInteger publicPrice() {
        return publicPrice;
    }

    long availableSlots() {
        return availableSlots;
    }

    boolean active() {
        return active;
    }

    Instant expiresAt() {
        return expiresAt;
    }

    OfferHandles handles() {
        return handles;
    }

    RevealState revealState() {
        return revealState;
    }

    Optional<RevealedValues> revealed() {
        return revealState == RevealState.RESOLVED
                ? Optional.of(new RevealedValues(id, revealedPrice, revealedSlots))
                : Optional.empty();
    }

    Offer toOffer() {
        return new Offer(id, creator, title, description, publicPrice, duration, slots, availableSlots, active,
                createdAt, expiresAt, handles.price(), handles.duration(), handles.slots(), revealState);
    }
}
