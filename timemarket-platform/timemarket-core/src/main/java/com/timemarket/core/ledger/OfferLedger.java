package com.timemarket.core.ledger;

import com.timemarket.core.domain.ContractStats;
import com.timemarket.core.domain.FeeSplit;
import com.timemarket.core.domain.Offer;
import com.timemarket.core.domain.OfferHandles;
import com.timemarket.core.domain.Purchase;
import com.timemarket.core.domain.RevealState;
import com.timemarket.core.domain.RevealedValues;
import com.timemarket.core.error.AuthorizationException;
import com.timemarket.core.error.OfferNotFoundException;
import com.timemarket.core.error.PaymentException;
import com.timemarket.core.error.ProofVerificationException;
import com.timemarket.core.error.PurchaseNotFoundException;
import com.timemarket.core.error.ValidationException;
import com.timemarket.core.event.EventLog;
import com.timemarket.core.event.LedgerReceipt;
import com.timemarket.core.event.MarketplaceEvent;
import com.timemarket.core.fhe.AccessControlList;
import com.timemarket.core.fhe.DecryptionVerifier;
import com.timemarket.core.fhe.EncryptedHandle;
import com.timemarket.core.fhe.FheCoprocessor;
import com.timemarket.core.fhe.FheType;
import com.timemarket.core.fhe.InputProof;
import com.timemarket.core.fhe.VerificationResult;
import com.timemarket.core.util.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Authoritative state machine of the marketplace: offers, purchases, platform
 * settings and the value moved between buyers, creators and the treasury.
 *
 * <p>Offers and purchases live in append-only arenas keyed by sequential ids
 * starting at 1; the creator, buyer and active-offer indices hold ids only.
 * Mutations are serialized. Value-moving operations also hold a
 * {@link ReentrancyGuard} scope for their whole duration and update ledger
 * state before moving funds; if a transfer fails, state and balances are
 * rolled back and nothing is logged.
 *
 * <p>Every successful mutation is one transaction in the {@link EventLog} and
 * returns its {@link LedgerReceipt}.
 */
public class OfferLedger {

    private static final Logger log = LoggerFactory.getLogger(OfferLedger.class);

    private static final long SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    private final String contractAddress;
    private final FheCoprocessor fhe;
    private final DecryptionVerifier decryptionVerifier;
    private final FundsCustody custody;
    private final EventLog eventLog;
    private final Clock clock;
    private final ReentrancyGuard guard = new ReentrancyGuard();

    private final List<StoredOffer> offers = new ArrayList<>();
    private final List<Purchase> purchases = new ArrayList<>();
    private final Map<String, List<Long>> offersByCreator = new HashMap<>();
    private final Map<String, List<Long>> purchasesByBuyer = new HashMap<>();
    private final ActiveOfferSet activeOffers = new ActiveOfferSet();

    private String owner;
    private String treasury;
    private int platformFeeBps;
    private long totalOffersCreated;
    private long totalPurchases;
    private BigInteger totalVolume = BigInteger.ZERO;

    public OfferLedger(LedgerSettings settings, FheCoprocessor fhe, DecryptionVerifier decryptionVerifier,
                       FundsCustody custody, EventLog eventLog, Clock clock) {
        Objects.requireNonNull(settings, "Settings cannot be null");
        this.contractAddress = settings.contractAddress();
        this.owner = settings.owner();
        this.treasury = settings.treasury();
        this.platformFeeBps = settings.platformFeeBps();
        this.fhe = Objects.requireNonNull(fhe, "FHE coprocessor cannot be null");
        this.decryptionVerifier = Objects.requireNonNull(decryptionVerifier, "Decryption verifier cannot be null");
        this.custody = Objects.requireNonNull(custody, "Funds custody cannot be null");
        this.eventLog = Objects.requireNonNull(eventLog, "Event log cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    // ==================== Offer creation ====================

    /**
     * Creates an offer from plaintext values. The ledger encrypts the price,
     * duration and slots itself so every offer carries encrypted handles.
     */
    public synchronized LedgerReceipt createOffer(String creator, String title, String description,
                                                  BigInteger price, long durationDays, long slots) {
        guard.ensureNotEntered();
        String caller = Addresses.normalize(creator);
        validateOfferFields(title, description, price, durationDays, slots);

        OfferHandles handles = new OfferHandles(
                fhe.trivialEncrypt(price, FheType.EUINT64),
                fhe.trivialEncrypt(BigInteger.valueOf(durationDays), FheType.EUINT32),
                fhe.trivialEncrypt(BigInteger.valueOf(slots), FheType.EUINT32));
        return storeOffer(caller, title, description, price, durationDays, slots, handles, "createOffer");
    }

    /**
     * Creates an offer whose price, duration and slots were encrypted client-side
     * in one input bundle. All three handles must be covered by {@code proof},
     * issued for this contract and for {@code creator}.
     *
     * @throws ValidationException         if a plain field is invalid; checked before any import
     * @throws ProofVerificationException  if any handle is not authenticated by the proof
     */
    public synchronized LedgerReceipt createOfferEncrypted(String creator, String title, String description,
                                                           BigInteger displayPrice, long durationDays, long slots,
                                                           EncryptedHandle priceHandle,
                                                           EncryptedHandle durationHandle,
                                                           EncryptedHandle slotsHandle,
                                                           InputProof proof) {
        guard.ensureNotEntered();
        String caller = Addresses.normalize(creator);
        validateOfferFields(title, description, displayPrice, durationDays, slots);
        if (priceHandle == null || durationHandle == null || slotsHandle == null || proof == null) {
            throw new ValidationException("Encrypted price, duration, slots and proof are required");
        }

        OfferHandles handles;
        try {
            handles = new OfferHandles(
                    fhe.verifyInput(priceHandle, proof, contractAddress, caller, FheType.EUINT64),
                    fhe.verifyInput(durationHandle, proof, contractAddress, caller, FheType.EUINT32),
                    fhe.verifyInput(slotsHandle, proof, contractAddress, caller, FheType.EUINT32));
        } catch (ProofVerificationException e) {
            log.warn("Rejected encrypted offer from {}: {}", caller, e.getMessage());
            throw e;
        }
        return storeOffer(caller, title, description, displayPrice, durationDays, slots, handles,
                "createOfferWithFHE");
    }

    private LedgerReceipt storeOffer(String creator, String title, String description, BigInteger price,
                                     long durationDays, long slots, OfferHandles handles, String function) {
        AccessControlList acl = fhe.acl();
        for (EncryptedHandle handle : List.of(handles.price(), handles.duration(), handles.slots())) {
            acl.allow(handle, contractAddress);
            acl.allow(handle, creator);
        }

        Instant now = now();
        long offerId = offers.size() + 1L;
        Instant expiresAt = now.plusSeconds(durationDays * SECONDS_PER_DAY);
        StoredOffer offer = new StoredOffer(offerId, creator, title, description, price, durationDays, slots,
                now, expiresAt, handles);
        offers.add(offer);
        offersByCreator.computeIfAbsent(creator, k -> new ArrayList<>()).add(offerId);
        activeOffers.add(offerId);
        totalOffersCreated++;

        log.info("Offer {} created by {}: {} slots at {} for {} days", offerId, creator, slots, price, durationDays);
        return eventLog.commit(creator, function, now,
                List.of(new MarketplaceEvent.OfferCreated(offerId, creator, title, price, durationDays, slots)),
                offerId);
    }

    // ==================== Purchase ====================

    /**
     * Buys {@code quantity} slots of an active, unexpired offer. The fee goes to
     * the treasury, the rest to the creator, and any overpayment back to the
     * buyer. A failing transfer aborts the whole purchase.
     */
    public synchronized LedgerReceipt purchaseOffer(String buyer, long offerId, long quantity, BigInteger payment) {
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            String caller = Addresses.normalize(buyer);
            StoredOffer offer = requireOffer(offerId);
            Instant now = now();

            if (quantity <= 0) {
                throw new ValidationException("Quantity must be positive");
            }
            if (!offer.active()) {
                throw new ValidationException("Offer " + offerId + " is not active");
            }
            if (quantity > offer.availableSlots()) {
                throw new ValidationException("Only " + offer.availableSlots() + " slots available");
            }
            if (now.isAfter(offer.expiresAt())) {
                throw new ValidationException("Offer " + offerId + " has expired");
            }
            if (Addresses.same(caller, offer.creator())) {
                throw new ValidationException("Creator cannot purchase own offer");
            }
            BigInteger totalPrice = offer.publicPrice().multiply(BigInteger.valueOf(quantity));
            if (payment == null || payment.compareTo(totalPrice) < 0) {
                throw new PaymentException("Insufficient payment: required " + totalPrice + ", got " + payment);
            }
            FeeSplit split = FeeSplit.of(totalPrice, platformFeeBps);

            FundsCustody.Checkpoint checkpoint = custody.checkpoint();
            LedgerJournal journal = new LedgerJournal();
            Purchase purchase;
            try {
                custody.collect(caller, payment);
                purchase = applyPurchase(offer, caller, quantity, totalPrice, now, journal);
                custody.pay(treasury, split.fee());
                custody.pay(offer.creator(), split.creatorAmount());
                custody.pay(caller, payment.subtract(totalPrice));
            } catch (RuntimeException e) {
                journal.rollback();
                custody.revertTo(checkpoint);
                log.warn("Purchase of offer {} by {} aborted: {}", offerId, caller, e.getMessage());
                throw e;
            }
            custody.release(checkpoint);

            log.info("Offer {} purchased by {}: {} slots for {} (fee {}), {} left",
                    offerId, caller, quantity, totalPrice, split.fee(), offer.availableSlots());
            return eventLog.commit(caller, "purchaseOffer", now,
                    List.of(new MarketplaceEvent.OfferPurchased(
                            offerId, caller, quantity, totalPrice, offer.availableSlots())),
                    purchase.id());
        }
    }

    private Purchase applyPurchase(StoredOffer offer, String buyer, long quantity, BigInteger totalPrice,
                                   Instant now, LedgerJournal journal) {
        boolean wasActive = offer.active();
        boolean exhausted = offer.consume(quantity);
        journal.record(() -> offer.unconsume(quantity, wasActive));
        if (exhausted) {
            int position = activeOffers.remove(offer.id());
            journal.record(() -> activeOffers.restore(offer.id(), position));
        }

        Purchase purchase = new Purchase(purchases.size() + 1L, offer.id(), buyer, quantity, totalPrice, now);
        purchases.add(purchase);
        journal.record(() -> purchases.remove(purchases.size() - 1));

        List<Long> buyerPurchases = purchasesByBuyer.computeIfAbsent(buyer, k -> new ArrayList<>());
        buyerPurchases.add(purchase.id());
        journal.record(() -> buyerPurchases.remove(buyerPurchases.size() - 1));

        BigInteger previousVolume = totalVolume;
        totalPurchases++;
        totalVolume = totalVolume.add(totalPrice);
        journal.record(() -> {
            totalPurchases--;
            totalVolume = previousVolume;
        });
        return purchase;
    }

    // ==================== Deactivation ====================

    public synchronized LedgerReceipt deactivateOffer(String caller, long offerId) {
        guard.ensureNotEntered();
        String sender = Addresses.normalize(caller);
        StoredOffer offer = requireOffer(offerId);
        if (!Addresses.same(sender, offer.creator()) && !Addresses.same(sender, owner)) {
            throw new AuthorizationException("Only the creator or the owner can deactivate offer " + offerId);
        }
        if (!offer.active()) {
            throw new ValidationException("Offer " + offerId + " is not active");
        }
        offer.deactivate();
        activeOffers.remove(offerId);

        log.info("Offer {} deactivated by {}", offerId, sender);
        return eventLog.commit(sender, "deactivateOffer", now(),
                List.of(new MarketplaceEvent.OfferDeactivated(offerId, offer.creator())), 0L);
    }

    // ==================== Reveal / callback ====================

    /**
     * Marks the offer's price and slots handles publicly decryptable. The
     * emitted event lists exactly the handles the callback must cover.
     */
    public synchronized LedgerReceipt requestReveal(String caller, long offerId) {
        guard.ensureNotEntered();
        String sender = Addresses.normalize(caller);
        StoredOffer offer = requireOffer(offerId);
        if (!Addresses.same(sender, offer.creator()) && !Addresses.same(sender, owner)) {
            throw new AuthorizationException("Only the creator or the owner can reveal offer " + offerId);
        }
        if (offer.revealState() == RevealState.RESOLVED) {
            throw new ValidationException("Offer " + offerId + " is already revealed");
        }

        List<EncryptedHandle> handles = offer.handles().revealable();
        handles.forEach(fhe.acl()::makePubliclyDecryptable);
        offer.declassify();

        log.info("Reveal requested for offer {} by {}", offerId, sender);
        return eventLog.commit(sender, "requestTallyReveal", now(),
                List.of(new MarketplaceEvent.RevealRequested(offerId, handles)), 0L);
    }

    /**
     * Accepts the oracle's cleartexts for a declassified offer. The handle list
     * checked against the proof is rebuilt from the offer itself; the cleartext
     * is not looked at until verification has succeeded.
     *
     * @throws ProofVerificationException if the proof does not bind the cleartexts to the offer's handles
     */
    public synchronized LedgerReceipt resolveCallback(String caller, long offerId,
                                                      byte[] cleartexts, byte[] decryptionProof) {
        guard.ensureNotEntered();
        String sender = Addresses.normalize(caller);
        StoredOffer offer = requireOffer(offerId);
        if (offer.revealState() != RevealState.DECLASSIFIED) {
            throw new ValidationException("Offer " + offerId + " has no pending reveal");
        }

        List<EncryptedHandle> handles = offer.handles().revealable();
        VerificationResult result = decryptionVerifier.verify(handles, cleartexts, decryptionProof);
        if (!(result instanceof VerificationResult.Verified verified)) {
            String reason = ((VerificationResult.Rejected) result).reason();
            log.warn("Rejected reveal callback for offer {} from {}: {}", offerId, sender, reason);
            throw new ProofVerificationException("Invalid decryption proof for offer " + offerId + ": " + reason);
        }

        BigInteger price = verified.values().get(0);
        BigInteger slots = verified.values().get(1);
        if (!FheType.EUINT64.fits(price) || !FheType.EUINT32.fits(slots)) {
            throw new ProofVerificationException("Decrypted values out of range for offer " + offerId);
        }
        offer.resolve(price, slots.longValueExact());

        log.info("Reveal resolved for offer {}", offerId);
        return eventLog.commit(sender, "resolveTallyCallback", now(),
                List.of(new MarketplaceEvent.RevealResolved(offerId, price, slots.longValueExact())), 0L);
    }

    // ==================== Admin ====================

    public synchronized LedgerReceipt updatePlatformFee(String caller, int newFeeBps) {
        guard.ensureNotEntered();
        String sender = requireOwner(caller);
        FeeSplit.requireValidFee(newFeeBps);
        int oldFee = platformFeeBps;
        platformFeeBps = newFeeBps;
        log.info("Platform fee changed from {} to {} bps", oldFee, newFeeBps);
        return eventLog.commit(sender, "updatePlatformFee", now(),
                List.of(new MarketplaceEvent.PlatformFeeUpdated(oldFee, newFeeBps)), 0L);
    }

    public synchronized LedgerReceipt updateTreasury(String caller, String newTreasury) {
        guard.ensureNotEntered();
        String sender = requireOwner(caller);
        String next = Addresses.requireNonZero(newTreasury, "Treasury");
        String old = treasury;
        treasury = next;
        log.info("Treasury changed from {} to {}", old, next);
        return eventLog.commit(sender, "updateTreasury", now(),
                List.of(new MarketplaceEvent.TreasuryUpdated(old, next)), 0L);
    }

    /**
     * Sends the whole contract balance to the owner.
     */
    public synchronized LedgerReceipt emergencyWithdraw(String caller) {
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            String sender = requireOwner(caller);
            BigInteger balance = custody.contractBalance();
            if (balance.signum() == 0) {
                throw new ValidationException("Nothing to withdraw");
            }
            FundsCustody.Checkpoint checkpoint = custody.checkpoint();
            try {
                custody.pay(owner, balance);
            } catch (RuntimeException e) {
                custody.revertTo(checkpoint);
                log.warn("Emergency withdrawal of {} failed: {}", balance, e.getMessage());
                throw e;
            }
            custody.release(checkpoint);
            log.warn("Emergency withdrawal of {} to {}", balance, owner);
            return eventLog.commit(sender, "emergencyWithdraw", now(),
                    List.of(new MarketplaceEvent.EmergencyWithdrawal(owner, balance)), 0L);
        }
    }

    public synchronized LedgerReceipt transferOwnership(String caller, String newOwner) {
        guard.ensureNotEntered();
        String sender = requireOwner(caller);
        String next = Addresses.requireNonZero(newOwner, "Owner");
        String previous = owner;
        owner = next;
        log.info("Ownership transferred from {} to {}", previous, next);
        return eventLog.commit(sender, "transferOwnership", now(),
                List.of(new MarketplaceEvent.OwnershipTransferred(previous, next)), 0L);
    }

    // ==================== Views ====================

    // Views fail while a transfer is in flight so a payment callback cannot read uncommitted state.

    public synchronized Optional<Offer> findOffer(long offerId) {
        guard.ensureNotEntered();
        return offerAt(offerId).map(StoredOffer::toOffer);
    }

    public Offer getOffer(long offerId) {
        return findOffer(offerId).orElseThrow(() -> new OfferNotFoundException(offerId));
    }

    public synchronized Optional<Purchase> findPurchase(long purchaseId) {
        guard.ensureNotEntered();
        if (purchaseId < 1 || purchaseId > purchases.size()) {
            return Optional.empty();
        }
        return Optional.of(purchases.get((int) (purchaseId - 1)));
    }

    public Purchase getPurchase(long purchaseId) {
        return findPurchase(purchaseId).orElseThrow(() -> new PurchaseNotFoundException(purchaseId));
    }

    public synchronized List<Long> getActiveOfferIds() {
        guard.ensureNotEntered();
        return activeOffers.snapshot();
    }

    public synchronized List<Offer> getActiveOffers() {
        guard.ensureNotEntered();
        return activeOffers.snapshot().stream().map(id -> offers.get((int) (id - 1)).toOffer()).toList();
    }

    public synchronized List<Long> getUserOffers(String creator) {
        guard.ensureNotEntered();
        return List.copyOf(offersByCreator.getOrDefault(Addresses.normalize(creator), List.of()));
    }

    public synchronized List<Offer> getOffersByCreator(String creator) {
        guard.ensureNotEntered();
        return getUserOffers(creator).stream().map(id -> offers.get((int) (id - 1)).toOffer()).toList();
    }

    public synchronized List<Long> getUserPurchases(String buyer) {
        guard.ensureNotEntered();
        return List.copyOf(purchasesByBuyer.getOrDefault(Addresses.normalize(buyer), List.of()));
    }

    public synchronized List<Purchase> getPurchasesByBuyer(String buyer) {
        guard.ensureNotEntered();
        return getUserPurchases(buyer).stream().map(id -> purchases.get((int) (id - 1))).toList();
    }

    public synchronized OfferHandles getEncryptedOfferData(long offerId) {
        guard.ensureNotEntered();
        return requireOffer(offerId).handles();
    }

    public synchronized Optional<RevealedValues> getRevealedValues(long offerId) {
        guard.ensureNotEntered();
        return requireOffer(offerId).revealed();
    }

    public synchronized ContractStats getContractStats() {
        guard.ensureNotEntered();
        return new ContractStats(totalOffersCreated, totalPurchases, totalVolume, activeOffers.size());
    }

    public synchronized int getPlatformFee() {
        guard.ensureNotEntered();
        return platformFeeBps;
    }

    public synchronized String getTreasury() {
        guard.ensureNotEntered();
        return treasury;
    }

    public synchronized String getOwner() {
        guard.ensureNotEntered();
        return owner;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public EventLog getEventLog() {
        return eventLog;
    }

    public boolean isTransferInProgress() {
        return guard.isEntered();
    }

    // ==================== Private Helper Methods ====================

    private void validateOfferFields(String title, String description, BigInteger price,
                                     long durationDays, long slots) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Title cannot be empty");
        }
        if (description == null || description.isBlank()) {
            throw new ValidationException("Description cannot be empty");
        }
        if (price == null || price.signum() <= 0) {
            throw new ValidationException("Price must be positive");
        }
        if (durationDays <= 0) {
            throw new ValidationException("Duration must be positive");
        }
        if (slots <= 0) {
            throw new ValidationException("Slots must be positive");
        }
        if (!FheType.EUINT64.fits(price)) {
            throw new ValidationException("Price exceeds the 64-bit range");
        }
        if (!FheType.EUINT32.fits(BigInteger.valueOf(durationDays))) {
            throw new ValidationException("Duration exceeds the 32-bit range");
        }
        if (!FheType.EUINT32.fits(BigInteger.valueOf(slots))) {
            throw new ValidationException("Slots exceed the 32-bit range");
        }
    }

    private Optional<StoredOffer> offerAt(long offerId) {
        if (offerId < 1 || offerId > offers.size()) {
            return Optional.empty();
        }
        return Optional.of(offers.get((int) (offerId - 1)));
    }

    private StoredOffer requireOffer(long offerId) {
        return offerAt(offerId).orElseThrow(() -> new OfferNotFoundException(offerId));
    }

    private String requireOwner(String caller) {
        String sender = Addresses.normalize(caller);
        if (!Addresses.same(sender, owner)) {
            throw new AuthorizationException("Only the owner can perform this operation");
        }
        return sender;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
}
