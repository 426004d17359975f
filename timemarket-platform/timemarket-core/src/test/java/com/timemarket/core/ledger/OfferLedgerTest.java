package com.timemarket.core.ledger;

import com.timemarket.core.domain.ContractStats;
import com.timemarket.core.domain.Offer;
import com.timemarket.core.domain.OfferStatus;
import com.timemarket.core.domain.Purchase;
import com.timemarket.core.domain.RevealState;
import com.timemarket.core.error.AuthorizationException;
import com.timemarket.core.error.OfferNotFoundException;
import com.timemarket.core.error.PaymentException;
import com.timemarket.core.error.ReentrancyException;
import com.timemarket.core.error.ValidationException;
import com.timemarket.core.event.LedgerReceipt;
import com.timemarket.core.event.MarketplaceEvent;
import com.timemarket.core.util.Addresses;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static com.timemarket.core.ledger.LedgerFixture.BUYER;
import static com.timemarket.core.ledger.LedgerFixture.CONTRACT;
import static com.timemarket.core.ledger.LedgerFixture.CREATOR;
import static com.timemarket.core.ledger.LedgerFixture.INITIAL_BALANCE;
import static com.timemarket.core.ledger.LedgerFixture.OTHER_BUYER;
import static com.timemarket.core.ledger.LedgerFixture.OWNER;
import static com.timemarket.core.ledger.LedgerFixture.TREASURY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OfferLedgerTest {

    private LedgerFixture fixture;
    private OfferLedger ledger;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture(500);
        ledger = fixture.ledger;
    }

    // ==================== Creation ====================

    @Test
    void createOffer_storesOfferAndEmitsEvent() {
        // When
        LedgerReceipt receipt = ledger.createOffer(CREATOR, "Mentoring", "Weekly session",
                BigInteger.valueOf(100), 30, 5);

        // Then
        assertThat(receipt.createdId()).isEqualTo(1L);
        Offer offer = ledger.getOffer(1);
        assertThat(offer.creator()).isEqualTo(CREATOR);
        assertThat(offer.availableSlots()).isEqualTo(5);
        assertThat(offer.status()).isEqualTo(OfferStatus.ACTIVE);
        assertThat(offer.revealState()).isEqualTo(RevealState.SEALED);
        assertThat(offer.createdAt()).isEqualTo(LedgerFixture.START);
        assertThat(offer.expiresAt()).isEqualTo(LedgerFixture.START.plus(Duration.ofDays(30)));
        assertThat(receipt.firstEvent(MarketplaceEvent.OfferCreated.class)).contains(
                new MarketplaceEvent.OfferCreated(1, CREATOR, "Mentoring", BigInteger.valueOf(100), 30, 5));
        assertThat(ledger.getUserOffers(CREATOR)).containsExactly(1L);
        assertThat(ledger.getActiveOfferIds()).containsExactly(1L);
        assertThat(ledger.getContractStats().totalOffersCreated()).isEqualTo(1);
    }

    @Test
    void createOffer_plaintextOfferStillCarriesEncryptedHandles() {
        // When
        long offerId = fixture.createOffer(100, 30, 5);

        // Then
        Offer offer = ledger.getOffer(offerId);
        assertThat(offer.encryptedPrice()).isNotNull();
        assertThat(offer.encryptedDuration()).isNotNull();
        assertThat(offer.encryptedSlots()).isNotNull();
        assertThat(fixture.fhe.userDecrypt(offer.encryptedPrice(), CREATOR)).isEqualTo(BigInteger.valueOf(100));
        assertThat(fixture.fhe.acl().isAllowed(offer.encryptedSlots(), CONTRACT)).isTrue();
        assertThat(fixture.fhe.acl().isAllowed(offer.encryptedSlots(), BUYER)).isFalse();
    }

    @Test
    void createOffer_rejectsInvalidFieldsWithoutSideEffects() {
        assertThatThrownBy(() -> ledger.createOffer(CREATOR, " ", "d", BigInteger.ONE, 1, 1))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.createOffer(CREATOR, "t", "", BigInteger.ONE, 1, 1))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.createOffer(CREATOR, "t", "d", BigInteger.ZERO, 1, 1))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.createOffer(CREATOR, "t", "d", BigInteger.ONE, 0, 1))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.createOffer(CREATOR, "t", "d", BigInteger.ONE, 1, -3))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.createOffer(CREATOR, "t", "d", BigInteger.ONE.shiftLeft(64), 1, 1))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.createOffer("not-an-address", "t", "d", BigInteger.ONE, 1, 1))
                .isInstanceOf(ValidationException.class);

        assertThat(ledger.getContractStats()).isEqualTo(new ContractStats(0, 0, BigInteger.ZERO, 0));
        assertThat(fixture.eventLog.size()).isZero();
        assertThat(fixture.fhe.acl().grants()).isEmpty();
    }

    @Test
    void getOffer_unknownIdIsNotFound() {
        assertThat(ledger.findOffer(0)).isEmpty();
        assertThat(ledger.findOffer(7)).isEmpty();
        assertThatThrownBy(() -> ledger.getOffer(7))
                .isInstanceOf(OfferNotFoundException.class)
                .hasMessageContaining("7");
    }

    // ==================== Purchase ====================

    @Test
    void purchase_splitsFeeAndExhaustsOffer() {
        // Given
        long offerId = fixture.createOffer(100, 30, 5);

        // When
        LedgerReceipt first = ledger.purchaseOffer(BUYER, offerId, 2, BigInteger.valueOf(200));

        // Then
        assertThat(first.firstEvent(MarketplaceEvent.OfferPurchased.class)).contains(
                new MarketplaceEvent.OfferPurchased(offerId, BUYER, 2, BigInteger.valueOf(200), 3));
        assertThat(fixture.custody.balanceOf(TREASURY)).isEqualTo(BigInteger.valueOf(10));
        assertThat(fixture.custody.balanceOf(CREATOR)).isEqualTo(BigInteger.valueOf(190));
        assertThat(fixture.custody.balanceOf(BUYER)).isEqualTo(INITIAL_BALANCE.subtract(BigInteger.valueOf(200)));
        assertThat(ledger.getOffer(offerId).availableSlots()).isEqualTo(3);
        assertThat(ledger.getOffer(offerId).active()).isTrue();

        // When
        ledger.purchaseOffer(OTHER_BUYER, offerId, 3, BigInteger.valueOf(300));

        // Then
        Offer offer = ledger.getOffer(offerId);
        assertThat(offer.availableSlots()).isZero();
        assertThat(offer.active()).isFalse();
        assertThat(offer.status()).isEqualTo(OfferStatus.EXHAUSTED);
        assertThat(ledger.getActiveOfferIds()).doesNotContain(offerId);
        assertThat(ledger.getContractStats())
                .isEqualTo(new ContractStats(1, 2, BigInteger.valueOf(500), 0));
        assertThat(fixture.custody.contractBalance()).isZero();
    }

    @Test
    void purchase_recordsPurchaseForBuyer() {
        // Given
        long offerId = fixture.createOffer(40, 10, 10);

        // When
        long purchaseId = fixture.buy(BUYER, offerId, 3);

        // Then
        Purchase purchase = ledger.getPurchase(purchaseId);
        assertThat(purchase.offerId()).isEqualTo(offerId);
        assertThat(purchase.buyer()).isEqualTo(BUYER);
        assertThat(purchase.slots()).isEqualTo(3);
        assertThat(purchase.totalPrice()).isEqualTo(BigInteger.valueOf(120));
        assertThat(purchase.timestamp()).isEqualTo(LedgerFixture.START);
        assertThat(ledger.getUserPurchases(BUYER)).containsExactly(purchaseId);
        assertThat(ledger.getPurchasesByBuyer(BUYER)).containsExactly(purchase);
        assertThat(ledger.getUserPurchases(OTHER_BUYER)).isEmpty();
    }

    @Test
    void purchase_refundsOverpayment() {
        // Given
        long offerId = fixture.createOffer(100, 30, 5);

        // When
        ledger.purchaseOffer(BUYER, offerId, 1, BigInteger.valueOf(175));

        // Then
        assertThat(fixture.custody.balanceOf(BUYER)).isEqualTo(INITIAL_BALANCE.subtract(BigInteger.valueOf(100)));
        assertThat(fixture.custody.contractBalance()).isZero();
    }

    @Test
    void purchase_rejectsInvalidRequests() {
        // Given
        long offerId = fixture.createOffer(100, 30, 5);

        // Then
        assertThatThrownBy(() -> ledger.purchaseOffer(BUYER, 99, 1, BigInteger.valueOf(100)))
                .isInstanceOf(OfferNotFoundException.class);
        assertThatThrownBy(() -> ledger.purchaseOffer(BUYER, offerId, 0, BigInteger.valueOf(100)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.purchaseOffer(BUYER, offerId, 6, BigInteger.valueOf(600)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("slots available");
        assertThatThrownBy(() -> ledger.purchaseOffer(CREATOR, offerId, 1, BigInteger.valueOf(100)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("own offer");
        assertThatThrownBy(() -> ledger.purchaseOffer(BUYER, offerId, 2, BigInteger.valueOf(199)))
                .isInstanceOf(PaymentException.class);

        assertThat(ledger.getOffer(offerId).availableSlots()).isEqualTo(5);
        assertThat(ledger.getContractStats().totalPurchases()).isZero();
        assertThat(fixture.custody.balanceOf(BUYER)).isEqualTo(INITIAL_BALANCE);
    }

    @Test
    void purchase_allowedUntilExpiryInclusive() {
        // Given
        long offerId = fixture.createOffer(10, 1, 5);

        // When
        fixture.clock.advance(Duration.ofDays(1));
        fixture.buy(BUYER, offerId, 1);
        fixture.clock.advance(Duration.ofSeconds(1));

        // Then
        assertThat(ledger.getOffer(offerId).isExpired(fixture.clock.instant())).isTrue();
        assertThatThrownBy(() -> fixture.buy(BUYER, offerId, 1))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("expired");
        assertThat(ledger.getActiveOfferIds()).containsExactly(offerId);
    }

    @Test
    void purchase_failingTransferLegRestoresEverything() {
        // Given
        long offerId = fixture.createOffer(100, 30, 5);
        fixture.buy(OTHER_BUYER, offerId, 1);
        ContractStats statsBefore = ledger.getContractStats();
        Offer offerBefore = ledger.getOffer(offerId);
        int eventsBefore = fixture.eventLog.size();
        fixture.custody.rejectPaymentsTo(CREATOR);

        // When
        assertThatThrownBy(() -> ledger.purchaseOffer(BUYER, offerId, 4, BigInteger.valueOf(450)))
                .isInstanceOf(PaymentException.class);

        // Then
        assertThat(ledger.getOffer(offerId)).isEqualTo(offerBefore);
        assertThat(ledger.getActiveOfferIds()).containsExactly(offerId);
        assertThat(ledger.getContractStats()).isEqualTo(statsBefore);
        assertThat(ledger.getUserPurchases(BUYER)).isEmpty();
        assertThat(ledger.findPurchase(2)).isEmpty();
        assertThat(fixture.custody.balanceOf(BUYER)).isEqualTo(INITIAL_BALANCE);
        assertThat(fixture.custody.balanceOf(TREASURY)).isEqualTo(BigInteger.valueOf(5));
        assertThat(fixture.custody.contractBalance()).isZero();
        assertThat(fixture.eventLog.size()).isEqualTo(eventsBefore);
        assertThat(ledger.isTransferInProgress()).isFalse();

        // When
        fixture.custody.acceptPaymentsTo(CREATOR);
        long purchaseId = fixture.buy(BUYER, offerId, 4);

        // Then
        assertThat(purchaseId).isEqualTo(2);
        assertThat(ledger.getOffer(offerId).status()).isEqualTo(OfferStatus.EXHAUSTED);
    }

    @Test
    void purchase_reentrantCallFromRecipientIsRejected() {
        // Given
        long offerId = fixture.createOffer(100, 30, 5);
        fixture.custody.setPaymentHook((to, amount) -> {
            if (to.equals(CREATOR)) {
                ledger.purchaseOffer(OTHER_BUYER, offerId, 1, BigInteger.valueOf(100));
            }
        });

        // When
        assertThatThrownBy(() -> ledger.purchaseOffer(BUYER, offerId, 1, BigInteger.valueOf(100)))
                .isInstanceOf(ReentrancyException.class);

        // Then
        assertThat(ledger.getOffer(offerId).availableSlots()).isEqualTo(5);
        assertThat(ledger.getContractStats().totalPurchases()).isZero();
        assertThat(fixture.custody.balanceOf(BUYER)).isEqualTo(INITIAL_BALANCE);
        assertThat(fixture.custody.balanceOf(OTHER_BUYER)).isEqualTo(INITIAL_BALANCE);
        assertThat(ledger.isTransferInProgress()).isFalse();
    }

    @Test
    void purchase_nonValueCallFromRecipientIsRejected() {
        // Given
        long offerId = fixture.createOffer(100, 30, 5);
        fixture.custody.setPaymentHook((to, amount) -> {
            if (to.equals(CREATOR)) {
                ledger.deactivateOffer(CREATOR, offerId);
            }
        });

        // When
        assertThatThrownBy(() -> fixture.buy(BUYER, offerId, 1))
                .isInstanceOf(ReentrancyException.class);

        // Then
        assertThat(ledger.getOffer(offerId).active()).isTrue();
        fixture.custody.setPaymentHook((to, amount) -> {});
        assertThat(fixture.buy(BUYER, offerId, 1)).isEqualTo(1);
    }

    @Test
    void purchase_stateViewsFromRecipientAreRejected() {
        // Given
        long offerId = fixture.createOffer(100, 30, 5);
        List<Object> observed = new ArrayList<>();
        List<ReentrancyException> rejected = new ArrayList<>();
        fixture.custody.setPaymentHook((to, amount) -> {
            if (!to.equals(TREASURY)) {
                return;
            }
            List<Supplier<Object>> views = List.of(
                    ledger::getContractStats,
                    () -> ledger.getOffer(offerId),
                    () -> ledger.findPurchase(1),
                    () -> ledger.getUserPurchases(BUYER),
                    ledger::getActiveOfferIds);
            for (Supplier<Object> view : views) {
                try {
                    observed.add(view.get());
                } catch (ReentrancyException e) {
                    rejected.add(e);
                }
            }
        });
        fixture.custody.rejectPaymentsTo(CREATOR);

        // When
        assertThatThrownBy(() -> fixture.buy(BUYER, offerId, 2))
                .isInstanceOf(PaymentException.class);

        // Then
        assertThat(observed).isEmpty();
        assertThat(rejected).hasSize(5);
        assertThat(ledger.getContractStats().totalPurchases()).isZero();
        assertThat(ledger.getOffer(offerId).availableSlots()).isEqualTo(5);
        assertThat(ledger.getUserPurchases(BUYER)).isEmpty();
    }

    // ==================== Deactivation ====================

    @Test
    void deactivate_byCreatorOrOwnerOnly() {
        // Given
        long first = fixture.createOffer(100, 30, 5);
        long second = fixture.createOffer(100, 30, 5);

        // Then
        assertThatThrownBy(() -> ledger.deactivateOffer(BUYER, first))
                .isInstanceOf(AuthorizationException.class);

        // When
        LedgerReceipt receipt = ledger.deactivateOffer(CREATOR, first);
        ledger.deactivateOffer(OWNER, second);

        // Then
        assertThat(receipt.firstEvent(MarketplaceEvent.OfferDeactivated.class))
                .contains(new MarketplaceEvent.OfferDeactivated(first, CREATOR));
        assertThat(ledger.getOffer(first).status()).isEqualTo(OfferStatus.DEACTIVATED);
        assertThat(ledger.getActiveOfferIds()).isEmpty();
        assertThat(ledger.getContractStats().activeOffersCount()).isZero();
        assertThatThrownBy(() -> ledger.deactivateOffer(CREATOR, first))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> fixture.buy(BUYER, first, 1))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not active");
    }

    @Test
    void deactivate_keepsOtherActiveIds() {
        // Given
        long first = fixture.createOffer(1, 30, 5);
        long second = fixture.createOffer(1, 30, 5);
        long third = fixture.createOffer(1, 30, 5);

        // When
        ledger.deactivateOffer(CREATOR, first);

        // Then
        assertThat(ledger.getActiveOfferIds()).containsExactlyInAnyOrder(second, third);
        assertThat(ledger.getActiveOffers()).extracting(Offer::id).containsExactlyInAnyOrder(second, third);
    }

    // ==================== Admin ====================

    @Test
    void updatePlatformFee_ownerOnlyAndBounded() {
        assertThatThrownBy(() -> ledger.updatePlatformFee(CREATOR, 100))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> ledger.updatePlatformFee(OWNER, 1001))
                .isInstanceOf(ValidationException.class);

        LedgerReceipt receipt = ledger.updatePlatformFee(OWNER, 1000);

        assertThat(ledger.getPlatformFee()).isEqualTo(1000);
        assertThat(receipt.firstEvent(MarketplaceEvent.PlatformFeeUpdated.class))
                .contains(new MarketplaceEvent.PlatformFeeUpdated(500, 1000));
    }

    @Test
    void updateTreasury_redirectsFees() {
        // Given
        String newTreasury = LedgerFixture.address(0x77);
        long offerId = fixture.createOffer(1000, 30, 5);

        // When
        assertThatThrownBy(() -> ledger.updateTreasury(OWNER, "0x1234"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.updateTreasury(OWNER, Addresses.ZERO))
                .isInstanceOf(ValidationException.class);
        ledger.updateTreasury(OWNER, newTreasury);
        fixture.buy(BUYER, offerId, 1);

        // Then
        assertThat(ledger.getTreasury()).isEqualTo(newTreasury);
        assertThat(fixture.custody.balanceOf(newTreasury)).isEqualTo(BigInteger.valueOf(50));
        assertThat(fixture.custody.balanceOf(TREASURY)).isZero();
    }

    @Test
    void emergencyWithdraw_movesContractBalanceToOwner() {
        // Given
        fixture.custody.deposit(CONTRACT, BigInteger.valueOf(42));

        // Then
        assertThatThrownBy(() -> ledger.emergencyWithdraw(BUYER))
                .isInstanceOf(AuthorizationException.class);

        // When
        LedgerReceipt receipt = ledger.emergencyWithdraw(OWNER);

        // Then
        assertThat(fixture.custody.contractBalance()).isZero();
        assertThat(fixture.custody.balanceOf(OWNER)).isEqualTo(BigInteger.valueOf(42));
        assertThat(receipt.firstEvent(MarketplaceEvent.EmergencyWithdrawal.class))
                .contains(new MarketplaceEvent.EmergencyWithdrawal(OWNER, BigInteger.valueOf(42)));
        assertThatThrownBy(() -> ledger.emergencyWithdraw(OWNER))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void transferOwnership_movesAdminRights() {
        // Given
        String newOwner = LedgerFixture.address(0x99);

        // When
        ledger.transferOwnership(OWNER, newOwner);

        // Then
        assertThat(ledger.getOwner()).isEqualTo(newOwner);
        assertThatThrownBy(() -> ledger.updatePlatformFee(OWNER, 10))
                .isInstanceOf(AuthorizationException.class);
        ledger.updatePlatformFee(newOwner, 10);
        assertThat(ledger.getPlatformFee()).isEqualTo(10);
    }

    // ==================== Event log ====================

    @Test
    void everyMutationIsOneBlock() {
        // When
        LedgerReceipt create = ledger.createOffer(CREATOR, "t", "d", BigInteger.TEN, 1, 2);
        LedgerReceipt purchase = ledger.purchaseOffer(BUYER, 1, 1, BigInteger.TEN);

        // Then
        assertThat(create.blockNumber()).isEqualTo(1);
        assertThat(purchase.blockNumber()).isEqualTo(2);
        assertThat(purchase.transactionHash()).isNotEqualTo(create.transactionHash());
        assertThat(fixture.eventLog.getEntries()).hasSize(2);
        assertThat(fixture.eventLog.blockTimestamp(2)).contains(LedgerFixture.START);
    }
}
