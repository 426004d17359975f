package com.timemarket.api.purchase;

import com.timemarket.api.ApiFixture;
import com.timemarket.core.domain.Offer;
import com.timemarket.core.domain.Purchase;
import com.timemarket.core.error.PurchaseNotFoundException;
import com.timemarket.core.error.ReconciliationException;
import com.timemarket.core.event.LedgerReceipt;
import com.timemarket.core.reconcile.ChainDataSource;
import com.timemarket.core.reconcile.LedgerChainDataSource;
import com.timemarket.core.reconcile.PurchaseHistorySummary;
import com.timemarket.core.reconcile.PurchaseLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.timemarket.api.ApiFixture.BUYER;
import static com.timemarket.api.ApiFixture.CREATOR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PurchaseControllerTest {

    private ApiFixture fixture;
    private PurchaseController controller;

    @BeforeEach
    void setUp() {
        fixture = new ApiFixture();
        controller = new PurchaseController(fixture.ledger, fixture.reconciliationService, fixture.chainHistory);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void history_isNewestFirstWithTransactionHashes() {
        // Given
        long offerId = fixture.ledger.createOffer(CREATOR, "Consulting hour", "Architecture review",
                BigInteger.valueOf(100), 5, 5).createdId();
        LedgerReceipt first = fixture.ledger.purchaseOffer(BUYER, offerId, 2, BigInteger.valueOf(200));
        LedgerReceipt second = fixture.ledger.purchaseOffer(BUYER, offerId, 1, BigInteger.valueOf(150));

        // When
        PurchaseController.HistoryResponse history = controller.getHistory(BUYER).getBody();

        // Then
        assertThat(history.purchases()).extracting(entry -> entry.purchase().id())
                .containsExactly(second.createdId(), first.createdId());
        assertThat(history.purchases()).extracting(PurchaseController.HistoryEntry::transactionHash)
                .containsExactly(second.transactionHash(), first.transactionHash());
        assertThat(history.purchases().get(0).offer().id()).isEqualTo(offerId);
        assertThat(history.summary()).isEqualTo(new PurchaseHistorySummary(2, 3, BigInteger.valueOf(300), 2, true));
    }

    @Test
    void purchasesByBuyer_returnsRecordsWithoutRefundedExcess() {
        long offerId = fixture.ledger.createOffer(CREATOR, "Consulting hour", "Architecture review",
                BigInteger.valueOf(100), 5, 5).createdId();
        long purchaseId = fixture.ledger.purchaseOffer(BUYER, offerId, 1, BigInteger.valueOf(150)).createdId();

        assertThat(controller.getPurchasesByBuyer(BUYER).getBody()).hasSize(1);
        assertThat(controller.getPurchase(purchaseId).getBody().totalPrice()).isEqualTo(BigInteger.valueOf(100));
    }

    @Test
    void unknownPurchase_throwsNotFound() {
        assertThatThrownBy(() -> controller.getPurchase(7)).isInstanceOf(PurchaseNotFoundException.class);
    }

    @Test
    void history_emptyForNewBuyer() {
        PurchaseController.HistoryResponse history = controller.getHistory(CREATOR).getBody();

        assertThat(history.purchases()).isEmpty();
        assertThat(history.summary().purchaseCount()).isZero();
    }

    @Test
    void chainHistory_notFoundWhenIntegrationDisabled() {
        assertThat(controller.getChainHistory(BUYER).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void history_readsLocalLedgerEvenWithChainSource() {
        // Given
        long offerId = fixture.ledger.createOffer(CREATOR, "Consulting hour", "Architecture review",
                BigInteger.valueOf(100), 5, 5).createdId();
        fixture.ledger.purchaseOffer(BUYER, offerId, 1, BigInteger.valueOf(100));
        try (ApiFixture chain = new ApiFixture()) {
            PurchaseController withChain = new PurchaseController(fixture.ledger, fixture.reconciliationService,
                    fixture.chainHistory(Optional.of(new LedgerChainDataSource(chain.ledger))));

            // When
            PurchaseController.HistoryResponse local = withChain.getHistory(BUYER).getBody();
            ResponseEntity<PurchaseController.HistoryResponse> onChain = withChain.getChainHistory(BUYER);

            // Then
            assertThat(local.purchases()).hasSize(1);
            assertThat(onChain.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(onChain.getBody().purchases()).isEmpty();
        }
    }

    @Test
    void history_degradesWhenPurchaseListIsUnavailable() {
        // Given
        PurchaseController broken = new PurchaseController(fixture.ledger,
                fixture.reconciliationService(new UnreachableSource()), fixture.chainHistory);

        // When
        ResponseEntity<PurchaseController.HistoryResponse> response = broken.getHistory(BUYER);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().purchases()).isEmpty();
        assertThat(response.getBody().summary().complete()).isFalse();
    }

    private static class UnreachableSource implements ChainDataSource {

        @Override
        public List<Long> getUserPurchases(String buyer) {
            throw new ReconciliationException("node unreachable");
        }

        @Override
        public Purchase getPurchase(long purchaseId) {
            throw new ReconciliationException("node unreachable");
        }

        @Override
        public Offer getOffer(long offerId) {
            throw new ReconciliationException("node unreachable");
        }

        @Override
        public List<PurchaseLog> fetchPurchaseLogs(String buyer) {
            throw new ReconciliationException("node unreachable");
        }

        @Override
        public Instant blockTimestamp(long blockNumber) {
            throw new ReconciliationException("node unreachable");
        }
    }
}
