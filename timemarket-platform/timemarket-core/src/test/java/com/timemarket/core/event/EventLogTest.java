package com.timemarket.core.event;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventLogTest {

    private static final String ALICE = "0x00000000000000000000000000000000000000a1";
    private static final String BOB = "0x00000000000000000000000000000000000000b0";
    private static final Instant T0 = Instant.parse("2025-03-01T00:00:00Z");

    private final EventLog eventLog = new EventLog();

    @Test
    void commit_assignsOneBlockPerTransaction() {
        // When
        LedgerReceipt first = eventLog.commit(ALICE, "purchaseOffer", T0,
                List.of(new MarketplaceEvent.OfferPurchased(1, ALICE, 1, BigInteger.TEN, 4)), 1);
        LedgerReceipt second = eventLog.commit(BOB, "purchaseOffer", T0.plusSeconds(12),
                List.of(new MarketplaceEvent.OfferPurchased(1, BOB, 2, BigInteger.TWO, 2)), 2);

        // Then
        assertThat(first.blockNumber()).isEqualTo(1);
        assertThat(second.blockNumber()).isEqualTo(2);
        assertThat(first.transactionHash()).matches("0x[0-9a-f]{64}").isNotEqualTo(second.transactionHash());
        assertThat(second.logs().get(0).logIndex()).isEqualTo(1);
        assertThat(eventLog.blockTimestamp(2)).contains(T0.plusSeconds(12));
        assertThat(eventLog.blockTimestamp(3)).isEmpty();
        assertThat(eventLog.latestBlock()).isEqualTo(2);
    }

    @Test
    void commit_withoutEventsStillAdvancesBlock() {
        LedgerReceipt receipt = eventLog.commit(ALICE, "noop", T0, List.of(), 0);

        assertThat(receipt.logs()).isEmpty();
        assertThat(eventLog.latestBlock()).isEqualTo(1);
        assertThat(eventLog.size()).isZero();
    }

    @Test
    void query_filtersByTypeAndPredicate() {
        // Given
        eventLog.commit(ALICE, "createOffer", T0,
                List.of(new MarketplaceEvent.OfferCreated(1, ALICE, "t", BigInteger.ONE, 1, 5)), 1);
        eventLog.commit(BOB, "purchaseOffer", T0,
                List.of(new MarketplaceEvent.OfferPurchased(1, BOB, 1, BigInteger.ONE, 4)), 1);
        eventLog.commit(ALICE, "purchaseOffer", T0,
                List.of(new MarketplaceEvent.OfferPurchased(1, ALICE, 1, BigInteger.ONE, 3)), 2);

        // When
        List<LoggedEvent> bobs = eventLog.query(MarketplaceEvent.OfferPurchased.class, e -> e.buyer().equals(BOB));

        // Then
        assertThat(bobs).hasSize(1);
        assertThat(bobs.get(0).blockNumber()).isEqualTo(2);
        assertThat(eventLog.query(MarketplaceEvent.OfferCreated.class, e -> true)).hasSize(1);
    }
}
