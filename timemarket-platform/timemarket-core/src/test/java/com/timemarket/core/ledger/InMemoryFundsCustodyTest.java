package com.timemarket.core.ledger;

import com.timemarket.core.error.PaymentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.timemarket.core.ledger.LedgerFixture.BUYER;
import static com.timemarket.core.ledger.LedgerFixture.CONTRACT;
import static com.timemarket.core.ledger.LedgerFixture.CREATOR;
import static com.timemarket.core.ledger.LedgerFixture.OTHER_BUYER;
import static com.timemarket.core.ledger.LedgerFixture.TREASURY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryFundsCustodyTest {

    private InMemoryFundsCustody custody;

    @BeforeEach
    void setUp() {
        custody = new InMemoryFundsCustody(CONTRACT);
        custody.deposit(BUYER, BigInteger.valueOf(100));
        custody.deposit(OTHER_BUYER, BigInteger.valueOf(50));
    }

    @Test
    void revertTo_restoresTouchedAccountsOnly() {
        // Given
        FundsCustody.Checkpoint checkpoint = custody.checkpoint();
        custody.collect(BUYER, BigInteger.valueOf(30));
        custody.pay(CREATOR, BigInteger.valueOf(25));

        // When
        custody.revertTo(checkpoint);

        // Then
        assertThat(custody.balanceOf(BUYER)).isEqualTo(BigInteger.valueOf(100));
        assertThat(custody.balanceOf(CREATOR)).isZero();
        assertThat(custody.contractBalance()).isZero();
        assertThat(custody.balanceOf(OTHER_BUYER)).isEqualTo(BigInteger.valueOf(50));
        assertThat(custody.openCheckpoints()).isZero();
    }

    @Test
    void release_keepsMovementsAndClosesJournal() {
        // Given
        FundsCustody.Checkpoint checkpoint = custody.checkpoint();
        custody.collect(BUYER, BigInteger.valueOf(40));
        custody.pay(TREASURY, BigInteger.valueOf(40));

        // When
        custody.release(checkpoint);

        // Then
        assertThat(custody.balanceOf(BUYER)).isEqualTo(BigInteger.valueOf(60));
        assertThat(custody.balanceOf(TREASURY)).isEqualTo(BigInteger.valueOf(40));
        assertThat(custody.openCheckpoints()).isZero();
        assertThatThrownBy(() -> custody.revertTo(checkpoint))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void revertTo_outerCheckpointUndoesInnerMovementsToo() {
        // Given
        FundsCustody.Checkpoint outer = custody.checkpoint();
        custody.collect(BUYER, BigInteger.valueOf(10));
        FundsCustody.Checkpoint inner = custody.checkpoint();
        custody.pay(CREATOR, BigInteger.valueOf(10));

        // When
        custody.revertTo(outer);

        // Then
        assertThat(custody.balanceOf(BUYER)).isEqualTo(BigInteger.valueOf(100));
        assertThat(custody.balanceOf(CREATOR)).isZero();
        assertThatThrownBy(() -> custody.release(inner))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ledgerPurchase_leavesNoOpenCheckpoint() {
        // Given
        LedgerFixture fixture = new LedgerFixture(500);
        long offerId = fixture.createOffer(100, 30, 5);

        // When
        fixture.buy(BUYER, offerId, 1);
        fixture.custody.rejectPaymentsTo(CREATOR);
        assertThatThrownBy(() -> fixture.buy(BUYER, offerId, 1))
                .isInstanceOf(PaymentException.class);

        // Then
        assertThat(fixture.custody.openCheckpoints()).isZero();
    }
}
