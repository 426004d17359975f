package com.timemarket.core.event;

import com.timemarket.core.fhe.EncryptedHandle;

import java.math.BigInteger;
import java.util.List;

/**
 * Events emitted by the offer ledger. Names match the on-chain event names.
 */
public sealed interface MarketplaceEvent permits
        MarketplaceEvent.OfferCreated,
        MarketplaceEvent.OfferPurchased,
        MarketplaceEvent.OfferDeactivated,
        MarketplaceEvent.RevealRequested,
        MarketplaceEvent.RevealResolved,
        MarketplaceEvent.PlatformFeeUpdated,
        MarketplaceEvent.TreasuryUpdated,
        MarketplaceEvent.EmergencyWithdrawal,
        MarketplaceEvent.OwnershipTransferred {

    String name();

    record OfferCreated(long offerId, String creator, String title, BigInteger publicPrice,
                        long duration, long slots) implements MarketplaceEvent {
        @Override
        public String name() {
            return "OfferCreated";
        }
    }

    record OfferPurchased(long offerId, String buyer, long slots, BigInteger totalPrice,
                          long slotsLeft) implements MarketplaceEvent {
        @Override
        public String name() {
            return "OfferPurchased";
        }
    }

    record OfferDeactivated(long offerId, String creator) implements MarketplaceEvent {
        @Override
        public String name() {
            return "OfferDeactivated";
        }
    }

    /**
     * Carries exactly the handles whose cleartext the next callback must cover.
     */
    record RevealRequested(long offerId, List<EncryptedHandle> handles) implements MarketplaceEvent {
        public RevealRequested {
            handles = List.copyOf(handles);
        }

        @Override
        public String name() {
            return "TallyRevealRequested";
        }
    }

    record RevealResolved(long offerId, BigInteger price, long slots) implements MarketplaceEvent {
        @Override
        public String name() {
            return "TallyRevealResolved";
        }
    }

    record PlatformFeeUpdated(int oldFeeBps, int newFeeBps) implements MarketplaceEvent {
        @Override
        public String name() {
            return "PlatformFeeUpdated";
        }
    }

    record TreasuryUpdated(String oldTreasury, String newTreasury) implements MarketplaceEvent {
        @Override
        public String name() {
            return "TreasuryUpdated";
        }
    }

    record EmergencyWithdrawal(String to, BigInteger amount) implements MarketplaceEvent {
        @Override
        public String name() {
            return "EmergencyWithdrawal";
        }
    }

    record OwnershipTransferred(String previousOwner, String newOwner) implements MarketplaceEvent {
        @Override
        public String name() {
            return "OwnershipTransferred";
        }
    }
}
