package com.timemarket.blockchain.service;

import com.timemarket.blockchain.contract.TimeMarketplaceContract;
import com.timemarket.blockchain.contract.TimeMarketplaceContract.OfferData;
import com.timemarket.blockchain.contract.TimeMarketplaceContract.OfferPurchasedEventResponse;
import com.timemarket.blockchain.contract.TimeMarketplaceContract.PurchaseData;
import com.timemarket.core.domain.Offer;
import com.timemarket.core.domain.Purchase;
import com.timemarket.core.domain.RevealState;
import com.timemarket.core.error.OfferNotFoundException;
import com.timemarket.core.error.PurchaseNotFoundException;
import com.timemarket.core.error.ReconciliationException;
import com.timemarket.core.fhe.EncryptedHandle;
import com.timemarket.core.reconcile.ChainDataSource;
import com.timemarket.core.reconcile.PurchaseLog;
import com.timemarket.core.util.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Chain data source reading the deployed marketplace over JSON-RPC: state via
 * contract calls, purchase history via {@code eth_getLogs} from the deploy
 * block, and block times via {@code eth_getBlockByNumber}.
 */
public class Web3jChainDataSource implements ChainDataSource {

    private static final Logger log = LoggerFactory.getLogger(Web3jChainDataSource.class);

    private final Web3j web3j;
    private final TimeMarketplaceContract contract;
    private final String contractAddress;
    private final BigInteger deployBlock;

    public Web3jChainDataSource(Web3j web3j, TimeMarketplaceContract contract, String contractAddress,
                                BigInteger deployBlock) {
        this.web3j = web3j;
        this.contract = contract;
        this.contractAddress = contractAddress;
        this.deployBlock = deployBlock;
    }

    @Override
    public List<Long> getUserPurchases(String buyer) {
        try {
            List<BigInteger> ids = contract.getUserPurchases(Addresses.normalize(buyer)).send();
            return ids.stream().map(BigInteger::longValueExact).toList();
        } catch (Exception e) {
            throw new ReconciliationException("Failed to read purchases of " + buyer, e);
        }
    }

    @Override
    public Purchase getPurchase(long purchaseId) {
        PurchaseData data;
        try {
            data = contract.purchases(BigInteger.valueOf(purchaseId)).send();
        } catch (Exception e) {
            throw new ReconciliationException("Failed to read purchase " + purchaseId, e);
        }
        return toPurchase(purchaseId, data);
    }

    @Override
    public Offer getOffer(long offerId) {
        OfferData data;
        try {
            data = contract.offers(BigInteger.valueOf(offerId)).send();
        } catch (Exception e) {
            throw new ReconciliationException("Failed to read offer " + offerId, e);
        }
        return toOffer(offerId, data);
    }

    @Override
    public List<PurchaseLog> fetchPurchaseLogs(String buyer) {
        EthFilter filter = purchaseFilter(contractAddress, deployBlock, Addresses.normalize(buyer));
        EthLog response;
        try {
            response = web3j.ethGetLogs(filter).send();
        } catch (Exception e) {
            throw new ReconciliationException("eth_getLogs failed for " + buyer, e);
        }
        if (response.hasError()) {
            throw new ReconciliationException("eth_getLogs failed for " + buyer + ": "
                    + response.getError().getMessage());
        }

        List<PurchaseLog> logs = new ArrayList<>();
        for (EthLog.LogResult<?> result : response.getLogs()) {
            if (!(result.get() instanceof Log entry)) {
                continue;
            }
            try {
                PurchaseLog decoded = toPurchaseLog(entry);
                if (decoded != null) {
                    logs.add(decoded);
                }
            } catch (RuntimeException e) {
                log.warn("Skipping undecodable purchase log in tx {}: {}", entry.getTransactionHash(), e.getMessage());
            }
        }
        return logs;
    }

    @Override
    public Instant blockTimestamp(long blockNumber) {
        EthBlock response;
        try {
            response = web3j.ethGetBlockByNumber(
                    DefaultBlockParameter.valueOf(BigInteger.valueOf(blockNumber)), false).send();
        } catch (Exception e) {
            throw new ReconciliationException("Failed to read block " + blockNumber, e);
        }
        if (response.hasError() || response.getBlock() == null) {
            throw new ReconciliationException("Block " + blockNumber + " is not available");
        }
        return Instant.ofEpochSecond(response.getBlock().getTimestamp().longValueExact());
    }

    // ==================== Mapping ====================

    /**
     * {@code OfferPurchased} logs of the marketplace whose indexed buyer is {@code buyer}.
     */
    static EthFilter purchaseFilter(String contractAddress, BigInteger fromBlock, String buyer) {
        EthFilter filter = new EthFilter(DefaultBlockParameter.valueOf(fromBlock),
                DefaultBlockParameterName.LATEST, contractAddress);
        filter.addSingleTopic(TimeMarketplaceContract.offerPurchasedTopic());
        filter.addNullTopic();
        filter.addSingleTopic(addressTopic(buyer));
        return filter;
    }

    static String addressTopic(String address) {
        return Numeric.toHexStringWithPrefixZeroPadded(Numeric.toBigInt(address), 64);
    }

    static PurchaseLog toPurchaseLog(Log entry) {
        OfferPurchasedEventResponse event = TimeMarketplaceContract.decodeOfferPurchased(entry);
        if (event == null) {
            return null;
        }
        return new PurchaseLog(
                event.offerId.longValueExact(),
                event.buyer.toLowerCase(Locale.ROOT),
                event.slots.longValueExact(),
                event.totalPrice,
                entry.getBlockNumber().longValueExact(),
                entry.getLogIndex().intValueExact(),
                entry.getTransactionHash());
    }

    static Purchase toPurchase(long purchaseId, PurchaseData data) {
        if (data.buyer == null || Addresses.ZERO.equalsIgnoreCase(data.buyer)) {
            throw new PurchaseNotFoundException(purchaseId);
        }
        return new Purchase(purchaseId, data.offerId.longValueExact(), data.buyer.toLowerCase(Locale.ROOT),
                data.slots.longValueExact(), data.totalPrice, Instant.ofEpochSecond(data.timestamp.longValueExact()));
    }

    /**
     * The contract does not expose reveal progress, so chain offers read as sealed.
     */
    static Offer toOffer(long offerId, OfferData data) {
        if (data.creator == null || Addresses.ZERO.equalsIgnoreCase(data.creator)) {
            throw new OfferNotFoundException(offerId);
        }
        return new Offer(
                data.id.longValueExact(),
                data.creator.toLowerCase(Locale.ROOT),
                data.title,
                data.description,
                data.publicPrice,
                data.duration.longValueExact(),
                data.slots.longValueExact(),
                data.availableSlots.longValueExact(),
                data.isActive,
                Instant.ofEpochSecond(data.createdAt.longValueExact()),
                Instant.ofEpochSecond(data.expiresAt.longValueExact()),
                EncryptedHandle.fromBytes(data.encryptedPrice),
                EncryptedHandle.fromBytes(data.encryptedDuration),
                EncryptedHandle.fromBytes(data.encryptedSlots),
                RevealState.SEALED);
    }
}
