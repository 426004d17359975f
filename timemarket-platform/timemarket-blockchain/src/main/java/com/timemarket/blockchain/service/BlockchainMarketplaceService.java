package com.timemarket.blockchain.service;

import com.timemarket.blockchain.contract.TimeMarketplaceContract;
import com.timemarket.core.domain.ContractStats;
import com.timemarket.core.fhe.EncryptedHandle;
import com.timemarket.core.fhe.InputProof;
import com.timemarket.core.reconcile.ChainDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Service for interacting with the deployed marketplace contract.
 *
 * <p>Every call returns an empty result when the integration is disabled or
 * the call fails; failures are logged, never thrown.
 */
@Service
public class BlockchainMarketplaceService {

    private static final Logger log = LoggerFactory.getLogger(BlockchainMarketplaceService.class);
    private final BlockchainConfig config;
    private TimeMarketplaceContract contract;
    private Web3j web3j;

    public BlockchainMarketplaceService(BlockchainConfig config) {
        this.config = config;
        if (config.isEnabled()) {
            initializeContract();
        }
    }

    private void initializeContract() {
        try {
            this.web3j = Web3j.build(new HttpService(config.getNodeUrl()));
            Credentials credentials = Credentials.create(config.getPrivateKey());
            StaticGasProvider gasProvider = new StaticGasProvider(
                    BigInteger.valueOf(config.getGasPrice()),
                    BigInteger.valueOf(config.getGasLimit()));
            this.contract = TimeMarketplaceContract.load(
                    config.getMarketplaceAddress(), web3j, credentials, gasProvider);
            log.info("Marketplace contract initialized at {}", config.getMarketplaceAddress());
        } catch (Exception e) {
            log.error("Failed to initialize marketplace contract", e);
        }
    }

    public Optional<BlockchainTxResult> createOffer(String title, String description, BigInteger price,
                                                    long durationDays, long slots) {
        return submit("create offer '" + title + "'", () -> contract.createOffer(title, description, price,
                BigInteger.valueOf(durationDays), BigInteger.valueOf(slots)));
    }

    /**
     * Submits an offer whose three handles share one input proof.
     */
    public Optional<BlockchainTxResult> createOfferWithFHE(String title, String description, BigInteger price,
                                                           long durationDays, long slots,
                                                           EncryptedHandle priceHandle,
                                                           EncryptedHandle durationHandle,
                                                           EncryptedHandle slotsHandle,
                                                           InputProof proof) {
        return submit("create encrypted offer '" + title + "'", () -> contract.createOfferWithFHE(
                title, description, price, BigInteger.valueOf(durationDays), BigInteger.valueOf(slots),
                priceHandle.toBytes(), durationHandle.toBytes(), slotsHandle.toBytes(), proof.toBytes()));
    }

    public Optional<BlockchainTxResult> purchaseOffer(long offerId, long slots, BigInteger payment) {
        return submit("purchase offer " + offerId, () -> contract.purchaseOffer(
                BigInteger.valueOf(offerId), BigInteger.valueOf(slots), payment));
    }

    public Optional<BlockchainTxResult> deactivateOffer(long offerId) {
        return submit("deactivate offer " + offerId, () -> contract.deactivateOffer(BigInteger.valueOf(offerId)));
    }

    public Optional<BlockchainTxResult> requestTallyReveal(long offerId) {
        return submit("request reveal of offer " + offerId,
                () -> contract.requestTallyReveal(BigInteger.valueOf(offerId)));
    }

    public Optional<BlockchainTxResult> resolveTallyCallback(long offerId, byte[] cleartexts, byte[] decryptionProof) {
        return submit("resolve reveal of offer " + offerId,
                () -> contract.resolveTallyCallback(BigInteger.valueOf(offerId), cleartexts, decryptionProof));
    }

    public Optional<BlockchainTxResult> updatePlatformFee(int feeBps) {
        return submit("update platform fee", () -> contract.updatePlatformFee(BigInteger.valueOf(feeBps)));
    }

    public Optional<BlockchainTxResult> updateTreasury(String treasury) {
        return submit("update treasury", () -> contract.updateTreasury(treasury));
    }

    public Optional<BlockchainTxResult> emergencyWithdraw() {
        return submit("emergency withdraw", () -> contract.emergencyWithdraw());
    }

    /**
     * Gets contract statistics from the blockchain.
     */
    public Optional<ContractStats> getContractStats() {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TimeMarketplaceContract.StatsData stats = contract.getContractStats().send();
            return Optional.of(new ContractStats(
                    stats.totalOffersCreated().longValueExact(),
                    stats.totalPurchases().longValueExact(),
                    stats.totalVolume(),
                    stats.activeOffersCount().longValueExact()));
        } catch (Exception e) {
            log.error("Failed to get contract stats from blockchain", e);
            return Optional.empty();
        }
    }

    public Optional<List<BigInteger>> getActiveOfferIds() {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return Optional.of(contract.getActiveOfferIds().send());
        } catch (Exception e) {
            log.error("Failed to get active offers from blockchain", e);
            return Optional.empty();
        }
    }

    /**
     * Chain data source over the deployed contract, for the purchase history
     * indexer. Empty when the integration is disabled.
     */
    public Optional<ChainDataSource> chainDataSource() {
        if (!isEnabled()) {
            return Optional.empty();
        }
        return Optional.of(new Web3jChainDataSource(web3j, contract, config.getMarketplaceAddress(),
                BigInteger.valueOf(config.getDeployBlock())));
    }

    public boolean isEnabled() {
        return config.isEnabled() && contract != null;
    }

    private Optional<BlockchainTxResult> submit(String action,
                                                Supplier<RemoteFunctionCall<TransactionReceipt>> call) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = call.get().send();
            BlockchainTxResult result = toTxResult(receipt);
            if (result.success()) {
                log.info("Submitted {} in tx {}", action, result.txHash());
            } else {
                log.warn("Transaction {} to {} was mined but reverted", result.txHash(), action);
            }
            return Optional.of(result);
        } catch (Exception e) {
            log.error("Failed to {} on blockchain", action, e);
            return Optional.empty();
        }
    }

    static BlockchainTxResult toTxResult(TransactionReceipt receipt) {
        return new BlockchainTxResult(
                receipt.getTransactionHash(),
                receipt.getBlockNumber(),
                receipt.isStatusOK()
        );
    }

    public record BlockchainTxResult(String txHash, BigInteger blockNumber, boolean success) {}
}
