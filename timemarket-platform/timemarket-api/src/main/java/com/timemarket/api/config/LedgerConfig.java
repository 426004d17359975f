package com.timemarket.api.config;

import com.timemarket.api.purchase.ChainPurchaseHistory;
import com.timemarket.blockchain.service.BlockchainMarketplaceService;
import com.timemarket.core.event.EventLog;
import com.timemarket.core.fhe.EncryptedInputService;
import com.timemarket.core.fhe.LocalFheCoprocessor;
import com.timemarket.core.ledger.InMemoryFundsCustody;
import com.timemarket.core.ledger.OfferLedger;
import com.timemarket.core.reconcile.LedgerChainDataSource;
import com.timemarket.core.reconcile.PurchaseReconciliationService;
import com.timemarket.core.util.HexBytes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the in-process ledger, its local coprocessor and the purchase indexer.
 */
@Configuration
public class LedgerConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public LocalFheCoprocessor fheCoprocessor(LedgerProperties properties) {
        String key = properties.getCoprocessorKey();
        if (key == null || key.isBlank()) {
            log.warn("No coprocessor key configured, input proofs will not survive a restart");
            return LocalFheCoprocessor.create(properties.getChainId());
        }
        return new LocalFheCoprocessor(HexBytes.fromHex(key), properties.getChainId());
    }

    @Bean
    public InMemoryFundsCustody fundsCustody(LedgerProperties properties) {
        return new InMemoryFundsCustody(properties.getContractAddress());
    }

    @Bean
    public EventLog eventLog() {
        return new EventLog();
    }

    @Bean
    public OfferLedger offerLedger(LedgerProperties properties, LocalFheCoprocessor fheCoprocessor,
                                   InMemoryFundsCustody fundsCustody, EventLog eventLog, Clock ledgerClock) {
        OfferLedger ledger = new OfferLedger(properties.toSettings(), fheCoprocessor, fheCoprocessor,
                fundsCustody, eventLog, ledgerClock);
        log.info("Offer ledger started at {} (owner {}, fee {} bps)",
                ledger.getContractAddress(), ledger.getOwner(), ledger.getPlatformFee());
        return ledger;
    }

    @Bean
    public EncryptedInputService encryptedInputService(LocalFheCoprocessor fheCoprocessor) {
        return new EncryptedInputService(fheCoprocessor);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService indexerExecutor(IndexerProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getThreads(), runnable -> {
            Thread thread = new Thread(runnable, "purchase-indexer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Reconciles the purchases of the in-process ledger, the one every write
     * endpoint goes to.
     */
    @Bean
    public PurchaseReconciliationService purchaseReconciliationService(OfferLedger offerLedger,
                                                                       ExecutorService indexerExecutor,
                                                                       IndexerProperties properties) {
        return new PurchaseReconciliationService(new LedgerChainDataSource(offerLedger), indexerExecutor,
                properties.getLookupTimeout());
    }

    @Bean
    public ChainPurchaseHistory chainPurchaseHistory(BlockchainMarketplaceService blockchainService,
                                                     ExecutorService indexerExecutor,
                                                     IndexerProperties properties) {
        ChainPurchaseHistory history = new ChainPurchaseHistory(blockchainService.chainDataSource(),
                indexerExecutor, properties.getLookupTimeout());
        if (history.isAvailable()) {
            log.info("Chain purchase history reading from the deployed contract");
        }
        return history;
    }
}
