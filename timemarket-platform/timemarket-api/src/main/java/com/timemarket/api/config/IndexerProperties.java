package com.timemarket.api.config;

import com.timemarket.core.reconcile.PurchaseReconciliationService;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Settings of the purchase history indexer.
 */
@Configuration
@ConfigurationProperties(prefix = "timemarket.indexer")
public class IndexerProperties {

    private Duration lookupTimeout = PurchaseReconciliationService.DEFAULT_LOOKUP_TIMEOUT;
    private int threads = 4;

    public Duration getLookupTimeout() { return lookupTimeout; }
    public void setLookupTimeout(Duration lookupTimeout) { this.lookupTimeout = lookupTimeout; }
    public int getThreads() { return threads; }
    public void setThreads(int threads) { this.threads = threads; }
}
