package com.timemarket.blockchain.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for blockchain connectivity.
 */
@Configuration
@ConfigurationProperties(prefix = "timemarket.blockchain")
public class BlockchainConfig {

    private String nodeUrl = "http://localhost:8545";
    private String marketplaceAddress;
    private String privateKey;
    private long gasPrice = 20_000_000_000L; // 20 Gwei
    private long gasLimit = 6_721_975L;
    private long deployBlock = 0L;
    private boolean enabled = false;

    public String getNodeUrl() { return nodeUrl; }
    public void setNodeUrl(String nodeUrl) { this.nodeUrl = nodeUrl; }
    public String getMarketplaceAddress() { return marketplaceAddress; }
    public void setMarketplaceAddress(String addr) { this.marketplaceAddress = addr; }
    public String getPrivateKey() { return privateKey; }
    public void setPrivateKey(String privateKey) { this.privateKey = privateKey; }
    public long getGasPrice() { return gasPrice; }
    public void setGasPrice(long gasPrice) { this.gasPrice = gasPrice; }
    public long getGasLimit() { return gasLimit; }
    public void setGasLimit(long gasLimit) { this.gasLimit = gasLimit; }
    public long getDeployBlock() { return deployBlock; }
    public void setDeployBlock(long deployBlock) { this.deployBlock = deployBlock; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
