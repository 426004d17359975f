package com.timemarket.api.config;

import com.timemarket.core.ledger.LedgerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings of the in-process offer ledger.
 */
@Configuration
@ConfigurationProperties(prefix = "timemarket.ledger")
public class LedgerProperties {

    private String contractAddress;
    private String owner;
    private String treasury;
    private int platformFeeBps = LedgerSettings.DEFAULT_FEE_BPS;
    private String coprocessorKey; // hex, random when unset
    private long chainId = 11155111L; // Sepolia

    public LedgerSettings toSettings() {
        return new LedgerSettings(contractAddress, owner, treasury, platformFeeBps);
    }

    public String getContractAddress() { return contractAddress; }
    public void setContractAddress(String contractAddress) { this.contractAddress = contractAddress; }
    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }
    public String getTreasury() { return treasury; }
    public void setTreasury(String treasury) { this.treasury = treasury; }
    public int getPlatformFeeBps() { return platformFeeBps; }
    public void setPlatformFeeBps(int platformFeeBps) { this.platformFeeBps = platformFeeBps; }
    public String getCoprocessorKey() { return coprocessorKey; }
    public void setCoprocessorKey(String coprocessorKey) { this.coprocessorKey = coprocessorKey; }
    public long getChainId() { return chainId; }
    public void setChainId(long chainId) { this.chainId = chainId; }
}
