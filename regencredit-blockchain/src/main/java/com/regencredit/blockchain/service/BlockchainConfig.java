package com.regencredit.blockchain.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for blockchain connectivity.
 */
@Configuration
@ConfigurationProperties(prefix = "regencredit.blockchain")
public class BlockchainConfig {

    private String nodeUrl = "http://localhost:8545";
    private String tokenContractAddress;
    private String privateKey;
    private long gasPrice = 20_000_000_000L; // 20 Gwei
    private long gasLimit = 6_721_975L;
    private boolean enabled = false;
    // pool ledger address (pool:regenerator) -> on-chain holder address
    private Map<String, String> poolAddresses = new HashMap<>();

    public String getNodeUrl() { return nodeUrl; }
    public void setNodeUrl(String nodeUrl) { this.nodeUrl = nodeUrl; }
    public String getTokenContractAddress() { return tokenContractAddress; }
    public void setTokenContractAddress(String addr) { this.tokenContractAddress = addr; }
    public String getPrivateKey() { return privateKey; }
    public void setPrivateKey(String privateKey) { this.privateKey = privateKey; }
    public long getGasPrice() { return gasPrice; }
    public void setGasPrice(long gasPrice) { this.gasPrice = gasPrice; }
    public long getGasLimit() { return gasLimit; }
    public void setGasLimit(long gasLimit) { this.gasLimit = gasLimit; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Map<String, String> getPoolAddresses() { return poolAddresses; }
    public void setPoolAddresses(Map<String, String> poolAddresses) { this.poolAddresses = poolAddresses; }
}
