package com.regencredit.blockchain.service;

import com.regencredit.blockchain.contract.RegenerationTokenContract;
import com.regencredit.core.ledger.TokenLedger;
import com.regencredit.core.time.BlockHeightSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Connects the protocol to the chain when enabled: the token contract becomes the
 * ledger and the node's block number the clock.
 */
@Service
public class BlockchainConnector {

    private static final Logger log = LoggerFactory.getLogger(BlockchainConnector.class);
    private final BlockchainConfig config;
    private Web3jTokenLedger ledger;
    private ChainBlockHeightSource blockHeight;

    public BlockchainConnector(BlockchainConfig config) {
        this.config = config;
        if (config.isEnabled()) {
            initializeContract();
        }
    }

    private void initializeContract() {
        try {
            Web3j web3j = Web3j.build(new HttpService(config.getNodeUrl()));
            Credentials credentials = Credentials.create(config.getPrivateKey());
            StaticGasProvider gasProvider = new StaticGasProvider(
                    BigInteger.valueOf(config.getGasPrice()),
                    BigInteger.valueOf(config.getGasLimit()));
            RegenerationTokenContract contract = RegenerationTokenContract.load(
                    config.getTokenContractAddress(), web3j, credentials, gasProvider);
            this.ledger = new Web3jTokenLedger(contract, config.getPoolAddresses());
            this.blockHeight = new ChainBlockHeightSource(web3j);
            log.info("Regeneration token contract initialized at {}", config.getTokenContractAddress());
        } catch (Exception e) {
            log.error("Failed to initialize the regeneration token contract", e);
        }
    }

    public Optional<TokenLedger> tokenLedger() {
        return Optional.ofNullable(ledger);
    }

    public Optional<BlockHeightSource> blockHeightSource() {
        return Optional.ofNullable(blockHeight);
    }

    public boolean isEnabled() {
        return config.isEnabled() && ledger != null;
    }
}
