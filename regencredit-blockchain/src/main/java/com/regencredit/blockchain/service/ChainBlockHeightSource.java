package com.regencredit.blockchain.service;

import com.regencredit.core.ledger.LedgerException;
import com.regencredit.core.time.BlockHeightSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Block height read from the node with {@code eth_blockNumber}. Never reports a height
 * lower than one it already returned, even when a load-balanced node lags behind.
 */
public class ChainBlockHeightSource implements BlockHeightSource {

    private static final Logger log = LoggerFactory.getLogger(ChainBlockHeightSource.class);

    private final Web3j web3j;
    private final AtomicLong highest = new AtomicLong();

    public ChainBlockHeightSource(Web3j web3j) {
        this.web3j = Objects.requireNonNull(web3j, "Web3j cannot be null");
    }

    @Override
    public long currentBlock() {
        long reported;
        try {
            reported = web3j.ethBlockNumber().send().getBlockNumber().longValueExact();
        } catch (IOException e) {
            log.error("Failed to read the block height from the node", e);
            throw new LedgerException("Node unreachable while reading the block height", e);
        }
        return highest.accumulateAndGet(reported, Math::max);
    }
}
