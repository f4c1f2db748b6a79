package com.regencredit.core.pool;

import java.math.BigInteger;

/**
 * Snapshot of a pool at a block height.
 */
public record PoolStatus(
        PoolType pool,
        BigInteger totalPoolTokens,
        int currentEra,
        int currentEpoch,
        BigInteger tokensPerEra,
        long currentEraLevels,
        long totalActiveLevels
) {}
