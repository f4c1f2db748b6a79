package com.regencredit.core.pool;

/**
 * An account's standing in one pool.
 *
 * @param era era the withdrawal pointer rests on
 * @param totalLevels levels held across all eras
 * @param eraLevels levels held in {@code era}
 * @param elapsedEras era lengths elapsed since {@code era} ended, fixed-point scaled
 */
public record PoolPosition(
        PoolType pool,
        String account,
        int era,
        long totalLevels,
        long eraLevels,
        long elapsedEras,
        boolean canWithdraw
) {}
