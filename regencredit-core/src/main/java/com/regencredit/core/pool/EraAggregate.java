package com.regencredit.core.pool;

import java.math.BigInteger;

/**
 * Per-era pool totals. {@code totalLevels} is the denominator of the era's distribution.
 */
public record EraAggregate(
        int era,
        long claimsCount,
        BigInteger tokensClaimed,
        long totalLevels
) {}
