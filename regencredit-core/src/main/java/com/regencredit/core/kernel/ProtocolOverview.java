package com.regencredit.core.kernel;

import com.regencredit.core.community.UserType;

import java.math.BigInteger;
import java.util.Map;

/**
 * Protocol-wide figures at one block height.
 */
public record ProtocolOverview(
        long blockNumber,
        int era,
        int epoch,
        long blocksUntilEraEnd,
        boolean safeguardActive,
        Map<UserType, Long> population,
        long votesToInvalidate,
        BigInteger totalSupply,
        BigInteger totalLocked,
        BigInteger totalCertified
) {}
