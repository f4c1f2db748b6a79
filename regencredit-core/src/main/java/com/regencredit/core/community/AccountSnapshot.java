package com.regencredit.core.community;

/**
 * Read-only view of an account.
 */
public record AccountSnapshot(
        String address,
        UserType type,
        UserType registeredType,
        String name,
        String proofPhotoHash,
        String inviter,
        long registeredAtBlock,
        int inviterPenalties
) {}
