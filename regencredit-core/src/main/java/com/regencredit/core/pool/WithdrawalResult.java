package com.regencredit.core.pool;

import java.math.BigInteger;

/**
 * Outcome of a withdrawal call. Only {@link Status#PAID} moves tokens.
 *
 * @param era era the call looked at
 * @param nextEra the account's withdrawal pointer after the call
 */
public record WithdrawalResult(
        PoolType pool,
        String account,
        int era,
        Status status,
        BigInteger amount,
        int nextEra
) {
    public enum Status {
        /** Share of the era transferred. */
        PAID,
        /** No levels in the era; pointer moved on. */
        SKIPPED,
        /** Era already claimed by this account. */
        ALREADY_CLAIMED,
        /** Era still running, or the account never earned levels. */
        NOTHING_TO_CLAIM
    }

    static WithdrawalResult nothing(PoolType pool, String account, int era, int nextEra) {
        return new WithdrawalResult(pool, account, era, Status.NOTHING_TO_CLAIM, BigInteger.ZERO, nextEra);
    }

    public boolean paid() {
        return status == Status.PAID;
    }
}
