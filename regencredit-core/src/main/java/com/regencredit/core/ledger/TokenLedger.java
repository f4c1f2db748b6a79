package com.regencredit.core.ledger;

import java.math.BigInteger;

/**
 * Balance ledger of the regeneration credit token. The protocol never moves tokens
 * itself; it instructs the ledger.
 */
public interface TokenLedger {

    BigInteger balanceOf(String account);

    /**
     * Moves tokens between two accounts.
     *
     * @throws LedgerException if the sender balance is insufficient or the ledger is unreachable
     */
    void transfer(String from, String to, BigInteger amount);

    /**
     * Burns tokens held by an account and counts them as certified.
     */
    void burnFrom(String account, BigInteger amount);

    /**
     * Releases tokens from the locked reserve ahead of a pool payout.
     */
    void decreaseLocked(BigInteger amount);

    /**
     * Pays locked tokens out of a pool account. The reserve shrinks and the recipient is
     * credited together: when this throws, neither has changed.
     *
     * @throws LedgerException if the reserve or the pool balance cannot cover the amount
     */
    void release(String from, String to, BigInteger amount);

    BigInteger totalSupply();

    BigInteger totalLocked();

    BigInteger totalCertified();
}
