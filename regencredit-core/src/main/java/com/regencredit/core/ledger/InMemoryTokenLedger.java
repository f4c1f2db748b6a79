package com.regencredit.core.ledger;

import com.regencredit.core.config.ProtocolConfig;
import com.regencredit.core.pool.PoolType;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ledger kept in memory. Backs local runs without a chain and the test suites.
 */
public class InMemoryTokenLedger implements TokenLedger {

    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;
    private BigInteger totalLocked = BigInteger.ZERO;
    private BigInteger totalCertified = BigInteger.ZERO;

    /**
     * A ledger holding every pool budget of the configuration, locked, at the pool addresses.
     */
    public static InMemoryTokenLedger funded(ProtocolConfig config) {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger();
        for (PoolType pool : PoolType.values()) {
            BigInteger budget = config.totalPoolTokens(pool);
            if (budget.signum() > 0) {
                ledger.mintLocked(pool.ledgerAddress(), budget);
            }
        }
        return ledger;
    }

    /**
     * Mints tokens into an account and marks them locked, the way pool budgets are
     * allocated at genesis.
     */
    public synchronized void mintLocked(String account, BigInteger amount) {
        requirePositive(amount);
        balances.merge(Objects.requireNonNull(account, "Account cannot be null"), amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
        totalLocked = totalLocked.add(amount);
    }

    /**
     * Mints freely circulating tokens.
     */
    public synchronized void mint(String account, BigInteger amount) {
        requirePositive(amount);
        balances.merge(Objects.requireNonNull(account, "Account cannot be null"), amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
    }

    @Override
    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized void transfer(String from, String to, BigInteger amount) {
        requirePositive(amount);
        Objects.requireNonNull(to, "Recipient cannot be null");
        debit(from, amount);
        balances.merge(to, amount, BigInteger::add);
    }

    @Override
    public synchronized void burnFrom(String account, BigInteger amount) {
        requirePositive(amount);
        debit(account, amount);
        totalSupply = totalSupply.subtract(amount);
        totalCertified = totalCertified.add(amount);
    }

    @Override
    public synchronized void decreaseLocked(BigInteger amount) {
        requirePositive(amount);
        if (totalLocked.compareTo(amount) < 0) {
            throw new LedgerException("Locked reserve " + totalLocked + " cannot cover " + amount);
        }
        totalLocked = totalLocked.subtract(amount);
    }

    @Override
    public synchronized void release(String from, String to, BigInteger amount) {
        requirePositive(amount);
        Objects.requireNonNull(to, "Recipient cannot be null");
        if (totalLocked.compareTo(amount) < 0) {
            throw new LedgerException("Locked reserve " + totalLocked + " cannot cover " + amount);
        }
        debit(from, amount);
        balances.merge(to, amount, BigInteger::add);
        totalLocked = totalLocked.subtract(amount);
    }

    @Override
    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public synchronized BigInteger totalLocked() {
        return totalLocked;
    }

    @Override
    public synchronized BigInteger totalCertified() {
        return totalCertified;
    }

    private void debit(String account, BigInteger amount) {
        BigInteger balance = balanceOf(account);
        if (balance.compareTo(amount) < 0) {
            throw new LedgerException("Insufficient balance on " + account + ": " + balance + " < " + amount);
        }
        balances.put(account, balance.subtract(amount));
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerException("Amount must be positive, got " + amount);
        }
    }
}
