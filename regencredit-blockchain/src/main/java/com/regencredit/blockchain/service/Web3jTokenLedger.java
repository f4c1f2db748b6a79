package com.regencredit.blockchain.service;

import com.regencredit.blockchain.contract.RegenerationTokenContract;
import com.regencredit.core.ledger.LedgerException;
import com.regencredit.core.ledger.TokenLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TokenLedger} backed by the regeneration credit token contract.
 *
 * <p>Pool ledger addresses are translated to the on-chain holders configured for them;
 * every other account is already an on-chain address. Calls block until the
 * transaction is mined.
 *
 * <p>A pool payout takes two transactions. The transfer goes first so a failed payout
 * leaves the reserve untouched; a reserve release that fails after the transfer is kept
 * and retried ahead of the next payout.
 */
public class Web3jTokenLedger implements TokenLedger {

    private static final Logger log = LoggerFactory.getLogger(Web3jTokenLedger.class);

    private final RegenerationTokenContract contract;
    private final Map<String, String> poolAddresses;
    private BigInteger pendingUnlock = BigInteger.ZERO;

    public Web3jTokenLedger(RegenerationTokenContract contract, Map<String, String> poolAddresses) {
        this.contract = Objects.requireNonNull(contract, "Contract cannot be null");
        this.poolAddresses = Map.copyOf(Objects.requireNonNull(poolAddresses, "Pool addresses cannot be null"));
    }

    @Override
    public BigInteger balanceOf(String account) {
        return call("balanceOf " + account, contract.balanceOf(resolve(account)));
    }

    @Override
    public void transfer(String from, String to, BigInteger amount) {
        submit("transfer " + amount + " from " + from + " to " + to,
                contract.transferFrom(resolve(from), resolve(to), amount));
    }

    @Override
    public void burnFrom(String account, BigInteger amount) {
        submit("burn " + amount + " from " + account, contract.burnFrom(resolve(account), amount));
    }

    @Override
    public void decreaseLocked(BigInteger amount) {
        submit("release " + amount + " from the locked reserve", contract.decreaseLocked(amount));
    }

    @Override
    public synchronized void release(String from, String to, BigInteger amount) {
        flushPendingUnlock();
        transfer(from, to, amount);
        try {
            decreaseLocked(amount);
        } catch (LedgerException e) {
            pendingUnlock = pendingUnlock.add(amount);
            log.error("Paid {} to {} but the reserve release failed, {} queued for retry", amount, to, pendingUnlock, e);
        }
    }

    /**
     * Reserve releases owed by payouts whose second transaction failed.
     */
    public synchronized BigInteger pendingUnlock() {
        return pendingUnlock;
    }

    private void flushPendingUnlock() {
        if (pendingUnlock.signum() > 0) {
            decreaseLocked(pendingUnlock);
            log.info("Released {} owed to the locked reserve", pendingUnlock);
            pendingUnlock = BigInteger.ZERO;
        }
    }

    @Override
    public BigInteger totalSupply() {
        return call("totalSupply", contract.totalSupply());
    }

    @Override
    public BigInteger totalLocked() {
        return call("totalLocked", contract.totalLocked());
    }

    @Override
    public BigInteger totalCertified() {
        return call("totalCertified", contract.totalCertified());
    }

    String resolve(String account) {
        Objects.requireNonNull(account, "Account cannot be null");
        if (!account.startsWith("pool:")) {
            return account;
        }
        String address = poolAddresses.get(account);
        if (address == null) {
            throw new LedgerException("No on-chain address configured for " + account);
        }
        return address;
    }

    private void submit(String action, RemoteFunctionCall<TransactionReceipt> transaction) {
        TransactionReceipt receipt;
        try {
            receipt = transaction.send();
        } catch (Exception e) {
            log.error("Failed to {} on the token contract", action, e);
            throw new LedgerException("Token contract unreachable: " + action, e);
        }
        if (!receipt.isStatusOK()) {
            log.warn("Token contract rejected {} (tx {})", action, receipt.getTransactionHash());
            throw new LedgerException("Token contract rejected " + action);
        }
        log.debug("Token contract accepted {} (tx {})", action, receipt.getTransactionHash());
    }

    private <T> T call(String action, RemoteFunctionCall<T> query) {
        try {
            return query.send();
        } catch (Exception e) {
            log.error("Failed to read {} from the token contract", action, e);
            throw new LedgerException("Token contract unreachable: " + action, e);
        }
    }
}
