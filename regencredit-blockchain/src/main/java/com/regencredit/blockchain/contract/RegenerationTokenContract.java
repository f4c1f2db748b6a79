package com.regencredit.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * Regeneration credit token contract - Web3j wrapper.
 *
 * ERC-20 token with a locked reserve holding the pool budgets. The protocol operator
 * moves pool tokens with {@code transferFrom} and releases the reserve with
 * {@code decreaseLocked}; supporters' offsets go through {@code burnFrom}, which also
 * counts the burn as certified.
 */
public class RegenerationTokenContract extends Contract {

    public static final String BINARY = "";
    public static final String FUNC_BALANCEOF = "balanceOf";
    public static final String FUNC_TRANSFERFROM = "transferFrom";
    public static final String FUNC_BURNFROM = "burnFrom";
    public static final String FUNC_DECREASELOCKED = "decreaseLocked";
    public static final String FUNC_TOTALSUPPLY = "totalSupply";
    public static final String FUNC_TOTALLOCKED = "totalLocked";
    public static final String FUNC_TOTALCERTIFIED = "totalCertified";

    // Events
    public static final Event TRANSFER_EVENT = new Event("Transfer",
            Arrays.asList(
                    new TypeReference<Address>(true) {},  // from
                    new TypeReference<Address>(true) {},  // to
                    new TypeReference<Uint256>() {}       // value
            ));

    public static final Event CERTIFIED_EVENT = new Event("Certified",
            Arrays.asList(
                    new TypeReference<Address>(true) {},  // supporter
                    new TypeReference<Uint256>() {}       // amount
            ));

    protected RegenerationTokenContract(String contractAddress, Web3j web3j,
                                        Credentials credentials, ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    public RemoteFunctionCall<BigInteger> balanceOf(String account) {
        return executeRemoteCallSingleValueReturn(balanceOfFunction(account), BigInteger.class);
    }

    public RemoteFunctionCall<TransactionReceipt> transferFrom(String from, String to, BigInteger amount) {
        return executeRemoteCallTransaction(transferFromFunction(from, to, amount));
    }

    /**
     * Burns tokens of an account and adds them to the certified total.
     */
    public RemoteFunctionCall<TransactionReceipt> burnFrom(String account, BigInteger amount) {
        return executeRemoteCallTransaction(burnFromFunction(account, amount));
    }

    /**
     * Releases tokens from the locked reserve ahead of a pool payout.
     */
    public RemoteFunctionCall<TransactionReceipt> decreaseLocked(BigInteger amount) {
        final Function function = new Function(
                FUNC_DECREASELOCKED,
                Arrays.asList(new Uint256(amount)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    public RemoteFunctionCall<BigInteger> totalSupply() {
        return executeRemoteCallSingleValueReturn(totalFunction(FUNC_TOTALSUPPLY), BigInteger.class);
    }

    public RemoteFunctionCall<BigInteger> totalLocked() {
        return executeRemoteCallSingleValueReturn(totalFunction(FUNC_TOTALLOCKED), BigInteger.class);
    }

    public RemoteFunctionCall<BigInteger> totalCertified() {
        return executeRemoteCallSingleValueReturn(totalFunction(FUNC_TOTALCERTIFIED), BigInteger.class);
    }

    public static RegenerationTokenContract load(String contractAddress, Web3j web3j,
                                                 Credentials credentials, ContractGasProvider gasProvider) {
        return new RegenerationTokenContract(contractAddress, web3j, credentials, gasProvider);
    }

    // ==================== ABI functions ====================

    static Function balanceOfFunction(String account) {
        return new Function(
                FUNC_BALANCEOF,
                Arrays.asList(new Address(account)),
                Arrays.asList(new TypeReference<Uint256>() {}));
    }

    static Function transferFromFunction(String from, String to, BigInteger amount) {
        return new Function(
                FUNC_TRANSFERFROM,
                Arrays.asList(new Address(from), new Address(to), new Uint256(amount)),
                Collections.emptyList());
    }

    static Function burnFromFunction(String account, BigInteger amount) {
        return new Function(
                FUNC_BURNFROM,
                Arrays.asList(new Address(account), new Uint256(amount)),
                Collections.emptyList());
    }

    static Function totalFunction(String name) {
        return new Function(
                name,
                Collections.emptyList(),
                Arrays.asList(new TypeReference<Uint256>() {}));
    }
}
