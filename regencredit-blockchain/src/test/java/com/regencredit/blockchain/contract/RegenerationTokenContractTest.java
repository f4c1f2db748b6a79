package com.regencredit.blockchain.contract;

import net.jqwik.api.*;
import net.jqwik.api.constraints.BigRange;
import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * ABI encoding of the token contract calls.
 */
class RegenerationTokenContractTest {

    private static final String POOL = "0x00000000000000000000000000000000000000a1";
    private static final String HOLDER = "0x00000000000000000000000000000000000000b2";

    @Test
    void callsUseTheErc20Selectors() {
        assertThat(FunctionEncoder.encode(RegenerationTokenContract.balanceOfFunction(HOLDER)))
                .startsWith("0x70a08231");
        assertThat(FunctionEncoder.encode(RegenerationTokenContract.transferFromFunction(POOL, HOLDER, BigInteger.TEN)))
                .startsWith("0x23b872dd");
        assertThat(FunctionEncoder.encode(RegenerationTokenContract.burnFromFunction(HOLDER, BigInteger.TEN)))
                .startsWith("0x79cc6790");
        assertThat(FunctionEncoder.encode(
                RegenerationTokenContract.totalFunction(RegenerationTokenContract.FUNC_TOTALSUPPLY)))
                .isEqualTo("0x18160ddd");
    }

    @Test
    void reserveQueriesAreDistinctCalls() {
        String locked = FunctionEncoder.encode(
                RegenerationTokenContract.totalFunction(RegenerationTokenContract.FUNC_TOTALLOCKED));
        String certified = FunctionEncoder.encode(
                RegenerationTokenContract.totalFunction(RegenerationTokenContract.FUNC_TOTALCERTIFIED));

        assertThat(locked).isEqualTo(FunctionEncoder.buildMethodId("totalLocked()"));
        assertThat(certified).isEqualTo(FunctionEncoder.buildMethodId("totalCertified()"));
        assertThat(locked).isNotEqualTo(certified);
    }

    /**
     * Property: a transfer always encodes as selector plus three 32-byte words,
     * the amount in the last one.
     */
    @Property(tries = 100)
    void transferEncodesThreeWords(@ForAll @BigRange(min = "0", max = "1000000000000000000000000000") BigInteger amount) {
        String encoded = FunctionEncoder.encode(RegenerationTokenContract.transferFromFunction(POOL, HOLDER, amount));

        assertThat(encoded).hasSize(2 + 8 + 3 * 64);
        assertThat(new BigInteger(encoded.substring(2 + 8 + 2 * 64), 16)).isEqualTo(amount);
    }
}
