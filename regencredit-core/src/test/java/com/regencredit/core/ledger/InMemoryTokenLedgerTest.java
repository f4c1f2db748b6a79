package com.regencredit.core.ledger;

import com.regencredit.core.config.ProtocolConfig;
import com.regencredit.core.pool.PoolType;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

class InMemoryTokenLedgerTest {

    @Test
    void fundedLedgerLocksEveryPoolBudget() {
        ProtocolConfig config = ProtocolConfig.defaults();
        InMemoryTokenLedger ledger = InMemoryTokenLedger.funded(config);

        BigInteger expected = ProtocolConfig.TOKEN_UNIT.multiply(BigInteger.valueOf(1_035_000_000));
        assertThat(ledger.totalSupply()).isEqualTo(expected);
        assertThat(ledger.totalLocked()).isEqualTo(expected);
        assertThat(ledger.balanceOf(PoolType.REGENERATOR.ledgerAddress()))
                .isEqualTo(config.totalPoolTokens(PoolType.REGENERATOR));
    }

    @Test
    void burningCertifiesAndShrinksSupply() {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger();
        ledger.mint("supporter", BigInteger.valueOf(100));

        ledger.burnFrom("supporter", BigInteger.valueOf(40));

        assertThat(ledger.balanceOf("supporter")).isEqualTo(BigInteger.valueOf(60));
        assertThat(ledger.totalSupply()).isEqualTo(BigInteger.valueOf(60));
        assertThat(ledger.totalCertified()).isEqualTo(BigInteger.valueOf(40));
    }

    @Test
    void overdraftsAreRejected() {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger();
        ledger.mint("alice", BigInteger.TEN);

        assertThatThrownBy(() -> ledger.transfer("alice", "bob", BigInteger.valueOf(11)))
                .isInstanceOf(LedgerException.class);
        assertThatThrownBy(() -> ledger.decreaseLocked(BigInteger.ONE))
                .isInstanceOf(LedgerException.class);
        assertThat(ledger.balanceOf("alice")).isEqualTo(BigInteger.TEN);
        assertThat(ledger.balanceOf("bob")).isZero();
    }

    @Test
    void releaseMovesLockedTokensOrNothing() {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger();
        ledger.mintLocked("pool", BigInteger.valueOf(100));

        ledger.release("pool", "alice", BigInteger.valueOf(30));

        assertThat(ledger.balanceOf("alice")).isEqualTo(BigInteger.valueOf(30));
        assertThat(ledger.totalLocked()).isEqualTo(BigInteger.valueOf(70));

        assertThatThrownBy(() -> ledger.release("drained", "alice", BigInteger.TEN))
                .isInstanceOf(LedgerException.class);
        assertThat(ledger.totalLocked()).isEqualTo(BigInteger.valueOf(70));
        assertThat(ledger.balanceOf("alice")).isEqualTo(BigInteger.valueOf(30));
    }
}
