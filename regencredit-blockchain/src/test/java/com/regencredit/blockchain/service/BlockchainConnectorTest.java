package com.regencredit.blockchain.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BlockchainConnectorTest {

    @Test
    void disabledConnectorProvidesNothing() {
        BlockchainConnector connector = new BlockchainConnector(new BlockchainConfig());

        assertThat(connector.isEnabled()).isFalse();
        assertThat(connector.tokenLedger()).isEmpty();
        assertThat(connector.blockHeightSource()).isEmpty();
    }

    @Test
    void enabledConnectorWiresTheContract() {
        BlockchainConfig config = new BlockchainConfig();
        config.setEnabled(true);
        config.setTokenContractAddress("0x00000000000000000000000000000000000000c3");
        config.setPrivateKey("0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318");

        BlockchainConnector connector = new BlockchainConnector(config);

        assertThat(connector.isEnabled()).isTrue();
        assertThat(connector.tokenLedger()).containsInstanceOf(Web3jTokenLedger.class);
        assertThat(connector.blockHeightSource()).isPresent();
    }
}
