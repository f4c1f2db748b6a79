package com.regencredit.api.config;

import com.regencredit.blockchain.service.BlockchainConfig;
import com.regencredit.blockchain.service.BlockchainConnector;
import com.regencredit.core.config.ProtocolConfig;
import com.regencredit.core.error.ConfigurationException;
import com.regencredit.core.kernel.RegenerationProtocol;
import com.regencredit.core.ledger.InMemoryTokenLedger;
import com.regencredit.core.ledger.TokenLedger;
import com.regencredit.core.time.BlockHeightSource;
import com.regencredit.core.time.ManualBlockHeight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the protocol once at startup. With the chain enabled the token contract and
 * the node's block number back it; otherwise an in-memory ledger funded with the pool
 * budgets and a manually advanced clock do.
 */
@Configuration
public class ProtocolConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ProtocolConfiguration.class);

    @Bean
    public ProtocolConfig protocolConfig(ProtocolProperties properties) {
        return properties.toConfig();
    }

    @Bean
    public TokenLedger tokenLedger(BlockchainConfig blockchain, BlockchainConnector connector,
                                   ProtocolConfig config) {
        if (blockchain.isEnabled()) {
            return connector.tokenLedger()
                    .orElseThrow(() -> new ConfigurationException("Blockchain enabled but the token contract is unavailable"));
        }
        log.warn("Blockchain disabled, using an in-memory token ledger");
        return InMemoryTokenLedger.funded(config);
    }

    @Bean
    public BlockHeightSource blockHeightSource(BlockchainConfig blockchain, BlockchainConnector connector,
                                               ProtocolProperties properties) {
        if (blockchain.isEnabled()) {
            return connector.blockHeightSource()
                    .orElseThrow(() -> new ConfigurationException("Blockchain enabled but the node is unavailable"));
        }
        return new ManualBlockHeight(properties.getStartBlock());
    }

    @Bean(destroyMethod = "stop")
    public RegenerationProtocol regenerationProtocol(ProtocolConfig config, TokenLedger ledger,
                                                     BlockHeightSource blocks, ProtocolProperties properties) {
        RegenerationProtocol.Builder builder = RegenerationProtocol.builder()
                .config(config)
                .ledger(ledger)
                .blockHeightSource(blocks);
        properties.getFoundingMembers().forEach(member ->
                builder.foundingMember(member.getAddress(), member.getType(), member.getName()));
        return builder.build();
    }
}
