package com.regencredit.core.kernel;

import com.regencredit.core.community.AccountSnapshot;
import com.regencredit.core.community.UserType;
import com.regencredit.core.config.ProtocolConfig;
import com.regencredit.core.error.ConfigurationException;
import com.regencredit.core.error.ReasonCode;
import com.regencredit.core.governance.ResourceType;
import com.regencredit.core.ledger.InMemoryTokenLedger;
import com.regencredit.core.pool.PoolType;
import com.regencredit.core.pool.WithdrawalResult;
import com.regencredit.core.time.ManualBlockHeight;
import org.junit.jupiter.api.Test;

import static com.regencredit.core.kernel.ProtocolFixture.ACTIVIST;
import static com.regencredit.core.kernel.ProtocolFixture.DEVELOPER_1;
import static org.assertj.core.api.Assertions.*;

class RegenerationProtocolTest {

    // ==================== Initialization ====================

    @Test
    void builderRequiresBlocksAndLedger() {
        assertThatThrownBy(() -> RegenerationProtocol.builder().ledger(new InMemoryTokenLedger()).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("block height");
        assertThatThrownBy(() -> RegenerationProtocol.builder().blockHeightSource(new ManualBlockHeight()).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("ledger");
    }

    @Test
    void configurationIsLockedAfterBuild() {
        RegenerationProtocol.Builder builder = RegenerationProtocol.builder()
                .blockHeightSource(new ManualBlockHeight())
                .ledger(new InMemoryTokenLedger());
        builder.build();

        assertThatThrownBy(() -> builder.config(ProtocolConfig.defaults()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("locked");
        assertThatThrownBy(builder::build).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void regeneratorsCannotBeFoundingMembers() {
        assertThatThrownBy(() -> RegenerationProtocol.builder()
                .blockHeightSource(new ManualBlockHeight())
                .ledger(new InMemoryTokenLedger())
                .foundingMember("0xr", UserType.REGENERATOR, "Regenerator")
                .build())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void foundingMembersAreRegisteredWithoutInviter() {
        ProtocolFixture f = ProtocolFixture.create();

        AccountSnapshot founder = f.protocol.account(ACTIVIST).orElseThrow();
        assertThat(founder.type()).isEqualTo(UserType.ACTIVIST);
        assertThat(founder.inviter()).isNull();
        assertThat(f.protocol.countOf(UserType.DEVELOPER)).isEqualTo(2);
        assertThat(f.protocol.overview().population())
                .containsEntry(UserType.RESEARCHER, 2L)
                .containsEntry(UserType.REGENERATOR, 0L);
    }

    // ==================== Community ====================

    @Test
    void invitedMembersRegister() {
        ProtocolFixture f = ProtocolFixture.create().at(50);
        String regenerator = f.regenerator("0xr");

        AccountSnapshot account = f.protocol.account(regenerator).orElseThrow();
        assertThat(account.inviter()).isEqualTo(ACTIVIST);
        assertThat(account.registeredAtBlock()).isEqualTo(50);
        assertThat(f.protocol.regenerator(regenerator).orElseThrow().area()).isEqualTo(ProtocolFixture.AREA);
    }

    @Test
    void registrationNeedsAnInvitationAndAValidArea() {
        ProtocolFixture f = ProtocolFixture.create();

        assertThatThrownBy(() -> f.protocol.registerUser("0xi", UserType.INSPECTOR, "Inspector", null))
                .extracting("reason").isEqualTo(ReasonCode.INVITATION_REQUIRED);
        assertThatThrownBy(() -> f.protocol.registerUser("0xr", UserType.REGENERATOR, "Regenerator", null))
                .extracting("reason").isEqualTo(ReasonCode.AREA_OUT_OF_BOUNDS);

        f.protocol.invite(ACTIVIST, "0xr", UserType.REGENERATOR);
        assertThatThrownBy(() -> f.protocol.registerRegenerator("0xr", "Regenerator", null, 100))
                .extracting("reason").isEqualTo(ReasonCode.AREA_OUT_OF_BOUNDS);
        assertThat(f.protocol.account("0xr")).isEmpty();
    }

    @Test
    void onlyTheConfiguredTypeInvites() {
        ProtocolFixture f = ProtocolFixture.create();

        assertThatThrownBy(() -> f.protocol.invite(DEVELOPER_1, "0xr", UserType.REGENERATOR))
                .extracting("reason").isEqualTo(ReasonCode.INVITATION_NOT_ALLOWED);
        assertThat(f.protocol.invite(DEVELOPER_1, "0xdev3", UserType.DEVELOPER).inviter()).isEqualTo(DEVELOPER_1);
    }

    // ==================== Lifecycle ====================

    @Test
    void stoppedProtocolRejectsMutationsButServesReads() {
        ProtocolFixture f = ProtocolFixture.create();
        f.protocol.stop();

        assertThat(f.protocol.isRunning()).isFalse();
        assertThatThrownBy(() -> f.protocol.invite(ACTIVIST, "0xr", UserType.REGENERATOR))
                .extracting("reason").isEqualTo(ReasonCode.PROTOCOL_NOT_RUNNING);
        assertThat(f.protocol.account(ACTIVIST)).isPresent();
        assertThat(f.protocol.poolStatus(PoolType.REGENERATOR).currentEra()).isEqualTo(1);
    }

    @Test
    void overviewReportsTheClockAndSupply() {
        ProtocolFixture f = ProtocolFixture.create().at(11_500);

        ProtocolOverview overview = f.protocol.overview();

        assertThat(overview.era()).isEqualTo(1);
        assertThat(overview.epoch()).isEqualTo(1);
        assertThat(overview.blocksUntilEraEnd()).isEqualTo(500);
        assertThat(overview.safeguardActive()).isTrue();
        assertThat(overview.totalSupply()).isEqualTo(overview.totalLocked());
    }

    @Test
    void withdrawingARunningEraPaysNothing() {
        ProtocolFixture f = ProtocolFixture.create().at(100);
        f.protocol.publishResource(DEVELOPER_1, ResourceType.REPORT, "Report", null, "hash");

        WithdrawalResult early = f.protocol.withdraw(PoolType.DEVELOPER, DEVELOPER_1);
        assertThat(early.status()).isEqualTo(WithdrawalResult.Status.NOTHING_TO_CLAIM);

        f.at(12_000);
        WithdrawalResult paid = f.protocol.withdraw(PoolType.DEVELOPER, DEVELOPER_1);
        assertThat(paid.paid()).isTrue();
        assertThat(f.protocol.withdraw(PoolType.DEVELOPER, DEVELOPER_1, 1).status())
                .isEqualTo(WithdrawalResult.Status.ALREADY_CLAIMED);
        assertThat(f.protocol.eraAggregate(PoolType.DEVELOPER, 1).claimsCount()).isEqualTo(1);
    }

    @Test
    void unregisteredAccountsCannotWithdraw() {
        ProtocolFixture f = ProtocolFixture.create();

        assertThatThrownBy(() -> f.protocol.withdraw(PoolType.REGENERATOR, "0xstranger"))
                .extracting("reason").isEqualTo(ReasonCode.NOT_REGISTERED);
    }
}
