package com.regencredit.core.inspection;

import com.regencredit.core.community.UserType;
import com.regencredit.core.config.ProtocolConfig;
import com.regencredit.core.config.ProtocolConfig.InspectionSettings;
import com.regencredit.core.error.PreconditionViolationException;
import com.regencredit.core.error.ReasonCode;
import com.regencredit.core.error.TemporalGateException;
import com.regencredit.core.governance.ResourceType;
import com.regencredit.core.governance.VoteOutcome;
import com.regencredit.core.kernel.ProtocolFixture;
import com.regencredit.core.kernel.RegenerationProtocol;
import com.regencredit.core.pool.PoolType;
import com.regencredit.core.pool.WithdrawalResult;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.regencredit.core.kernel.ProtocolFixture.ACTIVIST;
import static com.regencredit.core.kernel.ProtocolFixture.RESEARCHER_1;
import static com.regencredit.core.kernel.ProtocolFixture.RESEARCHER_2;
import static org.assertj.core.api.Assertions.*;

class InspectionLifecycleTest {

    private static InspectionSettings settings(int minInspectionsForPool, long deadline, int maxGiveUps) {
        return new InspectionSettings(2_500, 1_000_000, 6, minInspectionsForPool, 0, deadline, 0, maxGiveUps,
                1_000_000, 10_000);
    }

    @Nested
    class PoolEntry {

        @Test
        void regeneratorEntersThePoolOnItsThirdInspection() {
            ProtocolFixture f = ProtocolFixture.create().at(100);
            RegenerationProtocol protocol = f.protocol;
            String regenerator = f.regenerator("0xr");
            String[] inspectors = {f.inspector("0xi1"), f.inspector("0xi2"), f.inspector("0xi3"), f.inspector("0xi4")};

            f.inspect(regenerator, inspectors[0], 20_000, 60);
            f.at(6_100).inspect(regenerator, inspectors[1], 20_000, 60);

            RegeneratorStatus afterTwo = protocol.regenerator(regenerator).orElseThrow();
            assertThat(afterTwo.onContractPool()).isFalse();
            assertThat(afterTwo.regenerationScore()).isEqualTo(32);
            assertThat(afterTwo.poolLevels()).isZero();

            f.at(12_100).inspect(regenerator, inspectors[2], 20_000, 60);

            RegeneratorStatus entered = protocol.regenerator(regenerator).orElseThrow();
            assertThat(entered.onContractPool()).isTrue();
            assertThat(entered.poolLevels()).as("accumulated score posted at entry").isEqualTo(48);
            assertThat(entered.poolEra()).isEqualTo(2);
            assertThat(protocol.position(PoolType.ACTIVIST, ACTIVIST).totalLevels())
                    .as("inviter rewarded once the regenerator entered the pool")
                    .isEqualTo(1);

            f.at(18_100).inspect(regenerator, inspectors[3], 50_000, 25);

            RegeneratorStatus fourth = protocol.regenerator(regenerator).orElseThrow();
            assertThat(fourth.poolLevels()).isEqualTo(68);
            assertThat(fourth.totalInspections()).isEqualTo(4);
            assertThat(protocol.eraImpact(2).realizedInspections()).isEqualTo(2);
            assertThat(protocol.totalImpact().trees()).isEqualTo(110_000);
        }

        @Test
        void closedErasPayTheirShares() {
            ProtocolFixture f = ProtocolFixture.create().at(100);
            String regenerator = f.regenerator("0xr");
            String first = f.inspector("0xi1");
            String second = f.inspector("0xi2");
            String third = f.inspector("0xi3");
            f.inspect(regenerator, first, 20_000, 60);
            f.at(6_100).inspect(regenerator, second, 20_000, 60);
            f.at(12_100).inspect(regenerator, third, 20_000, 60);

            f.at(24_000);
            WithdrawalResult regeneratorShare = f.protocol.withdraw(PoolType.REGENERATOR, regenerator);
            WithdrawalResult inspectorShare = f.protocol.withdraw(PoolType.INSPECTOR, first);

            assertThat(regeneratorShare.status()).isEqualTo(WithdrawalResult.Status.PAID);
            assertThat(regeneratorShare.era()).isEqualTo(2);
            assertThat(regeneratorShare.amount())
                    .isEqualTo(ProtocolConfig.TOKEN_UNIT.multiply(BigInteger.valueOf(31_250_000)));
            assertThat(inspectorShare.era()).isEqualTo(1);
            assertThat(inspectorShare.amount())
                    .as("two inspector levels in era 1")
                    .isEqualTo(ProtocolConfig.TOKEN_UNIT.multiply(BigInteger.valueOf(3_750_000)));
            assertThat(f.ledger.balanceOf(regenerator)).isEqualTo(regeneratorShare.amount());
        }

        @Test
        void poolEntryFollowsTheConfiguredCount() {
            ProtocolFixture f = ProtocolFixture.create(ProtocolFixture.config()
                    .inspection(settings(2, 50_000, 4))
                    .build()).at(100);
            String regenerator = f.regenerator("0xr");
            f.inspect(regenerator, f.inspector("0xi1"), 20_000, 60);
            f.inspect(regenerator, f.inspector("0xi2"), 20_000, 60);

            RegeneratorStatus status = f.protocol.regenerator(regenerator).orElseThrow();
            assertThat(status.onContractPool()).isTrue();
            assertThat(status.poolLevels()).isEqualTo(32);
        }
    }

    @Nested
    class Gates {

        @Test
        void regeneratorHoldsOnePendingInspection() {
            ProtocolFixture f = ProtocolFixture.create().at(100);
            String regenerator = f.regenerator("0xr");
            f.protocol.requestInspection(regenerator);

            assertThatThrownBy(() -> f.protocol.requestInspection(regenerator))
                    .isInstanceOf(PreconditionViolationException.class)
                    .extracting("reason").isEqualTo(ReasonCode.PENDING_INSPECTION);
        }

        @Test
        void requestsRespectTheCooldown() {
            ProtocolFixture f = ProtocolFixture.create().at(100);
            String regenerator = f.regenerator("0xr");
            f.inspect(regenerator, f.inspector("0xi1"), 1, 1);

            f.at(200);
            assertThatThrownBy(() -> f.protocol.requestInspection(regenerator))
                    .isInstanceOfSatisfying(TemporalGateException.class, e -> {
                        assertThat(e.getReason()).isEqualTo(ReasonCode.REQUEST_COOLDOWN);
                        assertThat(e.getAvailableAtBlock()).isEqualTo(6_100);
                    });
        }

        @Test
        void inspectorsWorkOneInspectionAtATime() {
            ProtocolFixture f = ProtocolFixture.create().at(100);
            String first = f.regenerator("0xr1");
            String second = f.regenerator("0xr2");
            String inspector = f.inspector("0xi");
            long firstId = f.protocol.requestInspection(first).id();
            long secondId = f.protocol.requestInspection(second).id();

            f.protocol.acceptInspection(inspector, firstId);
            assertThatThrownBy(() -> f.protocol.acceptInspection(inspector, secondId))
                    .extracting("reason").isEqualTo(ReasonCode.INSPECTOR_BUSY);

            f.protocol.realizeInspection(inspector, firstId, 1_000, 10, "evidence", "report");
            assertThatThrownBy(() -> f.protocol.acceptInspection(inspector, secondId))
                    .isInstanceOfSatisfying(TemporalGateException.class, e -> {
                        assertThat(e.getReason()).isEqualTo(ReasonCode.INSPECTOR_COOLDOWN);
                        assertThat(e.getAvailableAtBlock()).isEqualTo(6_100);
                    });

            f.at(6_100);
            f.protocol.acceptInspection(inspector, secondId);
            f.protocol.realizeInspection(inspector, secondId, 1_000, 10, "evidence", "report");
            long again = f.protocol.requestInspection(first).id();

            f.at(12_200);
            assertThatThrownBy(() -> f.protocol.acceptInspection(inspector, again))
                    .extracting("reason").isEqualTo(ReasonCode.ALREADY_INSPECTED_REGENERATOR);
            assertThat(f.protocol.inspector(inspector).orElseThrow().totalInspections()).isEqualTo(2);
        }

        @Test
        void acceptanceIsBlockedAtTheEndOfAnEra() {
            ProtocolFixture f = ProtocolFixture.create().at(10_900);
            String regenerator = f.regenerator("0xr");
            String inspector = f.inspector("0xi");
            long accepted = f.protocol.requestInspection(regenerator).id();
            f.protocol.acceptInspection(inspector, accepted);

            f.at(11_500);
            String late = f.regenerator("0xr2");
            String other = f.inspector("0xi2");
            long blocked = f.protocol.requestInspection(late).id();
            assertThatThrownBy(() -> f.protocol.acceptInspection(other, blocked))
                    .isInstanceOfSatisfying(TemporalGateException.class, e -> {
                        assertThat(e.getReason()).isEqualTo(ReasonCode.SAFEGUARD_WINDOW);
                        assertThat(e.getAvailableAtBlock()).isEqualTo(12_000);
                    });

            InspectionSnapshot realized = f.protocol.realizeInspection(inspector, accepted, 1_000, 10,
                    "evidence", "report");
            assertThat(realized.status()).isEqualTo(InspectionStatus.INSPECTED);
        }

        @Test
        void resultsAreCappedAndNeverNegative() {
            ProtocolFixture f = ProtocolFixture.create().at(100);
            String regenerator = f.regenerator("0xr");
            String inspector = f.inspector("0xi");
            long id = f.protocol.requestInspection(regenerator).id();
            f.protocol.acceptInspection(inspector, id);

            assertThatThrownBy(() -> f.protocol.realizeInspection(inspector, id, -1, 10, "evidence", "report"))
                    .extracting("reason").isEqualTo(ReasonCode.RESULT_OUT_OF_BOUNDS);
            assertThatThrownBy(() -> f.protocol.realizeInspection(inspector, id, 10, 10, " ", "report"))
                    .extracting("reason").isEqualTo(ReasonCode.INVALID_TEXT);

            InspectionSnapshot realized = f.protocol.realizeInspection(inspector, id, 5_000_000, 50_000,
                    "evidence", "report");
            assertThat(realized.treesResult()).isEqualTo(1_000_000);
            assertThat(realized.biodiversityResult()).isEqualTo(10_000);
            assertThat(realized.regenerationScore()).isEqualTo(ScoringTable.maxScore());
        }
    }

    @Nested
    class Deadlines {

        @Test
        void anotherInspectorTakesOverAnOverdueAcceptance() {
            ProtocolFixture f = ProtocolFixture.create(ProtocolFixture.config()
                    .inspection(settings(3, 100, 4))
                    .build()).at(10);
            String regenerator = f.regenerator("0xr");
            String slow = f.inspector("0xslow");
            String quick = f.inspector("0xquick");
            long id = f.protocol.requestInspection(regenerator).id();
            f.protocol.acceptInspection(slow, id);

            f.at(50);
            assertThatThrownBy(() -> f.protocol.acceptInspection(quick, id))
                    .extracting("reason").isEqualTo(ReasonCode.INVALID_INSPECTION_STATE);

            f.at(200);
            assertThatThrownBy(() -> f.protocol.realizeInspection(slow, id, 10, 10, "evidence", "report"))
                    .extracting("reason").isEqualTo(ReasonCode.INSPECTION_EXPIRED);
            InspectionSnapshot taken = f.protocol.acceptInspection(quick, id);

            assertThat(taken.inspector()).isEqualTo(quick);
            InspectorStatus slowStatus = f.protocol.inspector(slow).orElseThrow();
            assertThat(slowStatus.giveUps()).isEqualTo(1);
            assertThat(slowStatus.activeInspection()).isZero();
            assertThatThrownBy(() -> f.protocol.realizeInspection(slow, id, 10, 10, "evidence", "report"))
                    .extracting("reason").isEqualTo(ReasonCode.NOT_ASSIGNED_INSPECTOR);
            assertThat(f.protocol.realizeInspection(quick, id, 10, 10, "evidence", "report").status())
                    .isEqualTo(InspectionStatus.INSPECTED);
        }

        @Test
        void expiredAcceptanceDoesNotCountAsInspectingTheRegenerator() {
            ProtocolFixture f = ProtocolFixture.create(ProtocolFixture.config()
                    .inspection(settings(3, 100, 4))
                    .build()).at(10);
            String regenerator = f.regenerator("0xr");
            String inspector = f.inspector("0xi");
            long id = f.protocol.requestInspection(regenerator).id();
            f.protocol.acceptInspection(inspector, id);

            f.at(200);
            f.protocol.expireInspection(id);
            assertThat(f.protocol.inspector(inspector).orElseThrow().inspectedRegenerators()).isEmpty();

            assertThat(f.protocol.acceptInspection(inspector, id).inspector()).isEqualTo(inspector);
            f.protocol.realizeInspection(inspector, id, 20_000, 60, "evidence", "report");
            assertThat(f.protocol.inspector(inspector).orElseThrow().inspectedRegenerators())
                    .containsExactly(regenerator);
        }

        @Test
        void expiringTooEarlyPointsToTheFirstPossibleBlock() {
            ProtocolFixture f = ProtocolFixture.create(ProtocolFixture.config()
                    .inspection(settings(3, 100, 4))
                    .build()).at(10);
            String regenerator = f.regenerator("0xr");
            long id = f.protocol.requestInspection(regenerator).id();
            f.protocol.acceptInspection(f.inspector("0xi"), id);

            f.at(50);
            assertThatThrownBy(() -> f.protocol.expireInspection(id))
                    .isInstanceOfSatisfying(TemporalGateException.class, e -> {
                        assertThat(e.getReason()).isEqualTo(ReasonCode.INSPECTION_NOT_EXPIRED);
                        assertThat(e.getAvailableAtBlock()).isEqualTo(111);
                    });
        }

        @Test
        void repeatedGiveUpsDenyTheInspectorAndStripItsLevels() {
            ProtocolFixture f = ProtocolFixture.create(ProtocolFixture.config()
                    .inspection(settings(3, 100, 2))
                    .build()).at(10);
            String first = f.regenerator("0xr1");
            String second = f.regenerator("0xr2");
            String third = f.regenerator("0xr3");
            String inspector = f.inspector("0xi");
            f.inspect(third, inspector, 20_000, 60);
            assertThat(f.protocol.position(PoolType.INSPECTOR, inspector).totalLevels()).isEqualTo(1);

            long firstId = f.protocol.requestInspection(first).id();
            f.protocol.acceptInspection(inspector, firstId);
            f.at(111);
            InspectionSnapshot reopened = f.protocol.expireInspection(firstId);
            assertThat(reopened.status()).isEqualTo(InspectionStatus.OPEN);
            assertThat(reopened.inspector()).isNull();

            long secondId = f.protocol.requestInspection(second).id();
            f.protocol.acceptInspection(inspector, secondId);
            f.at(212);
            f.protocol.expireInspection(secondId);

            assertThat(f.protocol.account(inspector).orElseThrow().type()).isEqualTo(UserType.DENIED);
            assertThat(f.protocol.position(PoolType.INSPECTOR, inspector).totalLevels()).isZero();
            assertThat(f.protocol.countOf(UserType.INSPECTOR)).isZero();
            assertThat(f.protocol.account(ACTIVIST).orElseThrow().inviterPenalties()).isEqualTo(1);
            assertThatThrownBy(() -> f.protocol.acceptInspection(inspector, firstId))
                    .extracting("reason").isEqualTo(ReasonCode.USER_DENIED);
        }

        @Test
        void inspectorOneGiveUpFromDenialMustExpireExplicitly() {
            ProtocolFixture f = ProtocolFixture.create(ProtocolFixture.config()
                    .inspection(settings(3, 100, 1))
                    .build()).at(10);
            String first = f.regenerator("0xr1");
            String second = f.regenerator("0xr2");
            String inspector = f.inspector("0xi");
            long firstId = f.protocol.requestInspection(first).id();
            long secondId = f.protocol.requestInspection(second).id();
            f.protocol.acceptInspection(inspector, firstId);

            f.at(200);
            assertThatThrownBy(() -> f.protocol.acceptInspection(inspector, secondId))
                    .extracting("reason").isEqualTo(ReasonCode.INSPECTOR_BUSY);
            assertThat(f.protocol.inspection(firstId).orElseThrow().status()).isEqualTo(InspectionStatus.ACCEPTED);
        }

        @Test
        void overdueOwnInspectionIsExpiredWhenAcceptingAnother() {
            ProtocolFixture f = ProtocolFixture.create(ProtocolFixture.config()
                    .inspection(settings(3, 100, 4))
                    .build()).at(10);
            String first = f.regenerator("0xr1");
            String second = f.regenerator("0xr2");
            String inspector = f.inspector("0xi");
            long firstId = f.protocol.requestInspection(first).id();
            long secondId = f.protocol.requestInspection(second).id();
            f.protocol.acceptInspection(inspector, firstId);

            f.at(200);
            f.protocol.acceptInspection(inspector, secondId);

            assertThat(f.protocol.inspection(firstId).orElseThrow().status()).isEqualTo(InspectionStatus.OPEN);
            InspectorStatus status = f.protocol.inspector(inspector).orElseThrow();
            assertThat(status.giveUps()).isEqualTo(1);
            assertThat(status.activeInspection()).isEqualTo(secondId);
        }
    }

    @Nested
    class Denial {

        @Test
        void deniedRegeneratorCannotCollectItsAcceptedInspection() {
            ProtocolFixture f = ProtocolFixture.create().at(100);
            String regenerator = f.regenerator("0xr");
            String third = f.inspector("0xi3");
            f.inspect(regenerator, f.inspector("0xi1"), 20_000, 60);
            f.at(6_100).inspect(regenerator, f.inspector("0xi2"), 20_000, 60);
            f.at(12_100);
            long id = f.protocol.requestInspection(regenerator).id();
            f.protocol.acceptInspection(third, id);

            f.at(12_200);
            f.protocol.voteUser(RESEARCHER_1, regenerator, "Area does not exist");
            f.protocol.voteUser(RESEARCHER_2, regenerator, "Confirmed");

            assertThat(f.protocol.account(regenerator).orElseThrow().type()).isEqualTo(UserType.DENIED);
            assertThat(f.protocol.inspection(id).orElseThrow().status()).isEqualTo(InspectionStatus.INVALIDATED);
            assertThatThrownBy(() -> f.protocol.realizeInspection(third, id, 20_000, 60, "evidence", "report"))
                    .isInstanceOf(PreconditionViolationException.class)
                    .extracting("reason").isEqualTo(ReasonCode.USER_DENIED);

            RegeneratorStatus status = f.protocol.regenerator(regenerator).orElseThrow();
            assertThat(status.totalInspections()).isEqualTo(2);
            assertThat(status.onContractPool()).isFalse();
            assertThat(status.pendingInspection()).isFalse();
            assertThat(status.poolLevels()).isZero();
            assertThat(f.protocol.inspector(third).orElseThrow().activeInspection())
                    .as("inspector released")
                    .isZero();

            f.at(24_100);
            assertThatThrownBy(() -> f.protocol.withdraw(PoolType.REGENERATOR, regenerator))
                    .extracting("reason").isEqualTo(ReasonCode.USER_DENIED);
        }

        @Test
        void deniedInspectorHandsItsAcceptanceBack() {
            ProtocolFixture f = ProtocolFixture.create().at(100);
            String regenerator = f.regenerator("0xr");
            String denied = f.inspector("0xi1");
            String other = f.inspector("0xi2");
            long id = f.protocol.requestInspection(regenerator).id();
            f.protocol.acceptInspection(denied, id);

            f.at(200);
            f.protocol.voteUser(RESEARCHER_1, denied, "Never visits");
            f.protocol.voteUser(RESEARCHER_2, denied, "Confirmed");

            assertThat(f.protocol.inspection(id).orElseThrow().status()).isEqualTo(InspectionStatus.OPEN);
            assertThat(f.protocol.acceptInspection(other, id).inspector()).isEqualTo(other);
        }
    }

    @Nested
    class Invalidation {

        @Test
        void invalidatedInspectionIsClawedBack() {
            ProtocolFixture f = ProtocolFixture.create().at(100);
            String regenerator = f.regenerator("0xr");
            String first = f.inspector("0xi1");
            String second = f.inspector("0xi2");
            String third = f.inspector("0xi3");
            f.inspect(regenerator, first, 20_000, 60);
            f.at(6_100).inspect(regenerator, second, 20_000, 60);
            long challenged = f.at(12_100).inspect(regenerator, third, 20_000, 60).id();

            f.at(12_200);
            assertThat(f.protocol.voteResource(RESEARCHER_1, ResourceType.INSPECTION, challenged, "No trees")
                    .invalidated()).isFalse();
            assertThat(f.protocol.voteResource(RESEARCHER_2, ResourceType.INSPECTION, challenged, "Fake photos")
                    .invalidated()).isTrue();

            assertThat(f.protocol.inspection(challenged).orElseThrow().status())
                    .isEqualTo(InspectionStatus.INVALIDATED);
            RegeneratorStatus status = f.protocol.regenerator(regenerator).orElseThrow();
            assertThat(status.totalInspections()).isEqualTo(2);
            assertThat(status.regenerationScore()).isEqualTo(32);
            assertThat(status.onContractPool()).as("back below the entry count").isFalse();
            assertThat(status.poolLevels()).isZero();
            assertThat(f.protocol.inspector(third).orElseThrow().totalInspections()).isZero();
            assertThat(f.protocol.position(PoolType.INSPECTOR, third).totalLevels()).isZero();
            assertThat(f.protocol.penaltiesOf(third, ResourceType.INSPECTION)).isEqualTo(1);
            assertThat(f.protocol.eraImpact(2).realizedInspections()).isZero();
        }

        @Test
        void regeneratorReentersThePoolAfterLosingItsEnteringInspection() {
            ProtocolFixture f = ProtocolFixture.create(ProtocolFixture.config()
                    .inspection(settings(3, 50_000, 4))
                    .build()).at(100);
            String regenerator = f.regenerator("0xr");
            f.inspect(regenerator, f.inspector("0xi1"), 20_000, 60);
            f.inspect(regenerator, f.inspector("0xi2"), 20_000, 60);
            long entering = f.inspect(regenerator, f.inspector("0xi3"), 20_000, 60).id();
            assertThat(f.protocol.regenerator(regenerator).orElseThrow().poolLevels()).isEqualTo(48);

            f.at(200);
            f.protocol.voteResource(RESEARCHER_1, ResourceType.INSPECTION, entering, "No trees");
            f.protocol.voteResource(RESEARCHER_2, ResourceType.INSPECTION, entering, "Fake photos");

            RegeneratorStatus left = f.protocol.regenerator(regenerator).orElseThrow();
            assertThat(left.totalInspections()).isEqualTo(2);
            assertThat(left.onContractPool()).isFalse();
            assertThat(left.poolLevels()).isZero();
            assertThat(f.protocol.poolStatus(PoolType.REGENERATOR).totalActiveLevels()).isZero();

            f.inspect(regenerator, f.inspector("0xi4"), 20_000, 60);

            RegeneratorStatus back = f.protocol.regenerator(regenerator).orElseThrow();
            assertThat(back.onContractPool()).isTrue();
            assertThat(back.totalInspections()).isEqualTo(3);
            assertThat(back.poolLevels()).as("earlier scores posted again on re-entry").isEqualTo(48);
        }

        @Test
        void votesBeforeRealizationDoNotCarryIntoTheRealizationEra() {
            ProtocolFixture f = ProtocolFixture.create(ProtocolFixture.config()
                    .inspection(settings(3, 50_000, 4))
                    .build()).at(10_500);
            String regenerator = f.regenerator("0xr");
            String inspector = f.inspector("0xi");
            long id = f.protocol.requestInspection(regenerator).id();
            f.protocol.acceptInspection(inspector, id);
            assertThat(f.protocol.voteResource(RESEARCHER_1, ResourceType.INSPECTION, id, "Never visited")
                    .votes()).isEqualTo(1);

            f.at(12_100);
            f.protocol.realizeInspection(inspector, id, 20_000, 60, "evidence", "report");
            VoteOutcome outcome = f.protocol.voteResource(RESEARCHER_2, ResourceType.INSPECTION, id, "Fake photos");

            assertThat(outcome.votes()).isEqualTo(1);
            assertThat(outcome.invalidated()).isFalse();
            assertThat(f.protocol.inspection(id).orElseThrow().status()).isEqualTo(InspectionStatus.INSPECTED);
        }

        @Test
        void openInspectionsCannotBeChallenged() {
            ProtocolFixture f = ProtocolFixture.create().at(100);
            long id = f.protocol.requestInspection(f.regenerator("0xr")).id();

            assertThatThrownBy(() -> f.protocol.voteResource(RESEARCHER_1, ResourceType.INSPECTION, id, "Nothing"))
                    .extracting("reason").isEqualTo(ReasonCode.RESOURCE_NOT_FOUND);
        }
    }
}
