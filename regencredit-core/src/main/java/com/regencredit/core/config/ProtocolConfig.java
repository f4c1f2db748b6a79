package com.regencredit.core.config;

import com.regencredit.core.community.UserType;
import com.regencredit.core.error.ConfigurationException;
import com.regencredit.core.inspection.ScoringTable;
import com.regencredit.core.pool.PoolType;

import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable protocol configuration. Set once through {@link #builder()} and never
 * changed while the protocol runs.
 */
public final class ProtocolConfig {

    public static final BigInteger TOKEN_UNIT = BigInteger.TEN.pow(18);

    private final long deployBlock;
    private final long blocksPerEra;
    private final int halving;
    private final long eraPrecision;
    private final long bootstrapThreshold;
    private final int maxInviterPenalties;
    private final long invitationValidityBlocks;
    private final Map<UserType, TypePolicy> typePolicies;
    private final Map<PoolType, BigInteger> poolTokens;
    private final InspectionSettings inspection;
    private final GovernanceSettings governance;
    private final ScoringTable scoringTable;

    private ProtocolConfig(Builder builder) {
        this.deployBlock = builder.deployBlock;
        this.blocksPerEra = builder.blocksPerEra;
        this.halving = builder.halving;
        this.eraPrecision = builder.eraPrecision;
        this.bootstrapThreshold = builder.bootstrapThreshold;
        this.maxInviterPenalties = builder.maxInviterPenalties;
        this.invitationValidityBlocks = builder.invitationValidityBlocks;
        this.typePolicies = Collections.unmodifiableMap(new EnumMap<>(builder.typePolicies));
        this.poolTokens = Collections.unmodifiableMap(new EnumMap<>(builder.poolTokens));
        this.inspection = builder.inspection;
        this.governance = builder.governance;
        this.scoringTable = builder.scoringTable;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ProtocolConfig defaults() {
        return builder().build();
    }

    public long deployBlock() { return deployBlock; }
    public long blocksPerEra() { return blocksPerEra; }
    public int halving() { return halving; }
    public long eraPrecision() { return eraPrecision; }
    public long bootstrapThreshold() { return bootstrapThreshold; }
    public int maxInviterPenalties() { return maxInviterPenalties; }
    public long invitationValidityBlocks() { return invitationValidityBlocks; }
    public InspectionSettings inspection() { return inspection; }
    public GovernanceSettings governance() { return governance; }
    public ScoringTable scoringTable() { return scoringTable; }
    public Map<PoolType, BigInteger> poolTokens() { return poolTokens; }

    /**
     * Registration policy of a type. Every registrable type has one.
     */
    public TypePolicy policyFor(UserType type) {
        TypePolicy policy = typePolicies.get(type);
        if (policy == null) {
            throw new ConfigurationException("No policy configured for type " + type);
        }
        return policy;
    }

    public BigInteger totalPoolTokens(PoolType pool) {
        return poolTokens.getOrDefault(pool, BigInteger.ZERO);
    }

    // ==================== Inner Types ====================

    /**
     * How a type's population cap follows the regenerator population.
     */
    public enum Proportionality {
        /** No proportional cap. */
        NONE,
        /** cap = regenerators * ratio */
        DIRECT,
        /** cap = regenerators / ratio */
        INVERSE
    }

    /**
     * Registration and invitation rules of one user type.
     *
     * @param inviterType type allowed to invite this type, null when nobody invites it
     * @param invitationRequired whether registration consumes an invitation
     * @param invitationDelayBlocks blocks an inviter waits between two invitations of this type
     * @param proportionality cap convention relative to the regenerator population
     * @param ratio proportionality ratio
     * @param minimumSlots floor of the proportional cap
     * @param maxUsers absolute cap, 0 for none
     * @param publicationDelayBlocks blocks between two resources published by one member
     */
    public record TypePolicy(
            UserType type,
            UserType inviterType,
            boolean invitationRequired,
            long invitationDelayBlocks,
            Proportionality proportionality,
            long ratio,
            long minimumSlots,
            long maxUsers,
            long publicationDelayBlocks
    ) {
        public TypePolicy {
            Objects.requireNonNull(type, "Type cannot be null");
            Objects.requireNonNull(proportionality, "Proportionality cannot be null");
            if (!type.isRegistrable()) {
                throw new ConfigurationException("Type " + type + " cannot carry a registration policy");
            }
            if (proportionality != Proportionality.NONE && ratio <= 0) {
                throw new ConfigurationException("Proportional type " + type + " needs a positive ratio");
            }
            if (invitationRequired && inviterType == null) {
                throw new ConfigurationException("Type " + type + " requires invitations but has no inviter type");
            }
            if (invitationDelayBlocks < 0 || minimumSlots < 0 || maxUsers < 0 || publicationDelayBlocks < 0) {
                throw new ConfigurationException("Negative limits in policy of " + type);
            }
        }

        public static TypePolicy open(UserType type) {
            return new TypePolicy(type, null, false, 0, Proportionality.NONE, 0, 0, 0, 0);
        }

        public static TypePolicy invitedBy(UserType type, UserType inviterType, long invitationDelayBlocks) {
            return new TypePolicy(type, inviterType, true, invitationDelayBlocks,
                    Proportionality.NONE, 0, 0, 0, 0);
        }

        public TypePolicy withProportionality(Proportionality proportionality, long ratio, long minimumSlots) {
            return new TypePolicy(type, inviterType, invitationRequired, invitationDelayBlocks,
                    proportionality, ratio, minimumSlots, maxUsers, publicationDelayBlocks);
        }

        public TypePolicy withMaxUsers(long maxUsers) {
            return new TypePolicy(type, inviterType, invitationRequired, invitationDelayBlocks,
                    proportionality, ratio, minimumSlots, maxUsers, publicationDelayBlocks);
        }

        public TypePolicy withPublicationDelay(long publicationDelayBlocks) {
            return new TypePolicy(type, inviterType, invitationRequired, invitationDelayBlocks,
                    proportionality, ratio, minimumSlots, maxUsers, publicationDelayBlocks);
        }

        public TypePolicy withoutInvitation() {
            return new TypePolicy(type, inviterType, false, invitationDelayBlocks,
                    proportionality, ratio, minimumSlots, maxUsers, publicationDelayBlocks);
        }
    }

    /**
     * Inspection lifecycle limits.
     */
    public record InspectionSettings(
            long minArea,
            long maxArea,
            int maxInspections,
            int minInspectionsForPool,
            long interInspectionDelay,
            long acceptanceDeadline,
            long requestCooldown,
            int maxGiveUps,
            long maxTreesResult,
            long maxBiodiversityResult
    ) {
        public InspectionSettings {
            if (minArea <= 0 || maxArea < minArea) {
                throw new ConfigurationException("Invalid regenerator area bounds: " + minArea + ".." + maxArea);
            }
            if (minInspectionsForPool <= 0 || maxInspections < minInspectionsForPool) {
                throw new ConfigurationException("Inspection counts must satisfy 0 < poolEntry <= max");
            }
            if (acceptanceDeadline <= 0 || maxGiveUps <= 0) {
                throw new ConfigurationException("Inspection deadline and max give-ups must be positive");
            }
            if (interInspectionDelay < 0 || requestCooldown < 0 || maxTreesResult <= 0 || maxBiodiversityResult <= 0) {
                throw new ConfigurationException("Invalid inspection limits");
            }
        }

        public static InspectionSettings defaults() {
            return new InspectionSettings(2_500, 1_000_000, 6, 3, 6_000, 50_000, 6_000, 4,
                    1_000_000, 10_000);
        }
    }

    /**
     * Validation and voting parameters.
     *
     * @param quorumPercent share of the live voter population needed to invalidate, on top of one vote
     */
    public record GovernanceSettings(
            long safeguardWindowBlocks,
            long voterMinInterval,
            int pointsPerLevel,
            int maxResourcePenalties,
            int minVotesToInvalidate,
            int quorumPercent
    ) {
        public GovernanceSettings {
            if (safeguardWindowBlocks < 0 || voterMinInterval < 0) {
                throw new ConfigurationException("Governance windows cannot be negative");
            }
            if (pointsPerLevel <= 0 || maxResourcePenalties <= 0 || minVotesToInvalidate <= 0) {
                throw new ConfigurationException("Governance thresholds must be positive");
            }
            if (quorumPercent < 0 || quorumPercent > 100) {
                throw new ConfigurationException("Quorum percent must be within 0..100");
            }
        }

        public static GovernanceSettings defaults() {
            return new GovernanceSettings(1_000, 100, 50, 3, 2, 20);
        }
    }

    // ==================== Builder ====================

    public static class Builder {
        private long deployBlock = 0;
        private long blocksPerEra = 12_000;
        private int halving = 12;
        private long eraPrecision = 100_000;
        private long bootstrapThreshold = 5;
        private int maxInviterPenalties = 5;
        private long invitationValidityBlocks = 0;
        private final Map<UserType, TypePolicy> typePolicies = new EnumMap<>(UserType.class);
        private final Map<PoolType, BigInteger> poolTokens = new EnumMap<>(PoolType.class);
        private InspectionSettings inspection = InspectionSettings.defaults();
        private GovernanceSettings governance = GovernanceSettings.defaults();
        private ScoringTable scoringTable = ScoringTable.defaults();

        private Builder() {
            typePolicies.put(UserType.REGENERATOR,
                    TypePolicy.invitedBy(UserType.REGENERATOR, UserType.ACTIVIST, 1_000));
            typePolicies.put(UserType.INSPECTOR,
                    TypePolicy.invitedBy(UserType.INSPECTOR, UserType.ACTIVIST, 1_000)
                            .withProportionality(Proportionality.DIRECT, 20, 10));
            typePolicies.put(UserType.RESEARCHER,
                    TypePolicy.invitedBy(UserType.RESEARCHER, UserType.RESEARCHER, 6_000)
                            .withProportionality(Proportionality.INVERSE, 10, 10)
                            .withPublicationDelay(1_000));
            typePolicies.put(UserType.DEVELOPER,
                    TypePolicy.invitedBy(UserType.DEVELOPER, UserType.DEVELOPER, 6_000)
                            .withProportionality(Proportionality.INVERSE, 10, 10)
                            .withPublicationDelay(1_000));
            typePolicies.put(UserType.CONTRIBUTOR,
                    TypePolicy.invitedBy(UserType.CONTRIBUTOR, UserType.CONTRIBUTOR, 6_000)
                            .withProportionality(Proportionality.INVERSE, 10, 10)
                            .withPublicationDelay(1_000));
            typePolicies.put(UserType.ACTIVIST,
                    TypePolicy.invitedBy(UserType.ACTIVIST, UserType.ACTIVIST, 6_000)
                            .withProportionality(Proportionality.INVERSE, 10, 10));
            typePolicies.put(UserType.SUPPORTER, TypePolicy.open(UserType.SUPPORTER));

            poolTokens.put(PoolType.REGENERATOR, TOKEN_UNIT.multiply(BigInteger.valueOf(750_000_000)));
            poolTokens.put(PoolType.INSPECTOR, TOKEN_UNIT.multiply(BigInteger.valueOf(180_000_000)));
            poolTokens.put(PoolType.RESEARCHER, TOKEN_UNIT.multiply(BigInteger.valueOf(30_000_000)));
            poolTokens.put(PoolType.DEVELOPER, TOKEN_UNIT.multiply(BigInteger.valueOf(30_000_000)));
            poolTokens.put(PoolType.CONTRIBUTOR, TOKEN_UNIT.multiply(BigInteger.valueOf(15_000_000)));
            poolTokens.put(PoolType.ACTIVIST, TOKEN_UNIT.multiply(BigInteger.valueOf(15_000_000)));
            poolTokens.put(PoolType.VALIDATOR, TOKEN_UNIT.multiply(BigInteger.valueOf(15_000_000)));
        }

        public Builder deployBlock(long deployBlock) {
            this.deployBlock = deployBlock;
            return this;
        }

        public Builder blocksPerEra(long blocksPerEra) {
            this.blocksPerEra = blocksPerEra;
            return this;
        }

        public Builder halving(int halving) {
            this.halving = halving;
            return this;
        }

        public Builder eraPrecision(long eraPrecision) {
            this.eraPrecision = eraPrecision;
            return this;
        }

        public Builder bootstrapThreshold(long bootstrapThreshold) {
            this.bootstrapThreshold = bootstrapThreshold;
            return this;
        }

        public Builder maxInviterPenalties(int maxInviterPenalties) {
            this.maxInviterPenalties = maxInviterPenalties;
            return this;
        }

        public Builder invitationValidityBlocks(long invitationValidityBlocks) {
            this.invitationValidityBlocks = invitationValidityBlocks;
            return this;
        }

        public Builder typePolicy(TypePolicy policy) {
            Objects.requireNonNull(policy, "Policy cannot be null");
            this.typePolicies.put(policy.type(), policy);
            return this;
        }

        public Builder poolTokens(PoolType pool, BigInteger tokens) {
            Objects.requireNonNull(pool, "Pool cannot be null");
            Objects.requireNonNull(tokens, "Tokens cannot be null");
            this.poolTokens.put(pool, tokens);
            return this;
        }

        public Builder inspection(InspectionSettings inspection) {
            this.inspection = Objects.requireNonNull(inspection, "Inspection settings cannot be null");
            return this;
        }

        public Builder governance(GovernanceSettings governance) {
            this.governance = Objects.requireNonNull(governance, "Governance settings cannot be null");
            return this;
        }

        public Builder scoringTable(ScoringTable scoringTable) {
            this.scoringTable = Objects.requireNonNull(scoringTable, "Scoring table cannot be null");
            return this;
        }

        public ProtocolConfig build() {
            if (blocksPerEra <= 0) {
                throw new ConfigurationException("blocksPerEra must be positive, got " + blocksPerEra);
            }
            if (halving <= 0) {
                throw new ConfigurationException("halving must be positive, got " + halving);
            }
            if (eraPrecision <= 0) {
                throw new ConfigurationException("eraPrecision must be positive, got " + eraPrecision);
            }
            if (deployBlock < 0 || bootstrapThreshold < 0 || maxInviterPenalties <= 0 || invitationValidityBlocks < 0) {
                throw new ConfigurationException("Invalid community limits");
            }
            if (governance.safeguardWindowBlocks() >= blocksPerEra) {
                throw new ConfigurationException("Safeguard window must be shorter than an era");
            }
            for (PoolType pool : PoolType.values()) {
                BigInteger tokens = poolTokens.get(pool);
                if (tokens == null || tokens.signum() < 0) {
                    throw new ConfigurationException("Pool " + pool + " needs a non-negative token budget");
                }
            }
            for (UserType type : UserType.values()) {
                if (type.isRegistrable() && !typePolicies.containsKey(type)) {
                    throw new ConfigurationException("Missing registration policy for " + type);
                }
            }
            return new ProtocolConfig(this);
        }
    }
}
