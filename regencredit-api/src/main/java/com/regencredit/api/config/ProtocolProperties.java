package com.regencredit.api.config;

import com.regencredit.core.community.UserType;
import com.regencredit.core.config.ProtocolConfig;
import com.regencredit.core.config.ProtocolConfig.GovernanceSettings;
import com.regencredit.core.config.ProtocolConfig.InspectionSettings;
import com.regencredit.core.config.ProtocolConfig.TypePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Protocol parameters bound from {@code regencredit.protocol.*}. Defaults match
 * {@link ProtocolConfig#defaults()}.
 */
@Configuration
@ConfigurationProperties(prefix = "regencredit.protocol")
public class ProtocolProperties {

    private long deployBlock = 0;
    private long blocksPerEra = 12_000;
    private int halving = 12;
    private long eraPrecision = 100_000;
    private long bootstrapThreshold = 5;
    private int maxInviterPenalties = 5;
    private long invitationValidityBlocks = 0;
    // initial height of the local clock when no chain is connected
    private long startBlock = 0;
    // overrides the default blocks an inviter waits between two invitations of a type
    private Map<UserType, Long> invitationDelays = new EnumMap<>(UserType.class);
    private Inspection inspection = new Inspection();
    private Governance governance = new Governance();
    private List<FoundingMember> foundingMembers = new ArrayList<>();

    /**
     * Immutable protocol configuration; validation happens in the core builder.
     */
    public ProtocolConfig toConfig() {
        ProtocolConfig.Builder builder = ProtocolConfig.builder();
        ProtocolConfig defaults = ProtocolConfig.defaults();
        invitationDelays.forEach((type, delay) -> {
            TypePolicy policy = defaults.policyFor(type);
            builder.typePolicy(new TypePolicy(policy.type(), policy.inviterType(), policy.invitationRequired(),
                    delay, policy.proportionality(), policy.ratio(), policy.minimumSlots(), policy.maxUsers(),
                    policy.publicationDelayBlocks()));
        });
        return builder
                .deployBlock(deployBlock)
                .blocksPerEra(blocksPerEra)
                .halving(halving)
                .eraPrecision(eraPrecision)
                .bootstrapThreshold(bootstrapThreshold)
                .maxInviterPenalties(maxInviterPenalties)
                .invitationValidityBlocks(invitationValidityBlocks)
                .inspection(inspection.toSettings())
                .governance(governance.toSettings())
                .build();
    }

    public long getDeployBlock() { return deployBlock; }
    public void setDeployBlock(long deployBlock) { this.deployBlock = deployBlock; }
    public long getBlocksPerEra() { return blocksPerEra; }
    public void setBlocksPerEra(long blocksPerEra) { this.blocksPerEra = blocksPerEra; }
    public int getHalving() { return halving; }
    public void setHalving(int halving) { this.halving = halving; }
    public long getEraPrecision() { return eraPrecision; }
    public void setEraPrecision(long eraPrecision) { this.eraPrecision = eraPrecision; }
    public long getBootstrapThreshold() { return bootstrapThreshold; }
    public void setBootstrapThreshold(long bootstrapThreshold) { this.bootstrapThreshold = bootstrapThreshold; }
    public int getMaxInviterPenalties() { return maxInviterPenalties; }
    public void setMaxInviterPenalties(int maxInviterPenalties) { this.maxInviterPenalties = maxInviterPenalties; }
    public long getInvitationValidityBlocks() { return invitationValidityBlocks; }
    public void setInvitationValidityBlocks(long blocks) { this.invitationValidityBlocks = blocks; }
    public long getStartBlock() { return startBlock; }
    public void setStartBlock(long startBlock) { this.startBlock = startBlock; }
    public Map<UserType, Long> getInvitationDelays() { return invitationDelays; }
    public void setInvitationDelays(Map<UserType, Long> invitationDelays) { this.invitationDelays = invitationDelays; }
    public Inspection getInspection() { return inspection; }
    public void setInspection(Inspection inspection) { this.inspection = inspection; }
    public Governance getGovernance() { return governance; }
    public void setGovernance(Governance governance) { this.governance = governance; }
    public List<FoundingMember> getFoundingMembers() { return foundingMembers; }
    public void setFoundingMembers(List<FoundingMember> foundingMembers) { this.foundingMembers = foundingMembers; }

    public static class Inspection {
        private long minArea = 2_500;
        private long maxArea = 1_000_000;
        private int maxInspections = 6;
        private int minInspectionsForPool = 3;
        private long interInspectionDelay = 6_000;
        private long acceptanceDeadline = 50_000;
        private long requestCooldown = 6_000;
        private int maxGiveUps = 4;
        private long maxTreesResult = 1_000_000;
        private long maxBiodiversityResult = 10_000;

        InspectionSettings toSettings() {
            return new InspectionSettings(minArea, maxArea, maxInspections, minInspectionsForPool,
                    interInspectionDelay, acceptanceDeadline, requestCooldown, maxGiveUps,
                    maxTreesResult, maxBiodiversityResult);
        }

        public long getMinArea() { return minArea; }
        public void setMinArea(long minArea) { this.minArea = minArea; }
        public long getMaxArea() { return maxArea; }
        public void setMaxArea(long maxArea) { this.maxArea = maxArea; }
        public int getMaxInspections() { return maxInspections; }
        public void setMaxInspections(int maxInspections) { this.maxInspections = maxInspections; }
        public int getMinInspectionsForPool() { return minInspectionsForPool; }
        public void setMinInspectionsForPool(int count) { this.minInspectionsForPool = count; }
        public long getInterInspectionDelay() { return interInspectionDelay; }
        public void setInterInspectionDelay(long delay) { this.interInspectionDelay = delay; }
        public long getAcceptanceDeadline() { return acceptanceDeadline; }
        public void setAcceptanceDeadline(long deadline) { this.acceptanceDeadline = deadline; }
        public long getRequestCooldown() { return requestCooldown; }
        public void setRequestCooldown(long requestCooldown) { this.requestCooldown = requestCooldown; }
        public int getMaxGiveUps() { return maxGiveUps; }
        public void setMaxGiveUps(int maxGiveUps) { this.maxGiveUps = maxGiveUps; }
        public long getMaxTreesResult() { return maxTreesResult; }
        public void setMaxTreesResult(long maxTreesResult) { this.maxTreesResult = maxTreesResult; }
        public long getMaxBiodiversityResult() { return maxBiodiversityResult; }
        public void setMaxBiodiversityResult(long max) { this.maxBiodiversityResult = max; }
    }

    public static class Governance {
        private long safeguardWindowBlocks = 1_000;
        private long voterMinInterval = 100;
        private int pointsPerLevel = 50;
        private int maxResourcePenalties = 3;
        private int minVotesToInvalidate = 2;
        private int quorumPercent = 20;

        GovernanceSettings toSettings() {
            return new GovernanceSettings(safeguardWindowBlocks, voterMinInterval, pointsPerLevel,
                    maxResourcePenalties, minVotesToInvalidate, quorumPercent);
        }

        public long getSafeguardWindowBlocks() { return safeguardWindowBlocks; }
        public void setSafeguardWindowBlocks(long blocks) { this.safeguardWindowBlocks = blocks; }
        public long getVoterMinInterval() { return voterMinInterval; }
        public void setVoterMinInterval(long voterMinInterval) { this.voterMinInterval = voterMinInterval; }
        public int getPointsPerLevel() { return pointsPerLevel; }
        public void setPointsPerLevel(int pointsPerLevel) { this.pointsPerLevel = pointsPerLevel; }
        public int getMaxResourcePenalties() { return maxResourcePenalties; }
        public void setMaxResourcePenalties(int max) { this.maxResourcePenalties = max; }
        public int getMinVotesToInvalidate() { return minVotesToInvalidate; }
        public void setMinVotesToInvalidate(int min) { this.minVotesToInvalidate = min; }
        public int getQuorumPercent() { return quorumPercent; }
        public void setQuorumPercent(int quorumPercent) { this.quorumPercent = quorumPercent; }
    }

    public static class FoundingMember {
        private String address;
        private UserType type;
        private String name;

        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }
        public UserType getType() { return type; }
        public void setType(UserType type) { this.type = type; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }
}
