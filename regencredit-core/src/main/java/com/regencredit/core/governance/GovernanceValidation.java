package com.regencredit.core.governance;

import com.regencredit.core.community.Account;
import com.regencredit.core.community.CommunityRegistry;
import com.regencredit.core.config.ProtocolConfig;
import com.regencredit.core.config.ProtocolConfig.GovernanceSettings;
import com.regencredit.core.config.TextLimits;
import com.regencredit.core.error.ConfigurationException;
import com.regencredit.core.error.PreconditionViolationException;
import com.regencredit.core.error.ReasonCode;
import com.regencredit.core.error.TemporalGateException;
import com.regencredit.core.event.EventBus;
import com.regencredit.core.event.ProtocolEvents.ResourceInvalidated;
import com.regencredit.core.event.ProtocolEvents.VoteCast;
import com.regencredit.core.inspection.Inspection;
import com.regencredit.core.inspection.InspectionLifecycle;
import com.regencredit.core.inspection.InspectionStatus;
import com.regencredit.core.pool.ParticipantRules;
import com.regencredit.core.pool.PoolType;
import com.regencredit.core.time.EraClock;
import com.regencredit.core.time.SafeguardWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Era-bounded peer review of resources and members.
 *
 * <p>Resources can only be challenged during the era they were created in; once that era
 * closes they are final. User challenges are tallied per era and start over every era.
 * Every vote earns the voter a validation point, convertible into validator levels.
 */
public class GovernanceValidation {

    private static final Logger log = LoggerFactory.getLogger(GovernanceValidation.class);

    private final ProtocolConfig config;
    private final GovernanceSettings settings;
    private final EraClock clock;
    private final SafeguardWindow safeguard;
    private final CommunityRegistry registry;
    private final Map<PoolType, ParticipantRules> creatorRules;
    private final ParticipantRules validatorRules;
    private final InspectionLifecycle inspections;
    private final EventBus eventBus;

    private final Map<Long, Resource> resources = new LinkedHashMap<>();
    private final Map<Integer, Map<Long, Set<String>>> inspectionVotersByEra = new HashMap<>();
    private final Map<String, Long> lastPublishedAt = new HashMap<>();
    private final Map<String, Long> lastVoteAt = new HashMap<>();
    private final Map<String, Map<ResourceType, Integer>> penalties = new HashMap<>();
    private final Map<String, Long> points = new HashMap<>();
    private final Map<String, Long> convertedLevels = new HashMap<>();
    private final Map<Integer, Map<String, ChallengeTally>> challengesByEra = new HashMap<>();
    private final Map<Long, Delation> delations = new LinkedHashMap<>();
    private long nextResourceId = 1;
    private long nextDelationId = 1;

    public GovernanceValidation(ProtocolConfig config, EraClock clock, SafeguardWindow safeguard,
                                CommunityRegistry registry, Map<PoolType, ParticipantRules> creatorRules,
                                ParticipantRules validatorRules, InspectionLifecycle inspections, EventBus eventBus) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.settings = config.governance();
        this.clock = Objects.requireNonNull(clock, "Era clock cannot be null");
        this.safeguard = Objects.requireNonNull(safeguard, "Safeguard window cannot be null");
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.creatorRules = new EnumMap<>(Objects.requireNonNull(creatorRules, "Creator rules cannot be null"));
        for (ResourceType type : ResourceType.values()) {
            if (type.isPublishable()) {
                rulesFor(type);
            }
        }
        this.validatorRules = Objects.requireNonNull(validatorRules, "Validator rules cannot be null");
        this.inspections = Objects.requireNonNull(inspections, "Inspection lifecycle cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
    }

    // ==================== Publishing ====================

    /**
     * Publishes a report, research item or contribution and grants its creator one level.
     *
     * @throws TemporalGateException inside the safeguard window or the creator's publication delay
     */
    public ResourceSnapshot publishResource(String creator, ResourceType type, String title, String description,
                                            String documentHash, long blockNumber) {
        Objects.requireNonNull(type, "Type cannot be null");
        Account account = registry.requireActive(creator);
        if (!type.isPublishable() || account.type() != type.creatorType()) {
            throw new PreconditionViolationException(ReasonCode.NOT_ALLOWED_TO_PUBLISH,
                    account.type() + " cannot publish a " + type);
        }
        TextLimits.require("title", title, TextLimits.TITLE);
        TextLimits.bounded("description", description, TextLimits.DESCRIPTION);
        TextLimits.require("documentHash", documentHash, TextLimits.HASH);
        safeguard.requireOpen(blockNumber, "Publishing");

        long delay = config.policyFor(type.creatorType()).publicationDelayBlocks();
        Long last = lastPublishedAt.get(creator);
        if (last != null && blockNumber < last + delay) {
            throw new TemporalGateException(ReasonCode.PUBLICATION_COOLDOWN,
                    creator + " published recently", last + delay);
        }

        int era = clock.currentEra(blockNumber);
        Resource resource = new Resource(nextResourceId++, type, creator, title, description, documentHash,
                blockNumber, era);
        resources.put(resource.id(), resource);
        lastPublishedAt.put(creator, blockNumber);
        rulesFor(type).grantLevelAt(levelEventId(resource), creator, 1, era, blockNumber);

        log.info("{} published {} #{}", creator, type, resource.id());
        return resource.snapshot();
    }

    // ==================== Voting ====================

    /**
     * Whether the address may vote: an active member of a voter type holding
     * above-average levels in its pool.
     */
    public boolean canVote(String voter) {
        Optional<Account> account = registry.getAccount(voter);
        return account.isPresent() && !account.get().isDenied() && account.get().type().isVoter()
                && registry.isAboveAverage(voter);
    }

    /**
     * Votes needed to invalidate, scaled by the live voter population.
     */
    public long votesToInvalidate() {
        long scaled = registry.voterCount() * settings.quorumPercent() / 100 + 1;
        return Math.max(settings.minVotesToInvalidate(), scaled);
    }

    public VoteOutcome voteResource(String voter, ResourceType type, long resourceId, String justification,
                                    long blockNumber) {
        Objects.requireNonNull(type, "Type cannot be null");
        requireVoter(voter, blockNumber);
        TextLimits.require("justification", justification, TextLimits.DESCRIPTION);
        int currentEra = clock.currentEra(blockNumber);

        if (type == ResourceType.INSPECTION) {
            return voteInspection(voter, resourceId, currentEra, blockNumber);
        }
        Resource resource = resources.get(resourceId);
        if (resource == null || resource.type() != type) {
            throw new PreconditionViolationException(ReasonCode.RESOURCE_NOT_FOUND,
                    type + " #" + resourceId + " does not exist");
        }
        requireReviewable(resource.isValid(), resource.era(), currentEra, type, resourceId);
        requireNewVoter(voter, resource.creator(), resource.voters(), type, resourceId);

        resource.voters().add(voter);
        recordVote(voter, type + ":" + resourceId, currentEra, blockNumber);
        long threshold = votesToInvalidate();
        boolean invalidated = resource.voters().size() >= threshold;
        if (invalidated) {
            invalidateResource(resource, blockNumber);
        }
        return new VoteOutcome(voter, resource.creator(), resource.voters().size(), threshold, invalidated);
    }

    private VoteOutcome voteInspection(String voter, long inspectionId, int currentEra, long blockNumber) {
        Inspection inspection = inspections.find(inspectionId)
                .orElseThrow(() -> new PreconditionViolationException(ReasonCode.RESOURCE_NOT_FOUND,
                        "Inspection #" + inspectionId + " does not exist"));
        if (inspection.status() == InspectionStatus.OPEN) {
            throw new PreconditionViolationException(ReasonCode.RESOURCE_NOT_FOUND,
                    "Inspection #" + inspectionId + " has not been accepted");
        }
        requireReviewable(inspection.status() != InspectionStatus.INVALIDATED, inspection.reviewEra(), currentEra,
                ResourceType.INSPECTION, inspectionId);
        // A realized inspection is reviewed again in its realization era, with a fresh tally.
        Set<String> voters = inspectionVotersByEra.computeIfAbsent(inspection.reviewEra(), k -> new HashMap<>())
                .computeIfAbsent(inspectionId, k -> new LinkedHashSet<>());
        requireNewVoter(voter, inspection.inspector(), voters, ResourceType.INSPECTION, inspectionId);

        voters.add(voter);
        recordVote(voter, "INSPECTION:" + inspectionId, currentEra, blockNumber);
        long threshold = votesToInvalidate();
        boolean invalidated = voters.size() >= threshold;
        String inspector = inspection.inspector();
        if (invalidated) {
            inspections.invalidateInspection(inspectionId, blockNumber);
            penalize(inspector, ResourceType.INSPECTION, inspection.reviewEra(), inspectionId, blockNumber);
        }
        return new VoteOutcome(voter, inspector, voters.size(), threshold, invalidated);
    }

    /**
     * Votes to deny a member. The first voter against a member in an era is that era's
     * hunter and earns a validator level if the challenge succeeds.
     */
    public VoteOutcome voteUser(String voter, String target, String justification, long blockNumber) {
        requireVoter(voter, blockNumber);
        TextLimits.require("justification", justification, TextLimits.DESCRIPTION);
        registry.requireActive(target);
        if (voter.equals(target)) {
            throw new PreconditionViolationException(ReasonCode.SELF_VOTE, voter + " cannot vote against itself");
        }
        int era = clock.currentEra(blockNumber);
        Map<String, ChallengeTally> eraChallenges = challengesByEra.getOrDefault(era, Map.of());
        ChallengeTally existing = eraChallenges.get(target);
        if (existing != null && existing.voters.contains(voter)) {
            throw new PreconditionViolationException(ReasonCode.ALREADY_VOTED,
                    voter + " already voted against " + target + " in era " + era);
        }

        ChallengeTally tally = challengesByEra.computeIfAbsent(era, k -> new HashMap<>())
                .computeIfAbsent(target, k -> new ChallengeTally(voter));
        tally.voters.add(voter);
        recordVote(voter, target, era, blockNumber);
        long threshold = votesToInvalidate();
        boolean denied = tally.voters.size() >= threshold;
        if (denied) {
            tally.succeeded = true;
            registry.setToDenied(target, blockNumber);
            if (!registry.isDenied(tally.hunter)) {
                validatorRules.grantLevelAt("hunter:" + era + ":" + target, tally.hunter, 1, era, blockNumber);
            }
            log.info("{} denied by vote in era {}, hunter {}", target, era, tally.hunter);
        }
        return new VoteOutcome(voter, target, tally.voters.size(), threshold, denied);
    }

    // ==================== Participation points ====================

    /**
     * Converts {@code pointsPerLevel} validation points into one validator level.
     */
    public long convertPoints(String voter, long blockNumber) {
        registry.requireActive(voter);
        long held = pointsOf(voter);
        if (held < settings.pointsPerLevel()) {
            throw new PreconditionViolationException(ReasonCode.INSUFFICIENT_POINTS,
                    voter + " holds " + held + " of " + settings.pointsPerLevel() + " points");
        }
        long conversion = convertedLevels.merge(voter, 1L, Long::sum);
        points.put(voter, held - settings.pointsPerLevel());
        validatorRules.grantLevel("points:" + voter + ":" + conversion, voter, 1, blockNumber);
        log.info("{} converted {} points into a validator level", voter, settings.pointsPerLevel());
        return held - settings.pointsPerLevel();
    }

    public long pointsOf(String voter) {
        return points.getOrDefault(voter, 0L);
    }

    // ==================== Delations ====================

    public DelationSnapshot delate(String informer, String reported, String title, String testimony,
                                   long blockNumber) {
        registry.requireActive(informer);
        registry.requireRegistered(reported);
        if (informer.equals(reported)) {
            throw new PreconditionViolationException(ReasonCode.SELF_VOTE, informer + " cannot report itself");
        }
        TextLimits.require("title", title, TextLimits.TITLE);
        TextLimits.require("testimony", testimony, TextLimits.DESCRIPTION);

        Delation delation = new Delation(nextDelationId++, informer, reported, title, testimony, blockNumber);
        delations.put(delation.id(), delation);
        log.info("{} reported {} (delation #{})", informer, reported, delation.id());
        return delation.snapshot();
    }

    public DelationSnapshot thumbsUp(String voter, long delationId) {
        return react(voter, delationId, true);
    }

    public DelationSnapshot thumbsDown(String voter, long delationId) {
        return react(voter, delationId, false);
    }

    private DelationSnapshot react(String voter, long delationId, boolean up) {
        Delation delation = delations.get(delationId);
        if (delation == null) {
            throw new PreconditionViolationException(ReasonCode.DELATION_NOT_FOUND,
                    "Delation #" + delationId + " does not exist");
        }
        if (!canVote(voter)) {
            throw new PreconditionViolationException(ReasonCode.NOT_ALLOWED_TO_VOTE, voter + " cannot vote");
        }
        if (voter.equals(delation.informer()) || voter.equals(delation.reported())) {
            throw new PreconditionViolationException(ReasonCode.SELF_VOTE,
                    voter + " is a party of delation #" + delationId);
        }
        if (delation.hasReacted(voter)) {
            throw new PreconditionViolationException(ReasonCode.ALREADY_VOTED,
                    voter + " already reacted to delation #" + delationId);
        }
        delation.react(voter, up);
        return delation.snapshot();
    }

    // ==================== Queries ====================

    public Optional<ResourceSnapshot> resource(long resourceId) {
        return Optional.ofNullable(resources.get(resourceId)).map(Resource::snapshot);
    }

    public List<ResourceSnapshot> resources(ResourceType type) {
        return resources.values().stream()
                .filter(resource -> type == null || resource.type() == type)
                .map(Resource::snapshot)
                .toList();
    }

    public Optional<DelationSnapshot> delation(long delationId) {
        return Optional.ofNullable(delations.get(delationId)).map(Delation::snapshot);
    }

    public List<DelationSnapshot> delationsAgainst(String reported) {
        return delations.values().stream()
                .filter(delation -> delation.reported().equals(reported))
                .map(Delation::snapshot)
                .toList();
    }

    public Optional<UserChallenge> challenge(String target, int era) {
        ChallengeTally tally = challengesByEra.getOrDefault(era, Map.of()).get(target);
        return Optional.ofNullable(tally)
                .map(t -> new UserChallenge(target, era, t.hunter, Set.copyOf(t.voters), t.succeeded));
    }

    public int penaltiesOf(String creator, ResourceType type) {
        return penalties.getOrDefault(creator, Map.of()).getOrDefault(type, 0);
    }

    public long lastVoteAt(String voter) {
        return lastVoteAt.getOrDefault(voter, 0L);
    }

    // ==================== Internals ====================

    private void requireVoter(String voter, long blockNumber) {
        if (!canVote(voter)) {
            throw new PreconditionViolationException(ReasonCode.NOT_ALLOWED_TO_VOTE,
                    voter + " is not allowed to vote");
        }
        Long last = lastVoteAt.get(voter);
        if (last != null && blockNumber < last + settings.voterMinInterval()) {
            throw new TemporalGateException(ReasonCode.VOTE_COOLDOWN,
                    voter + " voted recently", last + settings.voterMinInterval());
        }
    }

    private static void requireReviewable(boolean valid, int creationEra, int currentEra, ResourceType type,
                                          long id) {
        if (!valid) {
            throw new PreconditionViolationException(ReasonCode.RESOURCE_ALREADY_INVALID,
                    type + " #" + id + " is already invalid");
        }
        if (creationEra != currentEra) {
            throw new PreconditionViolationException(ReasonCode.RESOURCE_FINALIZED,
                    type + " #" + id + " was finalized with era " + creationEra);
        }
    }

    private static void requireNewVoter(String voter, String creator, Set<String> voters, ResourceType type,
                                        long id) {
        if (voter.equals(creator)) {
            throw new PreconditionViolationException(ReasonCode.SELF_VOTE,
                    voter + " cannot vote on its own " + type);
        }
        if (voters.contains(voter)) {
            throw new PreconditionViolationException(ReasonCode.ALREADY_VOTED,
                    voter + " already voted on " + type + " #" + id);
        }
    }

    private void recordVote(String voter, String target, int era, long blockNumber) {
        lastVoteAt.put(voter, blockNumber);
        points.merge(voter, 1L, Long::sum);
        log.debug("{} voted against {} in era {}", voter, target, era);
        eventBus.publish(new VoteCast(voter, target, era, blockNumber));
    }

    private void invalidateResource(Resource resource, long blockNumber) {
        resource.invalidate(blockNumber);
        if (!registry.isDenied(resource.creator())) {
            rulesFor(resource.type()).removeLevel(resource.creator(), resource.era(), 1, blockNumber);
        }
        log.info("{} #{} of {} invalidated", resource.type(), resource.id(), resource.creator());
        penalize(resource.creator(), resource.type(), resource.era(), resource.id(), blockNumber);
    }

    private void penalize(String creator, ResourceType type, int era, long resourceId, long blockNumber) {
        int count = penalties.computeIfAbsent(creator, k -> new EnumMap<>(ResourceType.class))
                .merge(type, 1, Integer::sum);
        eventBus.publish(new ResourceInvalidated(type, resourceId, creator, era, blockNumber));
        if (count >= settings.maxResourcePenalties() && !registry.isDenied(creator)) {
            log.info("{} reached {} {} penalties and is denied", creator, count, type);
            registry.setToDenied(creator, blockNumber);
        }
    }

    private ParticipantRules rulesFor(ResourceType type) {
        PoolType pool = type.creatorType().pool()
                .orElseThrow(() -> new ConfigurationException("No pool for " + type.creatorType()));
        ParticipantRules rules = creatorRules.get(pool);
        if (rules == null) {
            throw new ConfigurationException("No rules wired for the " + pool + " pool");
        }
        return rules;
    }

    private static String levelEventId(Resource resource) {
        return "resource:" + resource.type() + ":" + resource.id();
    }

    private static final class ChallengeTally {
        private final String hunter;
        private final Set<String> voters = new LinkedHashSet<>();
        private boolean succeeded;

        private ChallengeTally(String hunter) {
            this.hunter = hunter;
        }
    }
}
