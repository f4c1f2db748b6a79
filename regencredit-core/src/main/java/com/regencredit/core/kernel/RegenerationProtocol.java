package com.regencredit.core.kernel;

import com.regencredit.core.community.Account;
import com.regencredit.core.community.AccountSnapshot;
import com.regencredit.core.community.CommunityRegistry;
import com.regencredit.core.community.Invitation;
import com.regencredit.core.community.InvitationGuard;
import com.regencredit.core.community.UserType;
import com.regencredit.core.config.ProtocolConfig;
import com.regencredit.core.error.ConfigurationException;
import com.regencredit.core.error.PreconditionViolationException;
import com.regencredit.core.error.ReasonCode;
import com.regencredit.core.event.EventBus;
import com.regencredit.core.event.ProtocolEvent;
import com.regencredit.core.governance.DelationSnapshot;
import com.regencredit.core.governance.GovernanceValidation;
import com.regencredit.core.governance.ResourceSnapshot;
import com.regencredit.core.governance.ResourceType;
import com.regencredit.core.governance.UserChallenge;
import com.regencredit.core.governance.VoteOutcome;
import com.regencredit.core.inspection.ActivistRules;
import com.regencredit.core.inspection.EraImpact;
import com.regencredit.core.inspection.InspectionLifecycle;
import com.regencredit.core.inspection.InspectionSnapshot;
import com.regencredit.core.inspection.InspectionStatus;
import com.regencredit.core.inspection.InspectorRules;
import com.regencredit.core.inspection.InspectorStatus;
import com.regencredit.core.inspection.RegeneratorRules;
import com.regencredit.core.inspection.RegeneratorStatus;
import com.regencredit.core.ledger.TokenLedger;
import com.regencredit.core.pool.EraAggregate;
import com.regencredit.core.pool.ParticipantRules;
import com.regencredit.core.pool.PoolPosition;
import com.regencredit.core.pool.PoolStatus;
import com.regencredit.core.pool.PoolType;
import com.regencredit.core.pool.RewardPool;
import com.regencredit.core.pool.WithdrawalResult;
import com.regencredit.core.supporter.SupporterRules;
import com.regencredit.core.time.BlockHeightSource;
import com.regencredit.core.time.EraClock;
import com.regencredit.core.time.SafeguardWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Entry point of the regeneration credit protocol.
 *
 * <p>Wires the components once, through {@link #builder()}, and serializes every call
 * behind a single fair lock. Each call reads the block height once and either applies
 * completely or throws before mutating anything. Domain events are dispatched
 * synchronously inside the caller's critical section.
 */
public final class RegenerationProtocol {

    private static final Logger log = LoggerFactory.getLogger(RegenerationProtocol.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final ProtocolConfig config;
    private final BlockHeightSource blocks;
    private final TokenLedger ledger;
    private final EventBus eventBus;
    private final EraClock clock;
    private final SafeguardWindow safeguard;
    private final Map<PoolType, ParticipantRules> rules;
    private final CommunityRegistry registry;
    private final RegeneratorRules regenerators;
    private final InspectorRules inspectors;
    private final InspectionLifecycle inspections;
    private final GovernanceValidation governance;
    private final SupporterRules supporters;
    private volatile boolean running = true;

    private RegenerationProtocol(Builder builder) {
        this.config = builder.config;
        this.blocks = builder.blocks;
        this.ledger = builder.ledger;
        this.eventBus = builder.eventBus != null ? builder.eventBus : new EventBus();
        this.clock = new EraClock(config.deployBlock(), config.blocksPerEra(), config.halving(),
                config.eraPrecision());
        this.safeguard = new SafeguardWindow(clock, config.governance().safeguardWindowBlocks());

        Map<PoolType, RewardPool> pools = new EnumMap<>(PoolType.class);
        Map<PoolType, ParticipantRules> participantRules = new EnumMap<>(PoolType.class);
        for (PoolType type : PoolType.values()) {
            RewardPool pool = new RewardPool(type, config.totalPoolTokens(type), clock, ledger);
            pools.put(type, pool);
            participantRules.put(type, new ParticipantRules(pool, clock, eventBus));
        }
        this.rules = participantRules;

        this.registry = new CommunityRegistry(config, new InvitationGuard(config.bootstrapThreshold()),
                new PoolLevelIndex(pools), eventBus);
        // Realized inspections reach the regenerator, inspector and activist rules in this order.
        this.regenerators = new RegeneratorRules(config.inspection(), registry,
                participantRules.get(PoolType.REGENERATOR), eventBus);
        this.inspectors = new InspectorRules(config.inspection(), registry,
                participantRules.get(PoolType.INSPECTOR), eventBus);
        new ActivistRules(registry, regenerators, inspectors, participantRules.get(PoolType.ACTIVIST),
                config.inspection().minInspectionsForPool(), eventBus);
        this.inspections = new InspectionLifecycle(config.inspection(), config.scoringTable(), clock, safeguard,
                registry, regenerators, inspectors, eventBus);
        this.governance = new GovernanceValidation(config, clock, safeguard, registry, participantRules,
                participantRules.get(PoolType.VALIDATOR), inspections, eventBus);
        this.supporters = new SupporterRules(registry, ledger, eventBus);

        long genesisBlock = blocks.currentBlock();
        builder.foundingMembers.forEach(member ->
                registry.addFoundingMember(member.address(), member.type(), member.name(), genesisBlock));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Community ====================

    /**
     * Registers a member of any type except regenerators, which carry an area.
     */
    public AccountSnapshot registerUser(String address, UserType type, String name, String proofPhotoHash) {
        return mutate(block -> {
            if (type == UserType.REGENERATOR) {
                throw new PreconditionViolationException(ReasonCode.AREA_OUT_OF_BOUNDS,
                        "Regenerators register with their area");
            }
            return registry.addUser(address, type, name, proofPhotoHash, block).snapshot();
        });
    }

    public RegeneratorStatus registerRegenerator(String address, String name, String proofPhotoHash, long area) {
        return mutate(block -> regenerators.register(address, name, proofPhotoHash, area, block));
    }

    public Invitation invite(String inviter, String invitee, UserType type) {
        return mutate(block -> registry.invite(inviter, invitee, type, block));
    }

    public Optional<AccountSnapshot> account(String address) {
        return read(() -> registry.getAccount(address).map(Account::snapshot));
    }

    public boolean canInvite(String address) {
        return read(() -> registry.isAboveAverage(address));
    }

    public long populationCap(UserType type) {
        return read(() -> registry.populationCap(type));
    }

    public long countOf(UserType type) {
        return read(() -> registry.countOf(type));
    }

    // ==================== Inspections ====================

    public InspectionSnapshot requestInspection(String regenerator) {
        return mutate(block -> inspections.requestInspection(regenerator, block));
    }

    public InspectionSnapshot acceptInspection(String inspector, long inspectionId) {
        return mutate(block -> inspections.acceptInspection(inspector, inspectionId, block));
    }

    public InspectionSnapshot realizeInspection(String inspector, long inspectionId, long treesResult,
                                                long biodiversityResult, String evidenceHash,
                                                String justificationHash) {
        return mutate(block -> inspections.realizeInspection(inspector, inspectionId, treesResult,
                biodiversityResult, evidenceHash, justificationHash, block));
    }

    public InspectionSnapshot expireInspection(long inspectionId) {
        return mutate(block -> inspections.expireInspection(inspectionId, block));
    }

    public Optional<InspectionSnapshot> inspection(long inspectionId) {
        return read(() -> inspections.inspection(inspectionId));
    }

    public List<InspectionSnapshot> inspections(InspectionStatus status) {
        return read(() -> inspections.inspections(status));
    }

    public EraImpact eraImpact(int era) {
        return read(() -> inspections.eraImpact(era));
    }

    public EraImpact totalImpact() {
        return read(inspections::totalImpact);
    }

    public Optional<RegeneratorStatus> regenerator(String address) {
        return read(() -> regenerators.status(address, blocks.currentBlock()));
    }

    public Optional<InspectorStatus> inspector(String address) {
        return read(() -> inspectors.status(address, blocks.currentBlock()));
    }

    // ==================== Pools ====================

    /**
     * Withdraws the era the account's pointer rests on.
     */
    public WithdrawalResult withdraw(PoolType pool, String account) {
        return mutate(block -> {
            registry.requireActive(account);
            return rulesOf(pool).withdraw(account, block);
        });
    }

    /**
     * Withdraws an explicit past era.
     */
    public WithdrawalResult withdraw(PoolType pool, String account, int era) {
        return mutate(block -> {
            registry.requireActive(account);
            return rulesOf(pool).withdraw(account, era, block);
        });
    }

    public PoolStatus poolStatus(PoolType pool) {
        return read(() -> rulesOf(pool).pool().status(blocks.currentBlock()));
    }

    public PoolPosition position(PoolType pool, String account) {
        return read(() -> rulesOf(pool).pool().position(account, blocks.currentBlock()));
    }

    public EraAggregate eraAggregate(PoolType pool, int era) {
        return read(() -> rulesOf(pool).pool().eraAggregate(era));
    }

    // ==================== Governance ====================

    public ResourceSnapshot publishResource(String creator, ResourceType type, String title, String description,
                                            String documentHash) {
        return mutate(block -> governance.publishResource(creator, type, title, description, documentHash, block));
    }

    public VoteOutcome voteResource(String voter, ResourceType type, long resourceId, String justification) {
        return mutate(block -> governance.voteResource(voter, type, resourceId, justification, block));
    }

    public VoteOutcome voteUser(String voter, String target, String justification) {
        return mutate(block -> governance.voteUser(voter, target, justification, block));
    }

    public long convertPoints(String voter) {
        return mutate(block -> governance.convertPoints(voter, block));
    }

    public DelationSnapshot delate(String informer, String reported, String title, String testimony) {
        return mutate(block -> governance.delate(informer, reported, title, testimony, block));
    }

    public DelationSnapshot thumbsUp(String voter, long delationId) {
        return mutate(block -> governance.thumbsUp(voter, delationId));
    }

    public DelationSnapshot thumbsDown(String voter, long delationId) {
        return mutate(block -> governance.thumbsDown(voter, delationId));
    }

    public boolean canVote(String voter) {
        return read(() -> governance.canVote(voter));
    }

    public long votesToInvalidate() {
        return read(governance::votesToInvalidate);
    }

    public long pointsOf(String voter) {
        return read(() -> governance.pointsOf(voter));
    }

    public int penaltiesOf(String creator, ResourceType type) {
        return read(() -> governance.penaltiesOf(creator, type));
    }

    public Optional<ResourceSnapshot> resource(long resourceId) {
        return read(() -> governance.resource(resourceId));
    }

    public List<ResourceSnapshot> resources(ResourceType type) {
        return read(() -> governance.resources(type));
    }

    public Optional<DelationSnapshot> delation(long delationId) {
        return read(() -> governance.delation(delationId));
    }

    public List<DelationSnapshot> delationsAgainst(String reported) {
        return read(() -> governance.delationsAgainst(reported));
    }

    public Optional<UserChallenge> challenge(String target, int era) {
        return read(() -> governance.challenge(target, era));
    }

    // ==================== Supporters ====================

    public BigInteger offset(String supporter, BigInteger amount) {
        return mutate(block -> supporters.offset(supporter, amount, block));
    }

    public BigInteger certifiedOf(String supporter) {
        return read(() -> supporters.certifiedOf(supporter));
    }

    // ==================== Protocol ====================

    public ProtocolOverview overview() {
        return read(() -> {
            long block = blocks.currentBlock();
            int era = clock.currentEra(block);
            Map<UserType, Long> population = new EnumMap<>(UserType.class);
            for (UserType type : UserType.values()) {
                if (type.isRegistrable()) {
                    population.put(type, registry.countOf(type));
                }
            }
            return new ProtocolOverview(block, era, clock.epochOf(era), clock.blocksUntilEraEnd(era, block),
                    safeguard.isActive(block), Map.copyOf(population), governance.votesToInvalidate(),
                    ledger.totalSupply(), ledger.totalLocked(), ledger.totalCertified());
        });
    }

    public <E extends ProtocolEvent> String subscribe(Class<E> eventType, Consumer<? super E> handler) {
        return eventBus.subscribe(eventType, handler);
    }

    /**
     * Rejects every further mutating call. Reads stay available.
     */
    public void stop() {
        lock.lock();
        try {
            running = false;
            log.info("Regeneration protocol stopped");
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public ProtocolConfig config() {
        return config;
    }

    public EraClock clock() {
        return clock;
    }

    public long currentBlock() {
        return blocks.currentBlock();
    }

    // ==================== Internals ====================

    private ParticipantRules rulesOf(PoolType pool) {
        return rules.get(Objects.requireNonNull(pool, "Pool cannot be null"));
    }

    private <T> T mutate(BlockOperation<T> operation) {
        lock.lock();
        try {
            if (!running) {
                throw new PreconditionViolationException(ReasonCode.PROTOCOL_NOT_RUNNING,
                        "Protocol is stopped");
            }
            return operation.apply(blocks.currentBlock());
        } finally {
            lock.unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    @FunctionalInterface
    private interface BlockOperation<T> {
        T apply(long blockNumber);
    }

    // ==================== Builder ====================

    /**
     * One-time wiring. The configuration is locked once {@link #build()} returns;
     * there is no administrative operation afterwards.
     */
    public static final class Builder {

        private ProtocolConfig config;
        private BlockHeightSource blocks;
        private TokenLedger ledger;
        private EventBus eventBus;
        private final List<FoundingMember> foundingMembers = new ArrayList<>();
        private boolean built;

        private Builder() {
        }

        public Builder config(ProtocolConfig config) {
            requireNotBuilt();
            this.config = config;
            return this;
        }

        public Builder blockHeightSource(BlockHeightSource blocks) {
            requireNotBuilt();
            this.blocks = blocks;
            return this;
        }

        public Builder ledger(TokenLedger ledger) {
            requireNotBuilt();
            this.ledger = ledger;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            requireNotBuilt();
            this.eventBus = eventBus;
            return this;
        }

        /**
         * Registers a member without invitation at initialization, so that types which
         * invite their own kind have someone to start from.
         */
        public Builder foundingMember(String address, UserType type, String name) {
            requireNotBuilt();
            foundingMembers.add(new FoundingMember(address, type, name));
            return this;
        }

        public RegenerationProtocol build() {
            requireNotBuilt();
            if (config == null) {
                config = ProtocolConfig.defaults();
            }
            if (blocks == null) {
                throw new ConfigurationException("A block height source is required");
            }
            if (ledger == null) {
                throw new ConfigurationException("A token ledger is required");
            }
            built = true;
            RegenerationProtocol protocol = new RegenerationProtocol(this);
            log.info("Regeneration protocol initialized: deployBlock={}, blocksPerEra={}, halving={}",
                    config.deployBlock(), config.blocksPerEra(), config.halving());
            return protocol;
        }

        private record FoundingMember(String address, UserType type, String name) {}

        private void requireNotBuilt() {
            if (built) {
                throw new ConfigurationException("Protocol configuration is locked");
            }
        }
    }
}
