package com.regencredit.core.community;

import com.regencredit.core.config.ProtocolConfig;
import com.regencredit.core.config.ProtocolConfig.TypePolicy;
import com.regencredit.core.config.TextLimits;
import com.regencredit.core.error.ConfigurationException;
import com.regencredit.core.error.ConsistencyViolationException;
import com.regencredit.core.error.PreconditionViolationException;
import com.regencredit.core.error.ReasonCode;
import com.regencredit.core.error.TemporalGateException;
import com.regencredit.core.event.EventBus;
import com.regencredit.core.event.ProtocolEvents.UserDenied;
import com.regencredit.core.event.ProtocolEvents.UserRegistered;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Community membership: identities, types, the invitation graph, population caps and
 * the denial cascade.
 *
 * <p>Not thread-safe; callers serialize access.
 */
public class CommunityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CommunityRegistry.class);

    private final ProtocolConfig config;
    private final InvitationGuard guard;
    private final LevelIndex levels;
    private final EventBus eventBus;

    private final Map<String, Account> accounts = new HashMap<>();
    private final Map<String, Invitation> invitations = new HashMap<>();
    private final Map<String, List<Invitation>> issuedInvitations = new HashMap<>();
    private final Map<UserType, Long> population = new EnumMap<>(UserType.class);

    public CommunityRegistry(ProtocolConfig config, InvitationGuard guard, LevelIndex levels, EventBus eventBus) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.guard = Objects.requireNonNull(guard, "Invitation guard cannot be null");
        this.levels = Objects.requireNonNull(levels, "Level index cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
    }

    // ==================== Registration ====================

    /**
     * Registers an address as a member of the given type.
     *
     * @throws PreconditionViolationException if the address is already known, the type is
     *         full, or no usable invitation exists when the type requires one
     */
    public Account addUser(String address, UserType type, String name, String proofPhotoHash, long blockNumber) {
        Objects.requireNonNull(address, "Address cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
        TextLimits.require("name", name, TextLimits.NAME);
        TextLimits.bounded("proofPhotoHash", proofPhotoHash, TextLimits.HASH);

        if (!type.isRegistrable()) {
            throw new PreconditionViolationException(ReasonCode.INVITATION_NOT_ALLOWED,
                    "Cannot register as " + type);
        }
        if (accounts.containsKey(address)) {
            throw new PreconditionViolationException(ReasonCode.ALREADY_REGISTERED,
                    address + " is already registered as " + accounts.get(address).type());
        }
        long cap = populationCap(type);
        if (countOf(type) >= cap) {
            throw new PreconditionViolationException(ReasonCode.POPULATION_CAP_REACHED,
                    type + " population cap of " + cap + " reached");
        }

        TypePolicy policy = config.policyFor(type);
        Invitation invitation = null;
        if (policy.invitationRequired()) {
            invitation = usableInvitation(address, type, blockNumber);
        }

        String inviter = invitation != null ? invitation.inviter() : null;
        Account account = new Account(address, type, name, proofPhotoHash, inviter, blockNumber);
        accounts.put(address, account);
        population.merge(type, 1L, Long::sum);
        if (invitation != null) {
            invitation.consume();
        }

        log.info("Registered {} as {} (invited by {})", address, type, inviter);
        eventBus.publish(new UserRegistered(address, type, inviter, blockNumber));
        return account;
    }

    /**
     * Registers a founding member without invitation. Only called while the protocol is
     * being initialized, before it accepts any call.
     */
    public Account addFoundingMember(String address, UserType type, String name, long blockNumber) {
        Objects.requireNonNull(address, "Address cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
        TextLimits.require("name", name, TextLimits.NAME);
        if (!type.isRegistrable() || type == UserType.REGENERATOR) {
            throw new ConfigurationException("A founding member cannot be a " + type);
        }
        if (accounts.containsKey(address)) {
            throw new ConfigurationException(address + " is listed twice as founding member");
        }
        Account account = new Account(address, type, name, null, null, blockNumber);
        accounts.put(address, account);
        population.merge(type, 1L, Long::sum);

        log.info("Founding member {} registered as {}", address, type);
        eventBus.publish(new UserRegistered(address, type, null, blockNumber));
        return account;
    }

    private Invitation usableInvitation(String address, UserType type, long blockNumber) {
        Invitation invitation = invitations.get(address);
        if (invitation == null || !invitation.isLive()) {
            throw new PreconditionViolationException(ReasonCode.INVITATION_REQUIRED,
                    address + " has no live invitation");
        }
        if (invitation.userType() != type) {
            throw new PreconditionViolationException(ReasonCode.INVITATION_REQUIRED,
                    address + " was invited as " + invitation.userType() + ", not " + type);
        }
        if (invitation.isExpired(blockNumber, config.invitationValidityBlocks())) {
            throw new PreconditionViolationException(ReasonCode.INVITATION_REQUIRED,
                    "Invitation of " + address + " expired");
        }
        Account inviter = accounts.get(invitation.inviter());
        if (inviter == null || inviter.isDenied() || inviter.inviterPenalties() >= config.maxInviterPenalties()) {
            throw new PreconditionViolationException(ReasonCode.INVITATION_REQUIRED,
                    "Inviter of " + address + " lost its invitation rights");
        }
        return invitation;
    }

    /**
     * Maximum population of a type given the current regenerator count.
     */
    public long populationCap(UserType type) {
        TypePolicy policy = config.policyFor(type);
        long regenerators = countOf(UserType.REGENERATOR);
        long cap = switch (policy.proportionality()) {
            case NONE -> Long.MAX_VALUE;
            case DIRECT -> Math.max(policy.minimumSlots(), Math.multiplyExact(regenerators, policy.ratio()));
            case INVERSE -> Math.max(policy.minimumSlots(), regenerators / policy.ratio());
        };
        if (policy.maxUsers() > 0) {
            cap = Math.min(cap, policy.maxUsers());
        }
        return cap;
    }

    // ==================== Invitations ====================

    /**
     * Issues an invitation for {@code invitee} to register as {@code type}.
     *
     * @throws TemporalGateException if the inviter is still in its invitation cool-down
     */
    public Invitation invite(String inviter, String invitee, UserType type, long blockNumber) {
        Objects.requireNonNull(invitee, "Invitee cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
        Account account = requireActive(inviter);

        if (!type.isRegistrable()) {
            throw new PreconditionViolationException(ReasonCode.INVITATION_NOT_ALLOWED, "Cannot invite as " + type);
        }
        TypePolicy policy = config.policyFor(type);
        if (policy.inviterType() != account.type()) {
            throw new PreconditionViolationException(ReasonCode.INVITATION_NOT_ALLOWED,
                    account.type() + " cannot invite " + type);
        }
        if (account.inviterPenalties() >= config.maxInviterPenalties()) {
            throw new PreconditionViolationException(ReasonCode.INVITER_PENALIZED,
                    inviter + " reached " + account.inviterPenalties() + " inviter penalties");
        }
        if (accounts.containsKey(invitee)) {
            throw new PreconditionViolationException(ReasonCode.ALREADY_REGISTERED, invitee + " is already registered");
        }
        Invitation existing = invitations.get(invitee);
        if (existing != null && existing.isLive()
                && !existing.isExpired(blockNumber, config.invitationValidityBlocks())) {
            throw new PreconditionViolationException(ReasonCode.INVITATION_ALREADY_EXISTS,
                    invitee + " already holds a live invitation");
        }

        Optional<Long> last = account.lastInvitationAt(type);
        if (last.isPresent() && blockNumber < last.get() + policy.invitationDelayBlocks()) {
            throw new TemporalGateException(ReasonCode.INVITATION_COOLDOWN,
                    inviter + " must wait between invitations", last.get() + policy.invitationDelayBlocks());
        }
        if (!canInviteByLevels(account)) {
            throw new PreconditionViolationException(ReasonCode.INVITE_ELIGIBILITY,
                    inviter + " needs above-average levels to invite");
        }

        if (existing != null) {
            existing.revoke();
        }
        Invitation invitation = new Invitation(invitee, inviter, type, blockNumber);
        invitations.put(invitee, invitation);
        issuedInvitations.computeIfAbsent(inviter, k -> new ArrayList<>()).add(invitation);
        account.recordInvitation(type, blockNumber);

        log.info("{} invited {} as {}", inviter, invitee, type);
        return invitation;
    }

    /**
     * Whether the account passes the above-average level rule for its own type.
     * Types without a pool always pass.
     */
    public boolean isAboveAverage(String address) {
        Account account = accounts.get(address);
        return account != null && !account.isDenied() && canInviteByLevels(account);
    }

    private boolean canInviteByLevels(Account account) {
        UserType type = account.type();
        if (type.pool().isEmpty()) {
            return true;
        }
        return guard.canInvite(levels.totalLevels(type), countOf(type), levels.levelsOf(type, account.address()));
    }

    /**
     * Counts a penalty against an inviter whose invitee was denied. Reaching the limit
     * removes the right to invite.
     */
    public void addInviterPenalty(String inviter) {
        Account account = accounts.get(inviter);
        if (account == null) {
            return;
        }
        account.addInviterPenalty();
        if (account.inviterPenalties() == config.maxInviterPenalties()) {
            log.warn("{} lost its invitation rights after {} penalties", inviter, account.inviterPenalties());
        }
    }

    // ==================== Denial ====================

    /**
     * Moves an account to the terminal denied state. Its live invitations die, its inviter
     * is penalized and every pool strips its levels. Denying twice has no effect.
     */
    public void setToDenied(String address, long blockNumber) {
        Account account = requireRegistered(address);
        if (account.isDenied()) {
            return;
        }
        UserType formerType = account.type();
        long count = countOf(formerType);
        if (count <= 0) {
            throw new ConsistencyViolationException(ReasonCode.COUNTER_UNDERFLOW,
                    formerType + " population would underflow");
        }

        population.put(formerType, count - 1);
        account.deny();
        issuedInvitations.getOrDefault(address, List.of()).forEach(Invitation::revoke);
        account.inviter().ifPresent(this::addInviterPenalty);

        log.info("Denied {} (was {})", address, formerType);
        eventBus.publish(new UserDenied(address, formerType, blockNumber));
    }

    // ==================== Queries ====================

    public Optional<Account> getAccount(String address) {
        return Optional.ofNullable(accounts.get(address));
    }

    public Account requireRegistered(String address) {
        Objects.requireNonNull(address, "Address cannot be null");
        Account account = accounts.get(address);
        if (account == null) {
            throw new PreconditionViolationException(ReasonCode.NOT_REGISTERED, address + " is not registered");
        }
        return account;
    }

    /**
     * Returns the account if it is registered and not denied.
     */
    public Account requireActive(String address) {
        Account account = requireRegistered(address);
        if (account.isDenied()) {
            throw new PreconditionViolationException(ReasonCode.USER_DENIED, address + " is denied");
        }
        return account;
    }

    /**
     * Returns the account if it is an active member of the given type.
     */
    public Account requireActive(String address, UserType type) {
        Account account = requireActive(address);
        if (account.type() != type) {
            throw new PreconditionViolationException(ReasonCode.NOT_REGISTERED,
                    address + " is not a " + type);
        }
        return account;
    }

    public UserType typeOf(String address) {
        Account account = accounts.get(address);
        return account == null ? UserType.UNDEFINED : account.type();
    }

    public boolean isDenied(String address) {
        Account account = accounts.get(address);
        return account != null && account.isDenied();
    }

    /**
     * Active members of a type.
     */
    public long countOf(UserType type) {
        return population.getOrDefault(type, 0L);
    }

    /**
     * Active members of the voter-eligible types.
     */
    public long voterCount() {
        return UserType.voterTypes().stream().mapToLong(this::countOf).sum();
    }

    public Optional<Invitation> invitationOf(String invitee) {
        return Optional.ofNullable(invitations.get(invitee));
    }

    public List<Invitation> invitationsIssuedBy(String inviter) {
        return List.copyOf(issuedInvitations.getOrDefault(inviter, List.of()));
    }

    public InvitationGuard guard() {
        return guard;
    }
}
