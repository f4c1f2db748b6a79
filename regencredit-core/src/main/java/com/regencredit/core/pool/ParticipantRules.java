package com.regencredit.core.pool;

import com.regencredit.core.event.EventBus;
import com.regencredit.core.event.ProtocolEvents.LevelGranted;
import com.regencredit.core.event.ProtocolEvents.LevelRemoved;
import com.regencredit.core.event.ProtocolEvents.UserDenied;
import com.regencredit.core.event.ProtocolEvents.WithdrawalCompleted;
import com.regencredit.core.time.EraClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Level rules shared by every participant class: one instance wraps the pool of one
 * class and is the only writer of it.
 *
 * <p>Level grants are keyed by an event id, so re-delivering the same inspection,
 * report or vote never credits twice. Accounts denied by the community lose their
 * levels in every era and are never credited again.
 */
public class ParticipantRules {

    private static final Logger log = LoggerFactory.getLogger(ParticipantRules.class);

    private final RewardPool pool;
    private final EraClock clock;
    private final EventBus eventBus;
    private final Set<String> creditedEvents = new HashSet<>();
    private final Set<String> deniedAccounts = new HashSet<>();

    public ParticipantRules(RewardPool pool, EraClock clock, EventBus eventBus) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        this.clock = Objects.requireNonNull(clock, "Era clock cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        eventBus.subscribe(UserDenied.class, this::onUserDenied);
    }

    /**
     * Credits levels in the era of the given block.
     *
     * @return false when the event was already credited or the account is denied
     */
    public boolean grantLevel(String eventId, String account, long amount, long blockNumber) {
        return grantLevelAt(eventId, account, amount, clock.currentEra(blockNumber), blockNumber);
    }

    /**
     * Credits levels against an explicit era index.
     *
     * @return false when the event was already credited or the account is denied
     */
    public boolean grantLevelAt(String eventId, String account, long amount, int era, long blockNumber) {
        Objects.requireNonNull(eventId, "Event ID cannot be null");
        if (creditedEvents.contains(eventId)) {
            return false;
        }
        if (deniedAccounts.contains(account)) {
            log.debug("{} pool: {} is denied, {} not credited", pool.type(), account, eventId);
            return false;
        }
        pool.grantLevel(account, amount, era);
        creditedEvents.add(eventId);
        eventBus.publish(new LevelGranted(pool.type(), account, amount, era, eventId, blockNumber));
        return true;
    }

    public void removeLevel(String account, int era, long amount, long blockNumber) {
        pool.removeLevel(account, era, amount);
        eventBus.publish(new LevelRemoved(pool.type(), account, amount, era, false, blockNumber));
    }

    public WithdrawalResult withdraw(String account, long blockNumber) {
        WithdrawalResult result = pool.withdraw(account, blockNumber);
        publishIfPaid(result, blockNumber);
        return result;
    }

    public WithdrawalResult withdraw(String account, int era, long blockNumber) {
        WithdrawalResult result = pool.withdraw(account, era, blockNumber);
        publishIfPaid(result, blockNumber);
        return result;
    }

    public boolean isCredited(String eventId) {
        return creditedEvents.contains(eventId);
    }

    public long levelsOf(String account) {
        return pool.totalLevelsOf(account);
    }

    public RewardPool pool() {
        return pool;
    }

    public PoolType type() {
        return pool.type();
    }

    private void onUserDenied(UserDenied event) {
        deniedAccounts.add(event.account());
        long held = pool.totalLevelsOf(event.account());
        if (held == 0) {
            return;
        }
        pool.removeAllLevels(event.account());
        eventBus.publish(new LevelRemoved(pool.type(), event.account(), held,
                clock.currentEra(event.blockNumber()), true, event.blockNumber()));
    }

    private void publishIfPaid(WithdrawalResult result, long blockNumber) {
        if (result.paid()) {
            eventBus.publish(new WithdrawalCompleted(result.pool(), result.account(), result.era(),
                    result.amount(), blockNumber));
        }
    }
}
