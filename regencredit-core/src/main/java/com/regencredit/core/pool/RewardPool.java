package com.regencredit.core.pool;

import com.regencredit.core.error.ConsistencyViolationException;
import com.regencredit.core.error.ReasonCode;
import com.regencredit.core.ledger.TokenLedger;
import com.regencredit.core.time.EraClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Token budget of one participant class plus its per-era level bookkeeping.
 *
 * <p>Each era distributes {@code tokensPerEra} among the accounts holding levels in
 * that era, proportionally to their levels. An account claims each era at most once.
 * The pool is additive: deduplicating level events is the caller's job.
 *
 * <p>Not thread-safe; callers serialize access.
 */
public class RewardPool {

    private static final Logger log = LoggerFactory.getLogger(RewardPool.class);

    private final PoolType type;
    private final BigInteger totalPoolTokens;
    private final EraClock clock;
    private final TokenLedger ledger;

    private final Map<Integer, EraState> eras = new TreeMap<>();
    private final Map<Integer, Map<String, Long>> eraLevels = new TreeMap<>();
    private final Map<Integer, Set<String>> withdrawn = new HashMap<>();
    private final Map<String, Integer> eraPointers = new HashMap<>();
    private final Map<String, Long> accountLevels = new HashMap<>();
    private long totalActiveLevels;

    public RewardPool(PoolType type, BigInteger totalPoolTokens, EraClock clock, TokenLedger ledger) {
        this.type = Objects.requireNonNull(type, "Pool type cannot be null");
        this.totalPoolTokens = Objects.requireNonNull(totalPoolTokens, "Pool tokens cannot be null");
        this.clock = Objects.requireNonNull(clock, "Era clock cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "Token ledger cannot be null");
        if (totalPoolTokens.signum() < 0) {
            throw new IllegalArgumentException("Pool tokens cannot be negative");
        }
    }

    // ==================== Emission Schedule ====================

    /**
     * Budget of an epoch: {@code totalPoolTokens / 2^epoch}. The remainder of the
     * integer division stays locked.
     */
    public BigInteger tokensPerEpoch(int epoch) {
        if (epoch < 1) {
            throw new IllegalArgumentException("Epochs are 1-indexed, got " + epoch);
        }
        return totalPoolTokens.divide(BigInteger.TWO.pow(epoch));
    }

    public BigInteger tokensPerEra(int epoch, int halving) {
        if (halving <= 0) {
            throw new IllegalArgumentException("Halving must be positive");
        }
        return tokensPerEpoch(epoch).divide(BigInteger.valueOf(halving));
    }

    /**
     * Budget distributed in the given era.
     */
    public BigInteger tokensForEra(int era) {
        return tokensPerEra(clock.epochOf(era), clock.halving());
    }

    // ==================== Levels ====================

    /**
     * Adds levels to an account in an era. The first grant sets the account's
     * withdrawal pointer to that era.
     */
    public void grantLevel(String account, long amount, int era) {
        Objects.requireNonNull(account, "Account cannot be null");
        if (amount <= 0) {
            throw new IllegalArgumentException("Level amount must be positive, got " + amount);
        }
        requireEra(era);

        eraLevels.computeIfAbsent(era, e -> new HashMap<>()).merge(account, amount, Long::sum);
        eraState(era).totalLevels += amount;
        accountLevels.merge(account, amount, Long::sum);
        totalActiveLevels += amount;
        eraPointers.merge(account, era, Math::min);

        log.debug("{} pool: +{} levels to {} in era {}", type, amount, account, era);
    }

    /**
     * Removes levels from an account in one era.
     *
     * @throws ConsistencyViolationException if the account holds fewer levels in that era,
     *         or already withdrew the era
     */
    public void removeLevel(String account, int era, long amount) {
        Objects.requireNonNull(account, "Account cannot be null");
        if (amount <= 0) {
            throw new IllegalArgumentException("Level amount must be positive, got " + amount);
        }
        long held = levelsOf(account, era);
        if (held < amount) {
            throw new ConsistencyViolationException(ReasonCode.LEVEL_UNDERFLOW,
                    type + " pool: cannot remove " + amount + " levels from " + account
                            + " in era " + era + ", holds " + held);
        }
        if (hasWithdrawn(account, era)) {
            throw new ConsistencyViolationException(ReasonCode.LEVEL_UNDERFLOW,
                    type + " pool: levels of " + account + " in era " + era + " were already paid out");
        }
        EraState state = eraState(era);
        if (state.totalLevels < amount || totalActiveLevels < amount) {
            throw new ConsistencyViolationException(ReasonCode.LEVEL_UNDERFLOW,
                    type + " pool: era " + era + " total would underflow");
        }

        eraLevels.get(era).put(account, held - amount);
        state.totalLevels -= amount;
        accountLevels.merge(account, -amount, Long::sum);
        totalActiveLevels -= amount;

        log.debug("{} pool: -{} levels from {} in era {}", type, amount, account, era);
    }

    /**
     * Removes every level of a denied account in every era it holds levels in.
     * Levels of eras the account already withdrew are zeroed for the account but stay
     * in the era denominator, so shares already paid to others are unaffected.
     *
     * @return levels removed from unclaimed eras
     */
    public long removeAllLevels(String account) {
        Objects.requireNonNull(account, "Account cannot be null");
        long removed = 0;
        for (Map.Entry<Integer, Map<String, Long>> entry : eraLevels.entrySet()) {
            int era = entry.getKey();
            long held = entry.getValue().getOrDefault(account, 0L);
            if (held == 0) {
                continue;
            }
            if (!hasWithdrawn(account, era)) {
                EraState state = eraState(era);
                if (state.totalLevels < held) {
                    throw new ConsistencyViolationException(ReasonCode.LEVEL_UNDERFLOW,
                            type + " pool: era " + era + " total would underflow");
                }
                state.totalLevels -= held;
                removed += held;
            }
            entry.getValue().put(account, 0L);
        }
        long total = accountLevels.getOrDefault(account, 0L);
        if (totalActiveLevels < total) {
            throw new ConsistencyViolationException(ReasonCode.LEVEL_UNDERFLOW,
                    type + " pool: active level total would underflow");
        }
        totalActiveLevels -= total;
        accountLevels.put(account, 0L);

        if (total > 0) {
            log.info("{} pool: stripped {} levels from denied account {}", type, total, account);
        }
        return removed;
    }

    // ==================== Withdrawals ====================

    /**
     * Claims the era the account's pointer rests on.
     */
    public WithdrawalResult withdraw(String account, long blockNumber) {
        Objects.requireNonNull(account, "Account cannot be null");
        Integer pointer = eraPointers.get(account);
        if (pointer == null) {
            return WithdrawalResult.nothing(type, account, clock.currentEra(blockNumber),
                    clock.currentEra(blockNumber));
        }
        return withdraw(account, pointer, blockNumber);
    }

    /**
     * Claims the account's share of a closed era.
     * <ul>
     *   <li>era still running: nothing happens</li>
     *   <li>era already claimed: nothing happens</li>
     *   <li>no levels in the era: the pointer skips ahead without a transfer</li>
     *   <li>otherwise {@code levels * tokensPerEra / eraLevels} is released and credited</li>
     *   <li>a ledger failure propagates and leaves the era claimable</li>
     * </ul>
     */
    public WithdrawalResult withdraw(String account, int recordedEra, long blockNumber) {
        Objects.requireNonNull(account, "Account cannot be null");
        requireEra(recordedEra);
        int currentEra = clock.currentEra(blockNumber);
        int pointer = eraPointers.getOrDefault(account, currentEra);

        if (recordedEra >= currentEra) {
            return WithdrawalResult.nothing(type, account, recordedEra, pointer);
        }
        if (hasWithdrawn(account, recordedEra)) {
            if (recordedEra == pointer) {
                pointer = recordedEra + 1;
                eraPointers.put(account, pointer);
            }
            return new WithdrawalResult(type, account, recordedEra,
                    WithdrawalResult.Status.ALREADY_CLAIMED, BigInteger.ZERO, pointer);
        }

        BigInteger eraTokens = tokensForEra(recordedEra);
        long levels = levelsOf(account, recordedEra);

        if (levels == 0) {
            int next = pointer;
            if (recordedEra == pointer) {
                next = nextClaimableEra(account, recordedEra, currentEra);
                eraPointers.put(account, next);
            }
            log.debug("{} pool: {} holds no levels in era {}, pointer moved to {}", type, account, recordedEra, next);
            return new WithdrawalResult(type, account, recordedEra,
                    WithdrawalResult.Status.SKIPPED, BigInteger.ZERO, next);
        }

        EraState state = eraState(recordedEra);
        BigInteger payout = BigInteger.valueOf(levels)
                .multiply(eraTokens)
                .divide(BigInteger.valueOf(state.totalLevels));

        if (payout.signum() > 0) {
            ledger.release(type.ledgerAddress(), account, payout);
        }

        withdrawn.computeIfAbsent(recordedEra, e -> new HashSet<>()).add(account);
        state.claimsCount++;
        state.tokensClaimed = state.tokensClaimed.add(payout);
        int next = pointer;
        if (recordedEra == pointer) {
            next = recordedEra + 1;
            eraPointers.put(account, next);
        }

        log.info("{} pool: {} withdrew {} for era {} ({} of {} levels)",
                type, account, payout, recordedEra, levels, state.totalLevels);
        return new WithdrawalResult(type, account, recordedEra, WithdrawalResult.Status.PAID, payout, next);
    }

    /**
     * Whether the pointer rests on a closed, unclaimed era.
     */
    public boolean canWithdraw(String account, long blockNumber) {
        Integer pointer = eraPointers.get(account);
        return pointer != null
                && pointer < clock.currentEra(blockNumber)
                && !hasWithdrawn(account, pointer);
    }

    private int nextClaimableEra(String account, int fromEra, int currentEra) {
        for (int era = fromEra + 1; era < currentEra; era++) {
            if (levelsOf(account, era) > 0 && !hasWithdrawn(account, era)) {
                return era;
            }
        }
        return currentEra;
    }

    // ==================== Queries ====================

    public long levelsOf(String account, int era) {
        Map<String, Long> levels = eraLevels.get(era);
        return levels == null ? 0 : levels.getOrDefault(account, 0L);
    }

    /**
     * Sum of the account's levels across all eras.
     */
    public long totalLevelsOf(String account) {
        return accountLevels.getOrDefault(account, 0L);
    }

    public long totalActiveLevels() {
        return totalActiveLevels;
    }

    public boolean hasWithdrawn(String account, int era) {
        Set<String> accounts = withdrawn.get(era);
        return accounts != null && accounts.contains(account);
    }

    public EraAggregate eraAggregate(int era) {
        requireEra(era);
        EraState state = eras.get(era);
        if (state == null) {
            return new EraAggregate(era, 0, BigInteger.ZERO, 0);
        }
        return new EraAggregate(era, state.claimsCount, state.tokensClaimed, state.totalLevels);
    }

    public PoolPosition position(String account, long blockNumber) {
        int currentEra = clock.currentEra(blockNumber);
        Integer pointer = eraPointers.get(account);
        int era = pointer != null ? pointer : currentEra;
        return new PoolPosition(
                type,
                account,
                era,
                totalLevelsOf(account),
                levelsOf(account, era),
                clock.elapsedErasSince(era, blockNumber),
                canWithdraw(account, blockNumber));
    }

    public PoolStatus status(long blockNumber) {
        int era = clock.currentEra(blockNumber);
        int epoch = clock.epochOf(era);
        return new PoolStatus(
                type,
                totalPoolTokens,
                era,
                epoch,
                tokensPerEra(epoch, clock.halving()),
                eraAggregate(era).totalLevels(),
                totalActiveLevels);
    }

    public PoolType type() {
        return type;
    }

    public BigInteger totalPoolTokens() {
        return totalPoolTokens;
    }

    private EraState eraState(int era) {
        return eras.computeIfAbsent(era, e -> new EraState());
    }

    private static void requireEra(int era) {
        if (era < 1) {
            throw new IllegalArgumentException("Eras are 1-indexed, got " + era);
        }
    }

    private static final class EraState {
        private long claimsCount;
        private BigInteger tokensClaimed = BigInteger.ZERO;
        private long totalLevels;
    }
}
