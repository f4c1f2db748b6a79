package com.regencredit.core.kernel;

import com.regencredit.core.community.LevelIndex;
import com.regencredit.core.community.UserType;
import com.regencredit.core.pool.PoolType;
import com.regencredit.core.pool.RewardPool;

import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves a member type to the reward pool that holds its levels.
 */
class PoolLevelIndex implements LevelIndex {

    private final Map<PoolType, RewardPool> pools;

    PoolLevelIndex(Map<PoolType, RewardPool> pools) {
        this.pools = new EnumMap<>(pools);
    }

    @Override
    public long levelsOf(UserType type, String account) {
        return type.pool().map(pools::get).map(pool -> pool.totalLevelsOf(account)).orElse(0L);
    }

    @Override
    public long totalLevels(UserType type) {
        return type.pool().map(pools::get).map(RewardPool::totalActiveLevels).orElse(0L);
    }
}
