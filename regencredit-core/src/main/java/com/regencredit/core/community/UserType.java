package com.regencredit.core.community;

import com.regencredit.core.pool.PoolType;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Participant classes of the community. An account holds exactly one type;
 * the only transition after registration is to {@link #DENIED}.
 */
public enum UserType {
    UNDEFINED,
    REGENERATOR,
    INSPECTOR,
    RESEARCHER,
    DEVELOPER,
    CONTRIBUTOR,
    ACTIVIST,
    SUPPORTER,
    DENIED;

    private static final Set<UserType> VOTERS = EnumSet.of(DEVELOPER, RESEARCHER, CONTRIBUTOR, ACTIVIST);

    /**
     * Types that can take part in validation votes.
     */
    public static Set<UserType> voterTypes() {
        return EnumSet.copyOf(VOTERS);
    }

    public boolean isVoter() {
        return VOTERS.contains(this);
    }

    /**
     * Types an account can register as.
     */
    public boolean isRegistrable() {
        return this != UNDEFINED && this != DENIED;
    }

    /**
     * The reward pool this type earns levels in, if any.
     */
    public Optional<PoolType> pool() {
        return switch (this) {
            case REGENERATOR -> Optional.of(PoolType.REGENERATOR);
            case INSPECTOR -> Optional.of(PoolType.INSPECTOR);
            case RESEARCHER -> Optional.of(PoolType.RESEARCHER);
            case DEVELOPER -> Optional.of(PoolType.DEVELOPER);
            case CONTRIBUTOR -> Optional.of(PoolType.CONTRIBUTOR);
            case ACTIVIST -> Optional.of(PoolType.ACTIVIST);
            case UNDEFINED, SUPPORTER, DENIED -> Optional.empty();
        };
    }
}
