package com.regencredit.core.community;

/**
 * Read access to pool levels, used for eligibility checks.
 */
public interface LevelIndex {

    /**
     * Levels an account holds in the pool of its type, across all eras.
     */
    long levelsOf(UserType type, String account);

    /**
     * Active levels of every member of a type.
     */
    long totalLevels(UserType type);
}
