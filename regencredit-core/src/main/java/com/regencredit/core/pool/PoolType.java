package com.regencredit.core.pool;

/**
 * Token budgets. Every contributing participant class has one, plus the
 * validator pool fed by governance votes.
 */
public enum PoolType {
    REGENERATOR,
    INSPECTOR,
    RESEARCHER,
    DEVELOPER,
    CONTRIBUTOR,
    ACTIVIST,
    VALIDATOR;

    /**
     * Ledger address holding the locked tokens of this pool.
     */
    public String ledgerAddress() {
        return "pool:" + name().toLowerCase();
    }
}
