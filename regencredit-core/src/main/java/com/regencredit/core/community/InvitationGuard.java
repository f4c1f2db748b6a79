package com.regencredit.core.community;

/**
 * Anti-Sybil gate on network growth. Once a type has more members than the bootstrap
 * threshold, only members contributing strictly above the type's average level may
 * bring new members in.
 */
public class InvitationGuard {

    private final long bootstrapThreshold;

    public InvitationGuard(long bootstrapThreshold) {
        if (bootstrapThreshold < 0) {
            throw new IllegalArgumentException("Bootstrap threshold cannot be negative");
        }
        this.bootstrapThreshold = bootstrapThreshold;
    }

    public boolean canInvite(long totalLevelsOfType, long totalUsersOfType, long inviterLevels) {
        if (totalUsersOfType <= bootstrapThreshold) {
            return true;
        }
        return inviterLevels >= minimumLevels(totalLevelsOfType, totalUsersOfType);
    }

    /**
     * Levels an account needs once the bootstrap phase is over: average plus one.
     */
    public long minimumLevels(long totalLevelsOfType, long totalUsersOfType) {
        if (totalUsersOfType <= 0) {
            return 0;
        }
        return totalLevelsOfType / totalUsersOfType + 1;
    }

    public long bootstrapThreshold() {
        return bootstrapThreshold;
    }
}
