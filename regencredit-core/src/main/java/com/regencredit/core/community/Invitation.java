package com.regencredit.core.community;

import java.util.Objects;

/**
 * Invitation for an address to register as a given type.
 */
public class Invitation {

    public enum Status {
        LIVE,
        CONSUMED,
        REVOKED
    }

    private final String invited;
    private final String inviter;
    private final UserType userType;
    private final long createdAtBlock;
    private Status status;

    Invitation(String invited, String inviter, UserType userType, long createdAtBlock) {
        this.invited = Objects.requireNonNull(invited, "Invited address cannot be null");
        this.inviter = Objects.requireNonNull(inviter, "Inviter address cannot be null");
        this.userType = Objects.requireNonNull(userType, "User type cannot be null");
        this.createdAtBlock = createdAtBlock;
        this.status = Status.LIVE;
    }

    public boolean isExpired(long blockNumber, long validityBlocks) {
        return validityBlocks > 0 && blockNumber > createdAtBlock + validityBlocks;
    }

    void consume() {
        this.status = Status.CONSUMED;
    }

    void revoke() {
        if (status == Status.LIVE) {
            this.status = Status.REVOKED;
        }
    }

    public String invited() { return invited; }
    public String inviter() { return inviter; }
    public UserType userType() { return userType; }
    public long createdAtBlock() { return createdAtBlock; }
    public Status status() { return status; }

    public boolean isLive() {
        return status == Status.LIVE;
    }

    @Override
    public String toString() {
        return "Invitation{" + inviter + " -> " + invited + " as " + userType + ", " + status + "}";
    }
}
