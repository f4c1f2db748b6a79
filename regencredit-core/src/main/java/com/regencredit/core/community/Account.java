package com.regencredit.core.community;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registered community member. The type is fixed at registration; denial is the only
 * change, and the former type is kept for bookkeeping.
 */
public class Account {

    private final String address;
    private final String name;
    private final String proofPhotoHash;
    private final String inviter;
    private final long registeredAtBlock;
    private UserType type;
    private UserType formerType;
    private int inviterPenalties;
    private final Map<UserType, Long> lastInvitationAt = new EnumMap<>(UserType.class);

    Account(String address, UserType type, String name, String proofPhotoHash, String inviter, long registeredAtBlock) {
        this.address = Objects.requireNonNull(address, "Address cannot be null");
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        this.name = name;
        this.proofPhotoHash = proofPhotoHash;
        this.inviter = inviter;
        this.registeredAtBlock = registeredAtBlock;
    }

    void deny() {
        this.formerType = type;
        this.type = UserType.DENIED;
    }

    void addInviterPenalty() {
        inviterPenalties++;
    }

    void recordInvitation(UserType invitedType, long blockNumber) {
        lastInvitationAt.put(invitedType, blockNumber);
    }

    Optional<Long> lastInvitationAt(UserType invitedType) {
        return Optional.ofNullable(lastInvitationAt.get(invitedType));
    }

    public String address() { return address; }
    public UserType type() { return type; }
    public String name() { return name; }
    public String proofPhotoHash() { return proofPhotoHash; }
    public int inviterPenalties() { return inviterPenalties; }
    public long registeredAtBlock() { return registeredAtBlock; }

    /**
     * Address that invited this account, empty for open registrations.
     */
    public Optional<String> inviter() {
        return Optional.ofNullable(inviter);
    }

    /**
     * Type held before denial; the current type otherwise.
     */
    public UserType effectiveType() {
        return formerType != null ? formerType : type;
    }

    public boolean isDenied() {
        return type == UserType.DENIED;
    }

    public AccountSnapshot snapshot() {
        return new AccountSnapshot(address, type, effectiveType(), name, proofPhotoHash, inviter,
                registeredAtBlock, inviterPenalties);
    }
}
