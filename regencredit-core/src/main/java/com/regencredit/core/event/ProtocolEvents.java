package com.regencredit.core.event;

import com.regencredit.core.community.UserType;
import com.regencredit.core.governance.ResourceType;
import com.regencredit.core.inspection.InspectionStatus;
import com.regencredit.core.pool.PoolType;

import java.math.BigInteger;

/**
 * Events exchanged between the protocol components.
 */
public final class ProtocolEvents {

    private ProtocolEvents() {
    }

    public record UserRegistered(String account, UserType type, String inviter, long blockNumber)
            implements ProtocolEvent {}

    /**
     * An account reached the terminal denied state. Every pool strips its levels.
     */
    public record UserDenied(String account, UserType formerType, long blockNumber)
            implements ProtocolEvent {}

    public record LevelGranted(PoolType pool, String account, long amount, int era, String eventId, long blockNumber)
            implements ProtocolEvent {}

    public record LevelRemoved(PoolType pool, String account, long amount, int era, boolean denied, long blockNumber)
            implements ProtocolEvent {}

    public record WithdrawalCompleted(PoolType pool, String account, int era, BigInteger amount, long blockNumber)
            implements ProtocolEvent {}

    public record InspectionRealized(
            long inspectionId,
            String regenerator,
            String inspector,
            long treesResult,
            long biodiversityResult,
            long regenerationScore,
            int era,
            long blockNumber
    ) implements ProtocolEvent {}

    public record InspectionExpired(long inspectionId, String inspector, int giveUps, long blockNumber)
            implements ProtocolEvent {}

    /**
     * Governance invalidated an inspection that was accepted or already inspected.
     */
    public record InspectionInvalidated(
            long inspectionId,
            String regenerator,
            String inspector,
            InspectionStatus previousStatus,
            long regenerationScore,
            int era,
            long blockNumber
    ) implements ProtocolEvent {}

    public record ResourceInvalidated(ResourceType resourceType, long resourceId, String creator, int era, long blockNumber)
            implements ProtocolEvent {}

    public record VoteCast(String voter, String target, int era, long blockNumber)
            implements ProtocolEvent {}

    /**
     * A supporter burned tokens to offset its impact.
     */
    public record TokensOffset(String supporter, BigInteger amount, BigInteger certifiedTotal, long blockNumber)
            implements ProtocolEvent {}
}
