package com.regencredit.core.inspection;

import java.util.Objects;

/**
 * One inspection of a regenerator's area by one inspector.
 * Mutated only by {@link InspectionLifecycle}.
 */
public class Inspection {

    private final long id;
    private final String regenerator;
    private final long createdAt;
    private InspectionStatus status;
    private String inspector;
    private long treesResult;
    private long biodiversityResult;
    private long regenerationScore;
    private String evidenceHash;
    private String justificationHash;
    private long acceptedAt;
    private int acceptedAtEra;
    private long inspectedAt;
    private int inspectedAtEra;
    private long invalidatedAt;

    Inspection(long id, String regenerator, long createdAt) {
        this.id = id;
        this.regenerator = Objects.requireNonNull(regenerator, "Regenerator cannot be null");
        this.createdAt = createdAt;
        this.status = InspectionStatus.OPEN;
    }

    void accept(String inspector, long blockNumber, int era) {
        this.inspector = inspector;
        this.acceptedAt = blockNumber;
        this.acceptedAtEra = era;
        this.status = InspectionStatus.ACCEPTED;
    }

    void reopen() {
        this.inspector = null;
        this.acceptedAt = 0;
        this.acceptedAtEra = 0;
        this.status = InspectionStatus.OPEN;
    }

    void realize(long trees, long biodiversity, long score, String evidenceHash, String justificationHash,
                 long blockNumber, int era) {
        this.treesResult = trees;
        this.biodiversityResult = biodiversity;
        this.regenerationScore = score;
        this.evidenceHash = evidenceHash;
        this.justificationHash = justificationHash;
        this.inspectedAt = blockNumber;
        this.inspectedAtEra = era;
        this.status = InspectionStatus.INSPECTED;
    }

    void invalidate(long blockNumber) {
        this.invalidatedAt = blockNumber;
        this.status = InspectionStatus.INVALIDATED;
    }

    boolean isOverdue(long blockNumber, long deadline) {
        return status == InspectionStatus.ACCEPTED && blockNumber > acceptedAt + deadline;
    }

    /**
     * Era of the latest transition open to review: inspection for realized ones,
     * acceptance otherwise.
     */
    public int reviewEra() {
        return inspectedAtEra > 0 ? inspectedAtEra : acceptedAtEra;
    }

    public long id() { return id; }
    public String regenerator() { return regenerator; }
    public String inspector() { return inspector; }
    public InspectionStatus status() { return status; }
    public long treesResult() { return treesResult; }
    public long biodiversityResult() { return biodiversityResult; }
    public long regenerationScore() { return regenerationScore; }
    public long acceptedAt() { return acceptedAt; }
    public int inspectedAtEra() { return inspectedAtEra; }

    public InspectionSnapshot snapshot() {
        return new InspectionSnapshot(id, status, regenerator, inspector, treesResult, biodiversityResult,
                regenerationScore, evidenceHash, justificationHash, createdAt, acceptedAt, inspectedAt,
                inspectedAtEra, invalidatedAt);
    }
}
