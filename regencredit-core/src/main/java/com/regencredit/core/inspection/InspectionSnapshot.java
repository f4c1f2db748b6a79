package com.regencredit.core.inspection;

/**
 * Read-only view of an inspection.
 */
public record InspectionSnapshot(
        long id,
        InspectionStatus status,
        String regenerator,
        String inspector,
        long treesResult,
        long biodiversityResult,
        long regenerationScore,
        String evidenceHash,
        String justificationHash,
        long createdAt,
        long acceptedAt,
        long inspectedAt,
        int inspectedAtEra,
        long invalidatedAt
) {}
