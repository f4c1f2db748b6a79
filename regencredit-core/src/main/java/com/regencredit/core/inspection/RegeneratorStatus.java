package com.regencredit.core.inspection;

/**
 * Read-only view of a regenerator.
 *
 * @param regenerationScore sum of the scores of its valid inspections
 * @param poolEra era its withdrawal pointer rests on
 * @param poolLevels levels posted to the regenerator pool
 */
public record RegeneratorStatus(
        String address,
        long area,
        boolean pendingInspection,
        int totalInspections,
        long lastRequestAt,
        long regenerationScore,
        boolean onContractPool,
        int poolEra,
        long poolLevels
) {}
