package com.regencredit.core.inspection;

import java.util.Set;

/**
 * Read-only view of an inspector.
 *
 * @param activeInspection id of the accepted inspection in progress, 0 for none
 */
public record InspectorStatus(
        String address,
        int totalInspections,
        int giveUps,
        int penalties,
        long lastAcceptedAt,
        long lastRealizedAt,
        long activeInspection,
        Set<String> inspectedRegenerators,
        int poolEra,
        long poolLevels
) {}
