package com.regencredit.core.inspection;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Regenerator state owned by {@link RegeneratorRules}.
 */
class RegeneratorProfile {

    private final String address;
    private final long area;
    boolean pendingInspection;
    int totalInspections;
    Long lastRequestAt;
    long regenerationScore;
    boolean onContractPool;
    int poolEntryEra;
    final Map<Long, Long> unpostedScores = new LinkedHashMap<>();
    final Map<Long, PostedLevel> postedLevels = new LinkedHashMap<>();

    RegeneratorProfile(String address, long area) {
        this.address = Objects.requireNonNull(address, "Address cannot be null");
        this.area = area;
    }

    String address() {
        return address;
    }

    long area() {
        return area;
    }

    RegeneratorStatus snapshot(int poolEra, long poolLevels) {
        return new RegeneratorStatus(address, area, pendingInspection, totalInspections,
                lastRequestAt == null ? 0 : lastRequestAt, regenerationScore, onContractPool, poolEra, poolLevels);
    }
}
