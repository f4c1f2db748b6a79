package com.regencredit.core.inspection;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Inspector state owned by {@link InspectorRules}.
 */
class InspectorProfile {

    private final String address;
    int totalInspections;
    int giveUps;
    int penalties;
    Long lastAcceptedAt;
    long lastRealizedAt;
    Long activeInspection;
    final Set<String> inspectedRegenerators = new LinkedHashSet<>();
    final Map<Long, PostedLevel> postedLevels = new HashMap<>();

    InspectorProfile(String address) {
        this.address = Objects.requireNonNull(address, "Address cannot be null");
    }

    String address() {
        return address;
    }

    InspectorStatus snapshot(int poolEra, long poolLevels) {
        return new InspectorStatus(address, totalInspections, giveUps, penalties,
                lastAcceptedAt == null ? 0 : lastAcceptedAt, lastRealizedAt,
                activeInspection == null ? 0 : activeInspection, Set.copyOf(inspectedRegenerators),
                poolEra, poolLevels);
    }
}
