package com.regencredit.core.inspection;

/**
 * Inspection states. INSPECTED and INVALIDATED are terminal for the lifecycle;
 * only governance moves an inspection to INVALIDATED.
 */
public enum InspectionStatus {
    OPEN,
    ACCEPTED,
    INSPECTED,
    INVALIDATED;

    public boolean isActive() {
        return this == OPEN || this == ACCEPTED;
    }
}
