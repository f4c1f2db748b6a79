package com.regencredit.core.governance;

import com.regencredit.core.community.UserType;

/**
 * Reviewable contributions and the member type that creates each.
 */
public enum ResourceType {
    REPORT(UserType.DEVELOPER),
    RESEARCH(UserType.RESEARCHER),
    CONTRIBUTION(UserType.CONTRIBUTOR),
    INSPECTION(UserType.INSPECTOR);

    private final UserType creatorType;

    ResourceType(UserType creatorType) {
        this.creatorType = creatorType;
    }

    public UserType creatorType() {
        return creatorType;
    }

    /**
     * Whether members publish this resource directly. Inspections enter review through
     * the inspection lifecycle instead.
     */
    public boolean isPublishable() {
        return this != INSPECTION;
    }
}
