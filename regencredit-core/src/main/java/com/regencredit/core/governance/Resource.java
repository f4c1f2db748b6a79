package com.regencredit.core.governance;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A published report, research item or contribution under review.
 */
class Resource {

    private final long id;
    private final ResourceType type;
    private final String creator;
    private final String title;
    private final String description;
    private final String documentHash;
    private final long createdAt;
    private final int era;
    private final Set<String> voters = new LinkedHashSet<>();
    private boolean valid = true;
    private long invalidatedAt;

    Resource(long id, ResourceType type, String creator, String title, String description, String documentHash,
             long createdAt, int era) {
        this.id = id;
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        this.creator = Objects.requireNonNull(creator, "Creator cannot be null");
        this.title = title;
        this.description = description;
        this.documentHash = documentHash;
        this.createdAt = createdAt;
        this.era = era;
    }

    void invalidate(long blockNumber) {
        valid = false;
        invalidatedAt = blockNumber;
    }

    long id() { return id; }
    ResourceType type() { return type; }
    String creator() { return creator; }
    int era() { return era; }
    boolean isValid() { return valid; }
    Set<String> voters() { return voters; }

    ResourceSnapshot snapshot() {
        return new ResourceSnapshot(id, type, creator, title, description, documentHash, createdAt, era,
                valid, voters.size(), invalidatedAt);
    }
}
