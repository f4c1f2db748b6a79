package com.regencredit.core.governance;

public record ResourceSnapshot(
        long id,
        ResourceType type,
        String creator,
        String title,
        String description,
        String documentHash,
        long createdAt,
        int era,
        boolean valid,
        int votes,
        long invalidatedAt
) {}
