package com.regencredit.core.governance;

public record DelationSnapshot(
        long id,
        String informer,
        String reported,
        String title,
        String testimony,
        long createdAt,
        int thumbsUp,
        int thumbsDown
) {}
