package com.regencredit.core.governance;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A public report of misconduct against a member. Other voters react to it; the
 * reactions inform user challenges but never deny anyone on their own.
 */
class Delation {

    private final long id;
    private final String informer;
    private final String reported;
    private final String title;
    private final String testimony;
    private final long createdAt;
    private final Set<String> reactors = new HashSet<>();
    private int thumbsUp;
    private int thumbsDown;

    Delation(long id, String informer, String reported, String title, String testimony, long createdAt) {
        this.id = id;
        this.informer = Objects.requireNonNull(informer, "Informer cannot be null");
        this.reported = Objects.requireNonNull(reported, "Reported cannot be null");
        this.title = title;
        this.testimony = testimony;
        this.createdAt = createdAt;
    }

    boolean hasReacted(String voter) {
        return reactors.contains(voter);
    }

    void react(String voter, boolean up) {
        reactors.add(voter);
        if (up) {
            thumbsUp++;
        } else {
            thumbsDown++;
        }
    }

    long id() { return id; }
    String informer() { return informer; }
    String reported() { return reported; }

    DelationSnapshot snapshot() {
        return new DelationSnapshot(id, informer, reported, title, testimony, createdAt, thumbsUp, thumbsDown);
    }
}
