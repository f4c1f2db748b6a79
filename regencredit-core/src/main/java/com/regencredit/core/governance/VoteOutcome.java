package com.regencredit.core.governance;

/**
 * Result of a single vote.
 *
 * @param votes votes accumulated against the target after this one
 * @param threshold votes needed to invalidate at the time of the vote
 * @param invalidated whether this vote reached the threshold
 */
public record VoteOutcome(String voter, String target, int votes, long threshold, boolean invalidated) {}
