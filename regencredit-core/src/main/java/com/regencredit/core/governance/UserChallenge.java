package com.regencredit.core.governance;

import java.util.Set;

/**
 * Votes to deny a user within one era.
 *
 * @param hunter first voter of the era against this user
 */
public record UserChallenge(String target, int era, String hunter, Set<String> voters, boolean succeeded) {}
