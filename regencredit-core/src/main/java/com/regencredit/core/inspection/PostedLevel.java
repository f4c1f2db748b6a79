package com.regencredit.core.inspection;

/**
 * Levels a single inspection put into a pool, kept so governance can claw them back.
 */
record PostedLevel(int era, long amount) {}
