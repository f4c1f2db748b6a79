package com.regencredit.core.inspection;

import com.regencredit.core.error.ConfigurationException;

import java.util.Arrays;

/**
 * Seven-tier threshold table turning inspection results into regeneration points.
 * A result earns the points of the highest tier whose threshold it reaches.
 * Trees and biodiversity are scored independently, so a full score is 64.
 */
public final class ScoringTable {

    public static final int TIERS = 7;
    private static final long[] TIER_POINTS = {0, 1, 2, 4, 8, 16, 32};

    private static final long[] DEFAULT_TREE_THRESHOLDS = {0, 1, 1_000, 5_000, 10_000, 50_000, 100_000};
    private static final long[] DEFAULT_BIODIVERSITY_THRESHOLDS = {0, 1, 10, 25, 50, 100, 200};

    private final long[] treeThresholds;
    private final long[] biodiversityThresholds;

    public ScoringTable(long[] treeThresholds, long[] biodiversityThresholds) {
        this.treeThresholds = validated("trees", treeThresholds);
        this.biodiversityThresholds = validated("biodiversity", biodiversityThresholds);
    }

    public static ScoringTable defaults() {
        return new ScoringTable(DEFAULT_TREE_THRESHOLDS, DEFAULT_BIODIVERSITY_THRESHOLDS);
    }

    public long treePoints(long trees) {
        return points(treeThresholds, trees);
    }

    public long biodiversityPoints(long species) {
        return points(biodiversityThresholds, species);
    }

    /**
     * Regeneration score of one inspection.
     */
    public long score(long trees, long species) {
        return treePoints(trees) + biodiversityPoints(species);
    }

    public static long maxScore() {
        return TIER_POINTS[TIERS - 1] * 2;
    }

    public long[] treeThresholds() {
        return treeThresholds.clone();
    }

    public long[] biodiversityThresholds() {
        return biodiversityThresholds.clone();
    }

    private static long points(long[] thresholds, long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Inspection result cannot be negative: " + value);
        }
        for (int tier = TIERS - 1; tier >= 0; tier--) {
            if (value >= thresholds[tier]) {
                return TIER_POINTS[tier];
            }
        }
        return 0;
    }

    private static long[] validated(String name, long[] thresholds) {
        if (thresholds == null || thresholds.length != TIERS) {
            throw new ConfigurationException(name + " scoring table needs exactly " + TIERS + " thresholds");
        }
        if (thresholds[0] != 0) {
            throw new ConfigurationException(name + " scoring table must start at 0");
        }
        for (int i = 1; i < TIERS; i++) {
            if (thresholds[i] <= thresholds[i - 1]) {
                throw new ConfigurationException(name + " scoring thresholds must be strictly ascending");
            }
        }
        return thresholds.clone();
    }

    @Override
    public String toString() {
        return "ScoringTable{trees=" + Arrays.toString(treeThresholds)
                + ", biodiversity=" + Arrays.toString(biodiversityThresholds) + "}";
    }
}
