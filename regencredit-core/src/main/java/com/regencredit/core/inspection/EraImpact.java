package com.regencredit.core.inspection;

/**
 * Regeneration impact recorded by the inspections realized in one era.
 */
public record EraImpact(
        int era,
        long trees,
        long biodiversity,
        long realizedInspections
) {
    static EraImpact empty(int era) {
        return new EraImpact(era, 0, 0, 0);
    }

    EraImpact plus(long trees, long biodiversity) {
        return new EraImpact(era, this.trees + trees, this.biodiversity + biodiversity, realizedInspections + 1);
    }

    EraImpact minus(long trees, long biodiversity) {
        return new EraImpact(era, this.trees - trees, this.biodiversity - biodiversity, realizedInspections - 1);
    }
}
