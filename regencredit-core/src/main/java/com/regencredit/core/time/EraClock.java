package com.regencredit.core.time;

import com.regencredit.core.error.ConfigurationException;

/**
 * Block height to era and epoch arithmetic.
 * Eras are 1-indexed windows of {@code blocksPerEra} blocks starting at the deploy block;
 * an epoch groups {@code halving} consecutive eras, after which emission halves.
 * Stateless apart from the constants fixed at construction.
 */
public final class EraClock {

    private final long deployBlock;
    private final long blocksPerEra;
    private final int halving;
    private final long precision;

    public EraClock(long deployBlock, long blocksPerEra, int halving, long precision) {
        if (blocksPerEra <= 0) {
            throw new ConfigurationException("blocksPerEra must be positive, got " + blocksPerEra);
        }
        if (halving <= 0) {
            throw new ConfigurationException("halving must be positive, got " + halving);
        }
        if (precision <= 0) {
            throw new ConfigurationException("precision must be positive, got " + precision);
        }
        this.deployBlock = deployBlock;
        this.blocksPerEra = blocksPerEra;
        this.halving = halving;
        this.precision = precision;
    }

    /**
     * Era containing the given block. Blocks before deployment count as era 1.
     */
    public int currentEra(long blockNumber) {
        if (blockNumber <= deployBlock) {
            return 1;
        }
        return Math.toIntExact((blockNumber - deployBlock) / blocksPerEra + 1);
    }

    public int epochOf(int era) {
        requireEra(era);
        return (era - 1) / halving + 1;
    }

    public int currentEpoch(long blockNumber) {
        return epochOf(currentEra(blockNumber));
    }

    /**
     * First block of the era.
     */
    public long eraStartBlock(int era) {
        requireEra(era);
        return deployBlock + (long) (era - 1) * blocksPerEra;
    }

    /**
     * First block after the era, i.e. the start of the next one.
     */
    public long eraEndBlock(int era) {
        requireEra(era);
        return deployBlock + (long) era * blocksPerEra;
    }

    /**
     * Positive while {@code targetEra} is running, zero at its closing boundary,
     * negative once it has fully elapsed.
     */
    public long blocksUntilEraEnd(int targetEra, long blockNumber) {
        return eraEndBlock(targetEra) - blockNumber;
    }

    public boolean isEraClosed(int era, long blockNumber) {
        return blocksUntilEraEnd(era, blockNumber) <= 0;
    }

    /**
     * Number of era lengths elapsed since {@code userEra} ended, scaled by the precision.
     * Zero while {@code userEra} has not ended.
     */
    public long elapsedErasSince(int userEra, long blockNumber) {
        long remaining = blocksUntilEraEnd(userEra, blockNumber);
        if (remaining > 0) {
            return 0;
        }
        return Math.multiplyExact(-remaining, precision) / blocksPerEra;
    }

    public long deployBlock() {
        return deployBlock;
    }

    public long blocksPerEra() {
        return blocksPerEra;
    }

    public int halving() {
        return halving;
    }

    public long precision() {
        return precision;
    }

    private static void requireEra(int era) {
        if (era < 1) {
            throw new IllegalArgumentException("Eras are 1-indexed, got " + era);
        }
    }
}
