package com.regencredit.core.time;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Block height driven by the caller. Used when no chain is attached and in tests.
 */
public class ManualBlockHeight implements BlockHeightSource {

    private final AtomicLong height;

    public ManualBlockHeight() {
        this(0);
    }

    public ManualBlockHeight(long initialHeight) {
        if (initialHeight < 0) {
            throw new IllegalArgumentException("Block height cannot be negative");
        }
        this.height = new AtomicLong(initialHeight);
    }

    @Override
    public long currentBlock() {
        return height.get();
    }

    /**
     * Moves the height forward.
     *
     * @return the new height
     */
    public long advance(long blocks) {
        if (blocks < 0) {
            throw new IllegalArgumentException("Block height only moves forward");
        }
        return height.addAndGet(blocks);
    }

    /**
     * Jumps to an absolute height that is not lower than the current one.
     */
    public void set(long blockNumber) {
        height.getAndUpdate(current -> {
            if (blockNumber < current) {
                throw new IllegalArgumentException("Block height only moves forward: " + blockNumber + " < " + current);
            }
            return blockNumber;
        });
    }
}
