package com.regencredit.core.time;

import com.regencredit.core.error.ReasonCode;
import com.regencredit.core.error.TemporalGateException;

import java.util.Objects;

/**
 * The closing blocks of every era, during which nothing new may enter review.
 * Gives the community time to validate everything submitted before the era becomes final.
 */
public class SafeguardWindow {

    private final EraClock clock;
    private final long windowBlocks;

    public SafeguardWindow(EraClock clock, long windowBlocks) {
        this.clock = Objects.requireNonNull(clock, "Era clock cannot be null");
        if (windowBlocks < 0 || windowBlocks >= clock.blocksPerEra()) {
            throw new IllegalArgumentException("Safeguard window must be within [0, blocksPerEra)");
        }
        this.windowBlocks = windowBlocks;
    }

    public boolean isActive(long blockNumber) {
        int era = clock.currentEra(blockNumber);
        return clock.blocksUntilEraEnd(era, blockNumber) <= windowBlocks;
    }

    /**
     * @throws TemporalGateException while the window is active; retry from the next era
     */
    public void requireOpen(long blockNumber, String action) {
        if (isActive(blockNumber)) {
            int era = clock.currentEra(blockNumber);
            throw new TemporalGateException(ReasonCode.SAFEGUARD_WINDOW,
                    action + " is blocked at the end of era " + era, clock.eraEndBlock(era));
        }
    }

    public long windowBlocks() {
        return windowBlocks;
    }
}
