package com.regencredit.core.time;

/**
 * External, monotonically increasing block height signal.
 */
@FunctionalInterface
public interface BlockHeightSource {

    long currentBlock();
}
