package com.regencredit.core.event;

/**
 * Domain event published by a protocol component after a state transition.
 */
public interface ProtocolEvent {

    /**
     * Block height at which the transition happened.
     */
    long blockNumber();
}
