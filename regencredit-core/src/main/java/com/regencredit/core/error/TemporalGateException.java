package com.regencredit.core.error;

/**
 * A cooldown, deadline or safeguard window is not satisfied yet.
 * Clients can retry from {@link #getAvailableAtBlock()}.
 */
public class TemporalGateException extends ProtocolException {

    private final long availableAtBlock;

    public TemporalGateException(ReasonCode reason, String message, long availableAtBlock) {
        super(reason, message + " (available at block " + availableAtBlock + ")");
        this.availableAtBlock = availableAtBlock;
    }

    public long getAvailableAtBlock() {
        return availableAtBlock;
    }
}
