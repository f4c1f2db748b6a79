package com.regencredit.core.error;

import java.util.Objects;

/**
 * Base type of every failure raised by the protocol core.
 * A call that throws leaves the protocol state untouched.
 */
public abstract class ProtocolException extends RuntimeException {

    private final ReasonCode reason;

    protected ProtocolException(ReasonCode reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
    }

    protected ProtocolException(ReasonCode reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
    }

    public ReasonCode getReason() {
        return reason;
    }
}
