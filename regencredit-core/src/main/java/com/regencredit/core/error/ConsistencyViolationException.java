package com.regencredit.core.error;

/**
 * Internal bookkeeping would become inconsistent. Indicates a programming error;
 * values are never clamped to hide it.
 */
public class ConsistencyViolationException extends ProtocolException {

    public ConsistencyViolationException(ReasonCode reason, String message) {
        super(reason, message);
    }
}
