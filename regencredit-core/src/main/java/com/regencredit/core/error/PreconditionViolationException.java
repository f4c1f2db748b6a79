package com.regencredit.core.error;

/**
 * A caller-facing rejection: the request is not valid for the current state.
 */
public class PreconditionViolationException extends ProtocolException {

    public PreconditionViolationException(ReasonCode reason, String message) {
        super(reason, message);
    }
}
