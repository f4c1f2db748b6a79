package com.regencredit.core.ledger;

/**
 * Token ledger rejected or failed an instruction.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
