package com.regencredit.core.config;

import com.regencredit.core.error.PreconditionViolationException;
import com.regencredit.core.error.ReasonCode;

/**
 * Size bounds of the free text and evidence hashes accepted by the protocol.
 */
public final class TextLimits {

    public static final int NAME = 100;
    public static final int TITLE = 100;
    public static final int DESCRIPTION = 500;
    public static final int HASH = 150;

    private TextLimits() {
    }

    /**
     * Rejects null, blank and oversized values.
     */
    public static String require(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new PreconditionViolationException(ReasonCode.INVALID_TEXT, field + " cannot be blank");
        }
        return bounded(field, value, maxLength);
    }

    /**
     * Rejects oversized values; null is allowed.
     */
    public static String bounded(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new PreconditionViolationException(ReasonCode.TEXT_TOO_LONG,
                    field + " exceeds " + maxLength + " characters");
        }
        return value;
    }
}
