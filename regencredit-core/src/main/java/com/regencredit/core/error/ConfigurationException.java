package com.regencredit.core.error;

/**
 * Fatal wiring or configuration error detected at construction time.
 */
public class ConfigurationException extends ProtocolException {

    public ConfigurationException(String message) {
        super(ReasonCode.INVALID_CONFIGURATION, message);
    }

    public ConfigurationException(ReasonCode reason, String message) {
        super(reason, message);
    }
}
