package com.browserswarm.automation;

/**
 * Malformed envelope, unexpected status code or an error reported by the automation backend.
 */
public class AutomationProtocolException extends RuntimeException {

    public AutomationProtocolException(String message) {
        super(message);
    }

    public AutomationProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
