package com.browserswarm.automation;

public class SessionExpiredException extends AutomationProtocolException {

    public SessionExpiredException(String message) {
        super(message);
    }

    public SessionExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
