package com.browserswarm.orchestration;

public class OracleFailureException extends RuntimeException {

    public OracleFailureException(String message) {
        super(message);
    }

    public OracleFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
