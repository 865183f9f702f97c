package io.fullerstack.ses.core;

/**
 * Base exception for SES account monitoring failures.
 */
public class SesMonitorException extends RuntimeException {

    public SesMonitorException(String message) {
        super(message);
    }

    public SesMonitorException(String message, Throwable cause) {
        super(message, cause);
    }
}
