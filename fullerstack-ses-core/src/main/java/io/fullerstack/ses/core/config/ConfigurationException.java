package io.fullerstack.ses.core.config;

import io.fullerstack.ses.core.SesMonitorException;

/**
 * Thrown when a configuration key is missing or holds a value that cannot be used.
 */
public class ConfigurationException extends SesMonitorException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
