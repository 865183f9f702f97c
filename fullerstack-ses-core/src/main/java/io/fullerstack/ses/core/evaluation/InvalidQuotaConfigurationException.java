package io.fullerstack.ses.core.evaluation;

import io.fullerstack.ses.core.SesMonitorException;

/**
 * Thrown when the sending quota cannot be evaluated, e.g. the account reports a zero 24-hour maximum.
 * <p>
 * Fatal to the quota check of the current cycle only.
 */
public class InvalidQuotaConfigurationException extends SesMonitorException {

    public InvalidQuotaConfigurationException(String message) {
        super(message);
    }
}
