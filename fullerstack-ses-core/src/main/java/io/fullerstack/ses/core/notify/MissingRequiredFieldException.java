package io.fullerstack.ses.core.notify;

import io.fullerstack.ses.core.SesMonitorException;

/**
 * Thrown by payload builders when a required input is absent, before anything is queued.
 */
public class MissingRequiredFieldException extends SesMonitorException {

    private final String field;

    public MissingRequiredFieldException(String field) {
        super("Missing required field: " + field);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    /**
     * Returns the value, or throws when it is null.
     */
    public static <T> T require(T value, String field) {
        if (value == null) {
            throw new MissingRequiredFieldException(field);
        }
        return value;
    }
}
