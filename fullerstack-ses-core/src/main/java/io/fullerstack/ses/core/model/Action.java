package io.fullerstack.ses.core.model;

import java.util.Locale;

/**
 * What the monitor did about the account in response to a reputation verdict.
 */
public enum Action {

    ALERT,
    ENABLE,
    DISABLE;

    /**
     * @return lower-case value used in payloads, e.g. {@code disable}
     */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
