package io.fullerstack.ses.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * How the monitor treats the account when reputation degrades.
 * <ul>
 *   <li>{@link #ALERT}: notify only, never touch account sending</li>
 *   <li>{@link #MANAGED}: disable sending on CRITICAL, re-enable once back to WARNING or OK</li>
 * </ul>
 */
public enum ManagementStrategy {

    ALERT,
    MANAGED;

    /**
     * Parses a configured strategy name.
     *
     * @param value configured value, e.g. {@code managed}
     * @return the strategy, or empty for null and unknown values
     */
    public static Optional<ManagementStrategy> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "alert" -> Optional.of(ALERT);
            case "managed" -> Optional.of(MANAGED);
            default -> Optional.empty();
        };
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
