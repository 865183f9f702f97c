package io.fullerstack.ses.core.model;

/**
 * Severity of one signal for one check cycle, ordered from least to most severe.
 */
public enum Status {

    OK("ok"),
    WARNING("warning"),
    CRITICAL("danger");

    private final String color;

    Status(String color) {
        this.color = color;
    }

    /**
     * @return the chat attachment colour for this status
     */
    public String color() {
        return color;
    }

    public boolean isAtLeast(Status other) {
        return compareTo(other) >= 0;
    }
}
