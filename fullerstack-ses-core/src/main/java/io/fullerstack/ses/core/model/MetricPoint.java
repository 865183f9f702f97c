package io.fullerstack.ses.core.model;

import java.util.Objects;

/**
 * One reputation measurement, already compared against its thresholds.
 *
 * @param label     metric label, e.g. "Bounce Rate"
 * @param value     latest value as a percentage (0-100 scale)
 * @param threshold the threshold the value was judged against
 * @param timestamp ISO-8601 UTC timestamp of the sample
 */
public record MetricPoint(
    String label,
    double value,
    double threshold,
    String timestamp
) {

    public MetricPoint {
        Objects.requireNonNull(label, "label cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }
}
