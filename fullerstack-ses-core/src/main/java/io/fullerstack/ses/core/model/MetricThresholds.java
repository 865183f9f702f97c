package io.fullerstack.ses.core.model;

/**
 * Warning and critical thresholds for one metric, as percentages (0-100 scale).
 *
 * @param warning  lower bound of the WARNING band (inclusive)
 * @param critical lower bound of the CRITICAL band (inclusive)
 */
public record MetricThresholds(double warning, double critical) {

    public MetricThresholds {
        if (Double.isNaN(warning) || Double.isNaN(critical)) {
            throw new IllegalArgumentException("thresholds cannot be NaN");
        }
        if (warning > critical) {
            throw new IllegalArgumentException(
                "warning threshold " + warning + " exceeds critical threshold " + critical);
        }
    }

    /**
     * Classifies a value, checking the critical band first.
     */
    public Status classify(double value) {
        if (value >= critical) {
            return Status.CRITICAL;
        }
        if (value >= warning) {
            return Status.WARNING;
        }
        return Status.OK;
    }
}
