package io.fullerstack.ses.core.model;

/**
 * The reputation metrics SES publishes to CloudWatch under {@code AWS/SES}.
 */
public enum ReputationMetric {

    BOUNCE_RATE("bounce_rate", "Bounce Rate", "Reputation.BounceRate"),
    COMPLAINT_RATE("complaint_rate", "Complaint Rate", "Reputation.ComplaintRate");

    private final String id;
    private final String label;
    private final String metricName;

    ReputationMetric(String id, String label, String metricName) {
        this.id = id;
        this.label = label;
        this.metricName = metricName;
    }

    /** Query id, also the key of the threshold map. */
    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    /** CloudWatch metric name. */
    public String metricName() {
        return metricName;
    }
}
