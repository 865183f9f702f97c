package io.fullerstack.ses.core.model;

import java.util.Objects;

/**
 * Result of comparing the 24-hour sending volume against the quota.
 *
 * @param volume             messages sent in the last 24 hours
 * @param maxVolume          messages allowed per 24 hours
 * @param utilizationPercent {@code volume / maxVolume * 100}, floored at 0, may exceed 100 when over quota
 * @param status             classification against the critical then warning threshold
 * @param metricTimestamp    ISO-8601 timestamp the reading is attributed to
 */
public record QuotaVerdict(
    double volume,
    double maxVolume,
    double utilizationPercent,
    Status status,
    String metricTimestamp
) {

    public QuotaVerdict {
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(metricTimestamp, "metricTimestamp cannot be null");
    }

    /**
     * @return share of the quota still available, never below 0
     */
    public double remainingPercent() {
        return Math.max(0.0, 100.0 - utilizationPercent);
    }

    /**
     * @param percent limit as a percentage, e.g. 100 for the full quota
     * @return true when utilization has reached the limit
     */
    public boolean isOver(double percent) {
        return utilizationPercent >= percent;
    }
}
