package io.fullerstack.ses.core.evaluation;

import io.fullerstack.ses.core.model.MetricThresholds;
import io.fullerstack.ses.core.model.QuotaVerdict;
import io.fullerstack.ses.core.model.Status;

import java.util.Objects;

/**
 * Maps 24-hour sending volume to a utilization percentage and a {@link Status}.
 * <p>
 * Utilization is {@code volume / maxVolume * 100}. It is floored at 0 and left unbounded above,
 * so an account over its quota reports more than 100. Boundaries are inclusive and the critical
 * threshold is checked before the warning threshold.
 *
 * @author Fullerstack
 */
public final class QuotaEvaluator {

    private QuotaEvaluator() {
    }

    /**
     * Evaluates sending volume against the quota.
     *
     * @param volume          messages sent in the last 24 hours
     * @param maxVolume       messages allowed per 24 hours, must be positive
     * @param warningPercent  warning threshold (0-100 scale)
     * @param criticalPercent critical threshold (0-100 scale)
     * @param metricTimestamp ISO-8601 timestamp the reading is attributed to
     * @return the verdict
     * @throws InvalidQuotaConfigurationException if {@code maxVolume} is not a positive number
     */
    public static QuotaVerdict evaluate(double volume, double maxVolume,
                                        double warningPercent, double criticalPercent,
                                        String metricTimestamp) {
        Objects.requireNonNull(metricTimestamp, "metricTimestamp cannot be null");
        if (Double.isNaN(maxVolume) || maxVolume <= 0) {
            throw new InvalidQuotaConfigurationException(
                "Sending quota max volume must be positive, got " + maxVolume);
        }

        double utilization = Math.max(0.0, volume / maxVolume * 100.0);
        Status status = new MetricThresholds(warningPercent, criticalPercent).classify(utilization);
        return new QuotaVerdict(volume, maxVolume, utilization, status, metricTimestamp);
    }
}
