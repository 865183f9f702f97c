package io.fullerstack.ses.core.monitor;

import io.fullerstack.ses.core.model.MetricSeries;
import io.fullerstack.ses.core.model.SendingStats;

import java.time.Instant;
import java.util.List;

/**
 * Read-only source of account sending and reputation metrics.
 *
 * @see io.fullerstack.ses.core.model.ReputationMetric
 */
public interface MetricsSource {

    /**
     * @return the account's rolling 24-hour sending counters
     */
    SendingStats getSendingStats();

    /**
     * Fetches one series per reputation metric over a window.
     *
     * @param start         window start, inclusive
     * @param end           window end, exclusive
     * @param periodSeconds aggregation period
     * @return one series per reputation metric, values on the 0-100 scale; a series may be empty
     */
    List<MetricSeries> getReputationMetrics(Instant start, Instant end, int periodSeconds);
}
