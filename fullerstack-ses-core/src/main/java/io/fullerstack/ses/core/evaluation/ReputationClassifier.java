package io.fullerstack.ses.core.evaluation;

import io.fullerstack.ses.core.model.MetricPoint;
import io.fullerstack.ses.core.model.MetricSeries;
import io.fullerstack.ses.core.model.MetricThresholds;
import io.fullerstack.ses.core.model.ReputationVerdict;
import io.fullerstack.ses.core.model.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Partitions reputation metrics into CRITICAL, WARNING and OK buckets.
 * <p>
 * <b>Rules</b>:
 * <ul>
 *   <li>A series with no samples, or with no configured thresholds, is left out of every bucket</li>
 *   <li>Only the most recent sample counts</li>
 *   <li>{@code value >= critical} is CRITICAL, else {@code value >= warning} is WARNING, else OK</li>
 * </ul>
 * The recorded threshold is the critical one for CRITICAL metrics and the warning one otherwise.
 * Bucket order follows input order.
 *
 * @author Fullerstack
 */
public final class ReputationClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ReputationClassifier.class);

    private ReputationClassifier() {
    }

    /**
     * Classifies the latest sample of every series.
     *
     * @param series     raw series, one per reputation metric
     * @param thresholds thresholds keyed by series id
     * @return the verdict, empty when no series has data
     */
    public static ReputationVerdict classify(List<MetricSeries> series, Map<String, MetricThresholds> thresholds) {
        Objects.requireNonNull(series, "series cannot be null");
        Objects.requireNonNull(thresholds, "thresholds cannot be null");

        List<MetricPoint> critical = new ArrayList<>();
        List<MetricPoint> warning = new ArrayList<>();
        List<MetricPoint> ok = new ArrayList<>();

        for (MetricSeries metric : series) {
            Optional<MetricSeries.Sample> latest = metric.latest();
            if (latest.isEmpty()) {
                continue;
            }
            MetricThresholds limits = thresholds.get(metric.id());
            if (limits == null) {
                logger.warn("No thresholds configured for metric {}, skipping it", metric.id());
                continue;
            }

            double value = latest.get().value();
            String timestamp = latest.get().timestamp().toString();
            Status status = limits.classify(value);
            switch (status) {
                case CRITICAL -> critical.add(new MetricPoint(metric.label(), value, limits.critical(), timestamp));
                case WARNING -> warning.add(new MetricPoint(metric.label(), value, limits.warning(), timestamp));
                default -> ok.add(new MetricPoint(metric.label(), value, limits.warning(), timestamp));
            }
        }

        return new ReputationVerdict(critical, warning, ok);
    }
}
