package io.fullerstack.ses.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw time series for one reputation metric over the lookback window.
 *
 * @param id      metric id, matching a key of the reputation threshold map
 * @param label   display label
 * @param samples data points in source order, possibly empty
 */
public record MetricSeries(
    String id,
    String label,
    List<Sample> samples
) {

    public MetricSeries {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(label, "label cannot be null");
        samples = samples == null ? List.of() : List.copyOf(samples);
    }

    /**
     * Returns the most recent sample. On equal timestamps the one appearing later in the series wins.
     *
     * @return latest sample, or empty when the series has no data
     */
    public Optional<Sample> latest() {
        Sample latest = null;
        for (Sample sample : samples) {
            if (latest == null || !sample.timestamp().isBefore(latest.timestamp())) {
                latest = sample;
            }
        }
        return Optional.ofNullable(latest);
    }

    /**
     * A single data point.
     *
     * @param timestamp when the value was measured
     * @param value     measured value as a percentage (0-100 scale)
     */
    public record Sample(Instant timestamp, double value) {

        public Sample {
            Objects.requireNonNull(timestamp, "timestamp cannot be null");
        }
    }
}
