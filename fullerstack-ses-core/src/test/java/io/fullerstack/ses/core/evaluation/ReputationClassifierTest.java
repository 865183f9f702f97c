package io.fullerstack.ses.core.evaluation;

import io.fullerstack.ses.core.model.MetricPoint;
import io.fullerstack.ses.core.model.MetricSeries;
import io.fullerstack.ses.core.model.MetricSeries.Sample;
import io.fullerstack.ses.core.model.MetricThresholds;
import io.fullerstack.ses.core.model.ReputationVerdict;
import io.fullerstack.ses.core.model.Status;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ReputationClassifierTest {

    private static final Instant T0 = Instant.parse("2018-06-17T02:00:00Z");
    private static final Instant T1 = Instant.parse("2018-06-17T02:15:00Z");

    private static final Map<String, MetricThresholds> THRESHOLDS = Map.of(
        "bounce_rate", new MetricThresholds(5, 8),
        "complaint_rate", new MetricThresholds(0.01, 0.04));

    private static MetricSeries bounce(Sample... samples) {
        return new MetricSeries("bounce_rate", "Bounce Rate", List.of(samples));
    }

    private static MetricSeries complaint(Sample... samples) {
        return new MetricSeries("complaint_rate", "Complaint Rate", List.of(samples));
    }

    @Test
    void shouldPlaceHealthyMetricsInOk() {
        // Given: bounce 3% and complaint 0.00001%
        List<MetricSeries> series = List.of(
            bounce(new Sample(T0, 3.0)),
            complaint(new Sample(T0, 0.00001)));

        // When
        ReputationVerdict verdict = ReputationClassifier.classify(series, THRESHOLDS);

        // Then: both OK, recorded against the warning threshold
        assertThat(verdict.critical()).isEmpty();
        assertThat(verdict.warning()).isEmpty();
        assertThat(verdict.ok()).containsExactly(
            new MetricPoint("Bounce Rate", 3.0, 5.0, "2018-06-17T02:00:00Z"),
            new MetricPoint("Complaint Rate", 0.00001, 0.01, "2018-06-17T02:00:00Z"));
        assertThat(verdict.status()).isEqualTo(Status.OK);
    }

    @Test
    void shouldTagCriticalMetricsWithCriticalThreshold() {
        // Given
        List<MetricSeries> series = List.of(
            bounce(new Sample(T0, 8.0)),
            complaint(new Sample(T0, 0.02)));

        // When
        ReputationVerdict verdict = ReputationClassifier.classify(series, THRESHOLDS);

        // Then: boundary value is critical, complaint is warning
        assertThat(verdict.critical()).extracting(MetricPoint::threshold).containsExactly(8.0);
        assertThat(verdict.warning()).extracting(MetricPoint::label).containsExactly("Complaint Rate");
        assertThat(verdict.warning()).extracting(MetricPoint::threshold).containsExactly(0.01);
        assertThat(verdict.status()).isEqualTo(Status.CRITICAL);
        assertThat(verdict.danger()).extracting(MetricPoint::label).containsExactly("Bounce Rate", "Complaint Rate");
    }

    @Test
    void shouldUseMostRecentSample() {
        // Given: samples out of order, the latest is healthy
        List<MetricSeries> series = List.of(bounce(new Sample(T1, 1.0), new Sample(T0, 9.0)));

        // When
        ReputationVerdict verdict = ReputationClassifier.classify(series, THRESHOLDS);

        // Then
        assertThat(verdict.ok()).singleElement()
            .satisfies(point -> {
                assertThat(point.value()).isEqualTo(1.0);
                assertThat(point.timestamp()).isEqualTo("2018-06-17T02:15:00Z");
            });
    }

    @Test
    void shouldPreferLaterSampleOnTimestampTie() {
        // Given
        List<MetricSeries> series = List.of(bounce(new Sample(T0, 1.0), new Sample(T0, 6.0)));

        // When
        ReputationVerdict verdict = ReputationClassifier.classify(series, THRESHOLDS);

        // Then
        assertThat(verdict.warning()).extracting(MetricPoint::value).containsExactly(6.0);
    }

    @Test
    void shouldExcludeEmptySeries() {
        // Given: no complaint data
        List<MetricSeries> series = List.of(bounce(new Sample(T0, 6.0)), complaint());

        // When
        ReputationVerdict verdict = ReputationClassifier.classify(series, THRESHOLDS);

        // Then: partition covers only metrics with data
        assertThat(verdict.size()).isEqualTo(1);
        assertThat(verdict.warning()).hasSize(1);
    }

    @Test
    void shouldReturnEmptyVerdictWhenNoData() {
        // When
        ReputationVerdict verdict = ReputationClassifier.classify(List.of(bounce(), complaint()), THRESHOLDS);

        // Then
        assertThat(verdict.isEmpty()).isTrue();
        assertThat(verdict.status()).isEqualTo(Status.OK);
    }

    @Test
    void shouldBeIdempotent() {
        // Given
        List<MetricSeries> series = List.of(bounce(new Sample(T0, 7.5)), complaint(new Sample(T1, 0.05)));

        // When / Then
        assertThat(ReputationClassifier.classify(series, THRESHOLDS))
            .isEqualTo(ReputationClassifier.classify(series, THRESHOLDS));
    }

    @Test
    void shouldNeverBeLessSevereForHigherValues() {
        // Given: increasing bounce rates
        double[] values = {0, 4.99, 5, 6, 7.99, 8, 50, 100};

        // When / Then
        Status previous = Status.OK;
        for (double value : values) {
            Status status = ReputationClassifier.classify(List.of(bounce(new Sample(T0, value))), THRESHOLDS).status();
            assertThat(status.isAtLeast(previous)).as("value %s", value).isTrue();
            previous = status;
        }
    }

    @Test
    void shouldSkipSeriesWithoutThresholds() {
        // Given: one unknown series alongside a known one
        MetricSeries unknown = new MetricSeries("reject_rate", "Reject Rate", List.of(new Sample(T0, 1.0)));

        // When
        ReputationVerdict verdict = ReputationClassifier.classify(
            List.of(unknown, bounce(new Sample(T0, 6.0))), THRESHOLDS);

        // Then: the unknown series lands in no bucket
        assertThat(verdict.critical()).isEmpty();
        assertThat(verdict.warning()).extracting(MetricPoint::label).containsExactly("Bounce Rate");
        assertThat(verdict.ok()).isEmpty();
    }

    @Test
    void shouldReturnEmptyVerdictWhenOnlyUnknownSeriesHaveData() {
        MetricSeries unknown = new MetricSeries("reject_rate", "Reject Rate", List.of(new Sample(T0, 1.0)));

        ReputationVerdict verdict = ReputationClassifier.classify(List.of(unknown), THRESHOLDS);

        assertThat(verdict.isEmpty()).isTrue();
    }
}
