package io.fullerstack.ses.core.evaluation;

import io.fullerstack.ses.core.model.QuotaVerdict;
import io.fullerstack.ses.core.model.Status;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class QuotaEvaluatorTest {

    private static final String TS = "2018-06-17T02:00:00Z";

    @Test
    void shouldClassifyOverQuotaAsCritical() {
        // When
        QuotaVerdict verdict = QuotaEvaluator.evaluate(15, 10, 80, 90, TS);

        // Then: utilization is not capped at 100
        assertThat(verdict.status()).isEqualTo(Status.CRITICAL);
        assertThat(verdict.utilizationPercent()).isEqualTo(150.0);
        assertThat(verdict.remainingPercent()).isZero();
        assertThat(verdict.isOver(100)).isTrue();
    }

    @Test
    void shouldTreatCriticalBoundaryAsInclusive() {
        // When
        QuotaVerdict verdict = QuotaEvaluator.evaluate(9, 10, 80, 90, TS);

        // Then
        assertThat(verdict.status()).isEqualTo(Status.CRITICAL);
    }

    @Test
    void shouldTreatWarningBoundaryAsInclusive() {
        // When
        QuotaVerdict verdict = QuotaEvaluator.evaluate(8, 10, 80, 90, TS);

        // Then
        assertThat(verdict.status()).isEqualTo(Status.WARNING);
        assertThat(verdict.remainingPercent()).isEqualTo(20.0);
    }

    @Test
    void shouldClassifyLowUsageAsOk() {
        // When
        QuotaVerdict verdict = QuotaEvaluator.evaluate(100, 50000, 80, 90, TS);

        // Then
        assertThat(verdict.status()).isEqualTo(Status.OK);
        assertThat(verdict.utilizationPercent()).isCloseTo(0.2, within(1e-9));
        assertThat(verdict.metricTimestamp()).isEqualTo(TS);
    }

    @Test
    void shouldClampNegativeUtilization() {
        // When
        QuotaVerdict verdict = QuotaEvaluator.evaluate(-5, 10, 80, 90, TS);

        // Then
        assertThat(verdict.utilizationPercent()).isZero();
        assertThat(verdict.status()).isEqualTo(Status.OK);
    }

    @Test
    void shouldRejectZeroMaxVolume() {
        assertThatThrownBy(() -> QuotaEvaluator.evaluate(5, 0, 80, 90, TS))
            .isInstanceOf(InvalidQuotaConfigurationException.class)
            .hasMessageContaining("must be positive");
    }

    @Test
    void shouldRejectNaNMaxVolume() {
        assertThatThrownBy(() -> QuotaEvaluator.evaluate(5, Double.NaN, 80, 90, TS))
            .isInstanceOf(InvalidQuotaConfigurationException.class);
    }
}
