package io.fullerstack.ses.core.notify.pagerduty;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fullerstack.ses.core.config.AccountContext;
import io.fullerstack.ses.core.evaluation.QuotaEvaluator;
import io.fullerstack.ses.core.model.Action;
import io.fullerstack.ses.core.model.MetricPoint;
import io.fullerstack.ses.core.model.QuotaVerdict;
import io.fullerstack.ses.core.notify.MissingRequiredFieldException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PagerDutyEventBuilderTest {

    private static final Instant EVENT_TIME = Instant.parse("2018-06-17T02:00:00Z");
    private static final String SERVICE = "supercoolco-us-west-2-prod-ses-account-monitor";

    private PagerDutyEventBuilder builder;

    @BeforeEach
    void setUp() {
        AccountContext account = AccountContext.of("supercoolco", "us-west-2", "prod", "ses-account-monitor");
        builder = new PagerDutyEventBuilder(account, "routing-key-123");
    }

    @Test
    void shouldBuildSendingQuotaTrigger() {
        // Given: 150% utilization
        QuotaVerdict verdict = QuotaEvaluator.evaluate(15, 10, 80, 90, EVENT_TIME.toString());

        // When
        PagerDutyEvent event = builder.sendingQuotaTrigger(verdict, 90, EVENT_TIME);

        // Then
        assertThat(event.routingKey()).isEqualTo("routing-key-123");
        assertThat(event.dedupKey()).isEqualTo(SERVICE + "/ses_account_sending_quota");
        assertThat(event.eventAction()).isEqualTo("trigger");
        assertThat(event.client()).isEqualTo("AWS Console");
        assertThat(event.clientUrl()).isEqualTo("https://us-west-2.console.aws.amazon.com/ses/home?region=us-west-2#dashboard:");

        PagerDutyPayload payload = event.payload();
        assertThat(payload.summary()).isEqualTo("SES account sending quota is at capacity.");
        assertThat(payload.timestamp()).isEqualTo("2018-06-17T02:00:00Z");
        assertThat(payload.source()).isEqualTo(SERVICE);
        assertThat(payload.severity()).isEqualTo("critical");
        assertThat(payload.component()).isEqualTo("ses");
        assertThat(payload.group()).isEqualTo("aws-supercoolco");
        assertThat(payload.eventClass()).isEqualTo("ses_account_sending_quota");
        assertThat(payload.customDetails())
            .containsEntry("aws_account_name", "supercoolco")
            .containsEntry("aws_region", "us-west-2")
            .containsEntry("aws_environment", "prod")
            .containsEntry("volume", 15.0)
            .containsEntry("max_volume", 10.0)
            .containsEntry("utilization", "150%")
            .containsEntry("threshold", "90%")
            .containsEntry("ts", "1529200800")
            .containsEntry("version", "v1.2018.06.18");
    }

    @Test
    void shouldShareDedupKeyBetweenTriggerAndResolve() {
        // Given
        QuotaVerdict verdict = QuotaEvaluator.evaluate(15, 10, 80, 90, EVENT_TIME.toString());
        List<MetricPoint> metrics = List.of(new MetricPoint("Bounce Rate", 9, 8, "2018-06-17T01:45:00Z"));

        // When / Then
        assertThat(builder.sendingQuotaTrigger(verdict, 90, EVENT_TIME).dedupKey())
            .isEqualTo(builder.sendingQuotaResolve().dedupKey());
        assertThat(builder.reputationTrigger(metrics, Action.ALERT, EVENT_TIME).dedupKey())
            .isEqualTo(builder.reputationResolve().dedupKey())
            .isEqualTo(SERVICE + "/ses_account_reputation");
    }

    @Test
    void shouldBuildResolveWithoutPayload() {
        // When
        PagerDutyEvent event = builder.reputationResolve();

        // Then
        assertThat(event.eventAction()).isEqualTo("resolve");
        assertThat(event.payload()).isNull();
        assertThat(event.client()).isNull();
        assertThat(event.identifier()).isEqualTo("resolve::" + SERVICE + "/ses_account_reputation");
    }

    @Test
    void shouldBuildReputationTriggerWithMetricDetails() {
        // Given
        List<MetricPoint> metrics = List.of(
            new MetricPoint("Bounce Rate", 9.0, 8.0, "2018-06-17T01:45:00Z"),
            new MetricPoint("Complaint Rate", 0.02, 0.01, "2018-06-17T01:45:00Z"));

        // When
        PagerDutyEvent event = builder.reputationTrigger(metrics, Action.DISABLE, EVENT_TIME);

        // Then
        assertThat(event.payload().summary()).isEqualTo("SES account reputation is at dangerous levels.");
        assertThat(event.payload().customDetails())
            .containsEntry("action", "disable")
            .containsEntry("action_message", "SES account sending is disabled.")
            .containsEntry("bounce_rate", "9.00%")
            .containsEntry("bounce_rate_threshold", "8.00%")
            .containsEntry("bounce_rate_timestamp", "2018-06-17T01:45:00Z")
            .containsEntry("complaint_rate", "0.02%")
            .containsEntry("complaint_rate_threshold", "0.01%");
    }

    @Test
    void shouldDescribeEachAction() {
        assertThat(PagerDutyEventBuilder.actionMessage(Action.ALERT))
            .isEqualTo("SES account is in danger of being suspended.");
        assertThat(PagerDutyEventBuilder.actionMessage(Action.ENABLE))
            .isEqualTo("SES account sending is enabled.");
    }

    @Test
    void shouldRefuseReputationTriggerWithoutMetrics() {
        assertThatThrownBy(() -> builder.reputationTrigger(List.of(), Action.ALERT, EVENT_TIME))
            .isInstanceOf(MissingRequiredFieldException.class)
            .hasMessageContaining("metrics");
    }

    @Test
    void shouldRefuseQuotaTriggerWithoutVerdict() {
        assertThatThrownBy(() -> builder.sendingQuotaTrigger(null, 90, EVENT_TIME))
            .isInstanceOf(MissingRequiredFieldException.class)
            .extracting(e -> ((MissingRequiredFieldException) e).getField())
            .isEqualTo("verdict");
    }

    @Test
    void shouldSerialiseWireShape() throws Exception {
        // Given
        QuotaVerdict verdict = QuotaEvaluator.evaluate(15, 10, 80, 90, EVENT_TIME.toString());
        ObjectMapper mapper = new ObjectMapper();

        // When
        JsonNode trigger = mapper.valueToTree(builder.sendingQuotaTrigger(verdict, 90, EVENT_TIME));
        JsonNode resolve = mapper.valueToTree(builder.sendingQuotaResolve());

        // Then: snake_case names, resolve carries only three fields
        assertThat(trigger.get("routing_key").asText()).isEqualTo("routing-key-123");
        assertThat(trigger.get("event_action").asText()).isEqualTo("trigger");
        assertThat(trigger.get("client_url").asText()).startsWith("https://us-west-2.console.aws.amazon.com");
        assertThat(trigger.get("payload").get("class").asText()).isEqualTo("ses_account_sending_quota");
        assertThat(trigger.get("payload").get("custom_details").get("utilization").asText()).isEqualTo("150%");
        assertThat(trigger.has("trigger")).isFalse();
        assertThat(resolve.size()).isEqualTo(3);
        assertThat(resolve.has("payload")).isFalse();
    }
}
