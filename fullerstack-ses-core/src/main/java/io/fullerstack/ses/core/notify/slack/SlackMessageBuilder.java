package io.fullerstack.ses.core.notify.slack;

import io.fullerstack.ses.core.config.AccountContext;
import io.fullerstack.ses.core.config.SlackSettings;
import io.fullerstack.ses.core.model.Action;
import io.fullerstack.ses.core.model.MetricPoint;
import io.fullerstack.ses.core.model.QuotaVerdict;
import io.fullerstack.ses.core.model.Status;
import io.fullerstack.ses.core.notify.MissingRequiredFieldException;
import io.fullerstack.ses.core.notify.Percentages;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.fullerstack.ses.core.notify.MissingRequiredFieldException.require;

/**
 * Builds Slack messages for the sending quota and reputation signals.
 * <p>
 * Field layout (quota): Service, Account, Region, Environment, Status, Time, Utilization,
 * Threshold, Volume, Max Volume, Message.
 * <br>
 * Field layout (reputation): Service, Account, Region, Environment, Status, Action, then a
 * {@code "{label} / Threshold"} and {@code "{label} Time"} pair per metric, then Message.
 *
 * @author Fullerstack
 */
public class SlackMessageBuilder {

    public static final String USERNAME = "SES Account Monitor";

    private final AccountContext account;
    private final SlackSettings settings;

    public SlackMessageBuilder(AccountContext account, SlackSettings settings) {
        this.account = Objects.requireNonNull(account, "account cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
    }

    /**
     * Quota message for a WARNING or CRITICAL verdict.
     *
     * @throws IllegalArgumentException if {@code status} is OK
     */
    public SlackMessage sendingQuotaAlert(Status status, QuotaVerdict verdict, double thresholdPercent, Instant eventTime) {
        require(status, "status");
        requireAlerting(status);
        String text = "SES account sending rate has breached the " + status.name() + " threshold.";
        String fallback = "SES account sending rate has breached " + status.name() + " threshold.";
        return sendingQuota(status, verdict, thresholdPercent, eventTime, fallback, text);
    }

    public SlackMessage sendingQuotaRecovered(QuotaVerdict verdict, double thresholdPercent, Instant eventTime) {
        return sendingQuota(Status.OK, verdict, thresholdPercent, eventTime,
            "SES account sending rate has recovered.",
            "SES account sending rate status is OK.");
    }

    /**
     * Reputation message for a WARNING or CRITICAL verdict.
     *
     * @param metrics metrics to list; must not be empty
     * @throws MissingRequiredFieldException if any input is absent or {@code metrics} is empty
     * @throws IllegalArgumentException if {@code status} is OK
     */
    public SlackMessage reputationAlert(Status status, List<MetricPoint> metrics, Action action, Instant eventTime) {
        require(status, "status");
        require(metrics, "metrics");
        requireAlerting(status);
        if (metrics.isEmpty()) {
            throw new MissingRequiredFieldException("metrics");
        }
        return reputation(status, metrics, action, eventTime,
            "SES account reputation has breached " + status.name() + " threshold.",
            "SES account reputation has breached the " + status.name() + " threshold.");
    }

    public SlackMessage reputationRecovered(List<MetricPoint> metrics, Action action, Instant eventTime) {
        require(metrics, "metrics");
        return reputation(Status.OK, metrics, action, eventTime,
            "SES account reputation has recovered.",
            "SES account reputation status is OK.");
    }

    private SlackMessage sendingQuota(Status status, QuotaVerdict verdict, double thresholdPercent,
                                      Instant eventTime, String fallback, String text) {
        require(verdict, "verdict");
        require(eventTime, "eventTime");

        List<SlackField> fields = new ArrayList<>(identityFields(
            "<" + account.sesConsoleUrl() + "|SES Account Sending>", status));
        fields.add(new SlackField("Time", verdict.metricTimestamp(), null));
        fields.add(SlackField.brief("Utilization", Percentages.twoDecimals(verdict.utilizationPercent())));
        fields.add(SlackField.brief("Threshold", Percentages.twoDecimals(thresholdPercent)));
        fields.add(SlackField.brief("Volume", number(verdict.volume())));
        fields.add(SlackField.brief("Max Volume", number(verdict.maxVolume())));
        fields.add(SlackField.wide("Message", text));

        return message(fallback, status, fields, eventTime);
    }

    private SlackMessage reputation(Status status, List<MetricPoint> metrics, Action action,
                                    Instant eventTime, String fallback, String text) {
        require(action, "action");
        require(eventTime, "eventTime");

        List<SlackField> fields = new ArrayList<>(identityFields(
            "<" + account.reputationDashboardUrl() + "|SES Account Reputation>", status));
        fields.add(SlackField.brief("Action", action.name()));
        for (MetricPoint metric : metrics) {
            fields.add(SlackField.brief(metric.label() + " / Threshold",
                Percentages.twoDecimals(metric.value()) + " / " + Percentages.twoDecimals(metric.threshold())));
            fields.add(SlackField.brief(metric.label() + " Time", metric.timestamp()));
        }
        fields.add(SlackField.wide("Message", text));

        return message(fallback, status, fields, eventTime);
    }

    private List<SlackField> identityFields(String service, Status status) {
        return List.of(
            SlackField.brief("Service", service),
            SlackField.brief("Account", account.accountName()),
            SlackField.brief("Region", account.region()),
            SlackField.brief("Environment", account.environment()),
            SlackField.brief("Status", status.name()));
    }

    private SlackMessage message(String fallback, Status status, List<SlackField> fields, Instant eventTime) {
        SlackAttachment attachment = new SlackAttachment(
            fallback,
            status.color(),
            fields,
            account.serviceName(),
            settings.footerIconUrl(),
            eventTime.getEpochSecond());
        return new SlackMessage(null, List.of(attachment), settings.iconEmoji(), USERNAME);
    }

    private static void requireAlerting(Status status) {
        if (status == Status.OK) {
            throw new IllegalArgumentException("alert messages need a WARNING or CRITICAL status");
        }
    }

    // whole counts render without a fraction
    private static Object number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < Long.MAX_VALUE) {
            return (long) value;
        }
        return value;
    }
}
