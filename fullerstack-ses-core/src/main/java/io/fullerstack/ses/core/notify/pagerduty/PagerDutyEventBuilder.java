package io.fullerstack.ses.core.notify.pagerduty;

import io.fullerstack.ses.core.config.AccountContext;
import io.fullerstack.ses.core.model.Action;
import io.fullerstack.ses.core.model.MetricPoint;
import io.fullerstack.ses.core.model.QuotaVerdict;
import io.fullerstack.ses.core.notify.MissingRequiredFieldException;
import io.fullerstack.ses.core.notify.Percentages;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static io.fullerstack.ses.core.notify.MissingRequiredFieldException.require;

/**
 * Builds PagerDuty trigger and resolve events for the sending quota and reputation signals.
 * <p>
 * Both signals use a dedup key of {@code {serviceName}/{eventClass}}, shared by trigger and
 * resolve so PagerDuty closes the incident it opened.
 *
 * @author Fullerstack
 */
public class PagerDutyEventBuilder {

    public static final String SENDING_QUOTA_CLASS = "ses_account_sending_quota";
    public static final String REPUTATION_CLASS = "ses_account_reputation";
    public static final String DETAILS_VERSION = "v1.2018.06.18";

    static final String SENDING_QUOTA_SUMMARY = "SES account sending quota is at capacity.";
    static final String REPUTATION_SUMMARY = "SES account reputation is at dangerous levels.";
    static final String CLIENT = "AWS Console";

    private final AccountContext account;
    private final String routingKey;

    /**
     * @param account    identity of the monitored account
     * @param routingKey PagerDuty integration key, may be null in dry-run setups
     */
    public PagerDutyEventBuilder(AccountContext account, String routingKey) {
        this.account = Objects.requireNonNull(account, "account cannot be null");
        this.routingKey = routingKey;
    }

    public PagerDutyEvent sendingQuotaTrigger(QuotaVerdict verdict, double thresholdPercent, Instant eventTime) {
        require(verdict, "verdict");
        require(eventTime, "eventTime");

        Map<String, Object> details = identityDetails();
        details.put("volume", verdict.volume());
        details.put("max_volume", verdict.maxVolume());
        details.put("utilization", Percentages.whole(verdict.utilizationPercent()));
        details.put("threshold", Percentages.whole(thresholdPercent));
        details.put("ts", String.valueOf(eventTime.getEpochSecond()));
        details.put("version", DETAILS_VERSION);

        return trigger(SENDING_QUOTA_SUMMARY, SENDING_QUOTA_CLASS, eventTime, details);
    }

    public PagerDutyEvent sendingQuotaResolve() {
        return PagerDutyEvent.resolve(routingKey, dedupKey(SENDING_QUOTA_CLASS));
    }

    /**
     * Builds a reputation trigger.
     *
     * @param metrics   metrics in danger, critical first; must not be empty
     * @param action    what the monitor did about the account
     * @param eventTime time of the check
     * @return trigger event
     * @throws MissingRequiredFieldException if any input is absent or {@code metrics} is empty
     */
    public PagerDutyEvent reputationTrigger(List<MetricPoint> metrics, Action action, Instant eventTime) {
        require(metrics, "metrics");
        require(action, "action");
        require(eventTime, "eventTime");
        if (metrics.isEmpty()) {
            throw new MissingRequiredFieldException("metrics");
        }

        Map<String, Object> details = identityDetails();
        details.put("ts", String.valueOf(eventTime.getEpochSecond()));
        details.put("version", DETAILS_VERSION);
        details.put("action", action.wireValue());
        details.put("action_message", actionMessage(action));
        for (MetricPoint metric : metrics) {
            String name = metric.label().replace(' ', '_').toLowerCase(Locale.ROOT);
            details.put(name, Percentages.twoDecimals(metric.value()));
            details.put(name + "_threshold", Percentages.twoDecimals(metric.threshold()));
            details.put(name + "_timestamp", metric.timestamp());
        }

        return trigger(REPUTATION_SUMMARY, REPUTATION_CLASS, eventTime, details);
    }

    public PagerDutyEvent reputationResolve() {
        return PagerDutyEvent.resolve(routingKey, dedupKey(REPUTATION_CLASS));
    }

    public String dedupKey(String eventClass) {
        return account.serviceName() + "/" + eventClass;
    }

    static String actionMessage(Action action) {
        return switch (action) {
            case DISABLE -> "SES account sending is disabled.";
            case ENABLE -> "SES account sending is enabled.";
            case ALERT -> "SES account is in danger of being suspended.";
        };
    }

    private PagerDutyEvent trigger(String summary, String eventClass, Instant eventTime, Map<String, Object> details) {
        PagerDutyPayload payload = new PagerDutyPayload(
            summary,
            eventTime.toString(),
            account.serviceName(),
            "critical",
            "ses",
            account.group(),
            eventClass,
            details);
        return new PagerDutyEvent(routingKey, dedupKey(eventClass), PagerDutyEvent.TRIGGER, payload,
            CLIENT, account.sesConsoleUrl());
    }

    private Map<String, Object> identityDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("aws_account_name", account.accountName());
        details.put("aws_region", account.region());
        details.put("aws_environment", account.environment());
        return details;
    }
}
