package io.fullerstack.ses.core.config;

import io.fullerstack.ses.core.model.ManagementStrategy;
import io.fullerstack.ses.core.model.MetricThresholds;
import io.fullerstack.ses.core.model.ReputationMetric;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed settings for one SES account monitor.
 * <p>
 * The management strategy is kept as the configured text. It is validated on every check
 * through {@link #strategy()} so an unknown value disables the checks instead of failing startup.
 *
 * @param account              identity of the monitored account
 * @param strategyName         configured management strategy, e.g. "alert" or "managed"
 * @param monitorReputation    whether the reputation check runs
 * @param monitorSendingQuota  whether the sending quota check runs
 * @param sendingQuota         sending quota utilization thresholds
 * @param reputation           reputation thresholds keyed by {@link ReputationMetric#id()}
 * @param reputationPeriod     CloudWatch aggregation period for reputation metrics
 * @param reputationLookback   how far back reputation metrics are fetched
 * @param notifyConfig         which backends hear about which signal
 * @param pagerDuty            PagerDuty settings
 * @param slack                Slack settings
 * @param httpTimeout          connect and request timeout of the notification HTTP client
 * @author Fullerstack
 */
public record MonitorSettings(
    AccountContext account,
    String strategyName,
    boolean monitorReputation,
    boolean monitorSendingQuota,
    MetricThresholds sendingQuota,
    Map<String, MetricThresholds> reputation,
    Duration reputationPeriod,
    Duration reputationLookback,
    NotifyConfig notifyConfig,
    PagerDutySettings pagerDuty,
    SlackSettings slack,
    Duration httpTimeout
) {

    public static final String DEFAULT_NAME = "ses-account-monitor";
    public static final Duration DEFAULT_REPUTATION_PERIOD = Duration.ofSeconds(900);
    public static final Duration DEFAULT_REPUTATION_LOOKBACK = Duration.ofSeconds(1800);
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(10);

    public MonitorSettings {
        Objects.requireNonNull(account, "account cannot be null");
        Objects.requireNonNull(sendingQuota, "sendingQuota cannot be null");
        Objects.requireNonNull(reputationPeriod, "reputationPeriod cannot be null");
        Objects.requireNonNull(reputationLookback, "reputationLookback cannot be null");
        Objects.requireNonNull(notifyConfig, "notifyConfig cannot be null");
        Objects.requireNonNull(pagerDuty, "pagerDuty cannot be null");
        Objects.requireNonNull(slack, "slack cannot be null");
        Objects.requireNonNull(httpTimeout, "httpTimeout cannot be null");
        reputation = Map.copyOf(Objects.requireNonNull(reputation, "reputation cannot be null"));
        for (ReputationMetric metric : ReputationMetric.values()) {
            if (!reputation.containsKey(metric.id())) {
                throw new IllegalArgumentException("Missing reputation thresholds for " + metric.id());
            }
        }
        if (reputationPeriod.isNegative() || reputationPeriod.isZero()) {
            throw new IllegalArgumentException("reputationPeriod must be positive");
        }
        if (reputationLookback.compareTo(reputationPeriod) < 0) {
            throw new IllegalArgumentException("reputationLookback must cover at least one reputationPeriod");
        }
    }

    /**
     * @return the parsed strategy, or empty when the configured value is not a known strategy
     */
    public Optional<ManagementStrategy> strategy() {
        return ManagementStrategy.parse(strategyName);
    }

    /**
     * Reads settings from configuration.
     *
     * @param config configuration to read
     * @return validated settings
     * @throws ConfigurationException if a value is malformed or inconsistent
     */
    public static MonitorSettings from(HierarchicalConfig config) {
        String accountName = config.getString("aws.account-name", "undefined");
        String region = config.getOptionalString("aws.region")
            .or(() -> config.getOptionalString("aws.default-region"))
            .orElseThrow(() -> new ConfigurationException(
                "Missing config key 'aws.region' in context: " + config.context()));
        String environment = config.getString("aws.environment", "undefined");
        String name = config.getString("monitor.name", DEFAULT_NAME);

        AccountContext account = new AccountContext(
            accountName,
            region,
            environment,
            config.getString("monitor.service-name",
                AccountContext.defaultServiceName(accountName, region, environment, name)),
            config.getString("ses.console-url", AccountContext.defaultConsoleUrl(region)),
            config.getString("ses.reputation-dashboard-url", AccountContext.defaultReputationDashboardUrl(region)));

        Map<String, MetricThresholds> reputation = new LinkedHashMap<>();
        reputation.put(ReputationMetric.BOUNCE_RATE.id(), thresholds(config, "thresholds.bounce-rate", 5, 8));
        reputation.put(ReputationMetric.COMPLAINT_RATE.id(), thresholds(config, "thresholds.complaint-rate", 0.01, 0.04));

        boolean dryRun = config.getBoolean("notify.dry-run", false);

        try {
            return builder()
                .account(account)
                .strategyName(config.getString("monitor.strategy", ManagementStrategy.ALERT.wireValue()))
                .monitorReputation(config.getBoolean("monitor.reputation.enabled", true))
                .monitorSendingQuota(config.getBoolean("monitor.sending-quota.enabled", true))
                .sendingQuota(thresholds(config, "thresholds.sending-quota", 80, 90))
                .reputation(reputation)
                .reputationPeriod(Duration.ofSeconds(config.getInt("monitor.reputation.period-seconds",
                    (int) DEFAULT_REPUTATION_PERIOD.toSeconds())))
                .reputationLookback(Duration.ofSeconds(config.getInt("monitor.reputation.lookback-seconds",
                    (int) DEFAULT_REPUTATION_LOOKBACK.toSeconds())))
                .notifyConfig(new NotifyConfig(
                    config.getBoolean("notify.pager-duty.on-reputation", false),
                    config.getBoolean("notify.pager-duty.on-sending-quota", false),
                    config.getBoolean("notify.slack.on-reputation", false),
                    config.getBoolean("notify.slack.on-sending-quota", false)))
                .pagerDuty(new PagerDutySettings(
                    config.getString("pager-duty.events-url", PagerDutySettings.DEFAULT_EVENTS_URL),
                    config.getOptionalString("pager-duty.routing-key").orElse(null),
                    dryRun || config.getBoolean("pager-duty.dry-run", false)))
                .slack(new SlackSettings(
                    config.getOptionalString("slack.webhook-url").orElse(null),
                    config.getList("slack.channels"),
                    config.getString("slack.footer-icon-url", SlackSettings.DEFAULT_FOOTER_ICON_URL),
                    config.getOptionalString("slack.icon-emoji").orElse(null),
                    dryRun || config.getBoolean("slack.dry-run", false)))
                .httpTimeout(Duration.ofSeconds(config.getInt("notify.http.timeout-seconds",
                    (int) DEFAULT_HTTP_TIMEOUT.toSeconds())))
                .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid monitor settings in context " + config.context()
                + ": " + e.getMessage(), e);
        }
    }

    private static MetricThresholds thresholds(HierarchicalConfig config, String prefix,
                                               double defaultWarning, double defaultCritical) {
        double warning = config.getDouble(prefix + ".warning-percent", defaultWarning);
        double critical = config.getDouble(prefix + ".critical-percent", defaultCritical);
        try {
            return new MetricThresholds(warning, critical);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid thresholds under '" + prefix + "': " + e.getMessage(), e);
        }
    }

    /**
     * Builder for MonitorSettings.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AccountContext account;
        private String strategyName = ManagementStrategy.ALERT.wireValue();
        private boolean monitorReputation = true;
        private boolean monitorSendingQuota = true;
        private MetricThresholds sendingQuota = new MetricThresholds(80, 90);
        private Map<String, MetricThresholds> reputation = Map.of(
            ReputationMetric.BOUNCE_RATE.id(), new MetricThresholds(5, 8),
            ReputationMetric.COMPLAINT_RATE.id(), new MetricThresholds(0.01, 0.04));
        private Duration reputationPeriod = DEFAULT_REPUTATION_PERIOD;
        private Duration reputationLookback = DEFAULT_REPUTATION_LOOKBACK;
        private NotifyConfig notifyConfig = NotifyConfig.none();
        private PagerDutySettings pagerDuty = new PagerDutySettings(PagerDutySettings.DEFAULT_EVENTS_URL, null, false);
        private SlackSettings slack = new SlackSettings(null, null, SlackSettings.DEFAULT_FOOTER_ICON_URL, null, false);
        private Duration httpTimeout = DEFAULT_HTTP_TIMEOUT;

        public Builder account(AccountContext account) {
            this.account = account;
            return this;
        }

        public Builder strategyName(String strategyName) {
            this.strategyName = strategyName;
            return this;
        }

        public Builder strategy(ManagementStrategy strategy) {
            this.strategyName = strategy.wireValue();
            return this;
        }

        public Builder monitorReputation(boolean monitorReputation) {
            this.monitorReputation = monitorReputation;
            return this;
        }

        public Builder monitorSendingQuota(boolean monitorSendingQuota) {
            this.monitorSendingQuota = monitorSendingQuota;
            return this;
        }

        public Builder sendingQuota(MetricThresholds sendingQuota) {
            this.sendingQuota = sendingQuota;
            return this;
        }

        public Builder reputation(Map<String, MetricThresholds> reputation) {
            this.reputation = reputation;
            return this;
        }

        public Builder reputationPeriod(Duration reputationPeriod) {
            this.reputationPeriod = reputationPeriod;
            return this;
        }

        public Builder reputationLookback(Duration reputationLookback) {
            this.reputationLookback = reputationLookback;
            return this;
        }

        public Builder notifyConfig(NotifyConfig notifyConfig) {
            this.notifyConfig = notifyConfig;
            return this;
        }

        public Builder pagerDuty(PagerDutySettings pagerDuty) {
            this.pagerDuty = pagerDuty;
            return this;
        }

        public Builder slack(SlackSettings slack) {
            this.slack = slack;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public MonitorSettings build() {
            if (account == null) {
                throw new IllegalArgumentException("account is required");
            }
            return new MonitorSettings(
                account,
                strategyName,
                monitorReputation,
                monitorSendingQuota,
                sendingQuota,
                reputation,
                reputationPeriod,
                reputationLookback,
                notifyConfig,
                pagerDuty,
                slack,
                httpTimeout
            );
        }
    }
}
