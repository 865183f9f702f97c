package io.fullerstack.ses.core.monitor;

import io.fullerstack.ses.core.config.MonitorSettings;
import io.fullerstack.ses.core.config.NotifyConfig;
import io.fullerstack.ses.core.evaluation.InvalidQuotaConfigurationException;
import io.fullerstack.ses.core.evaluation.QuotaEvaluator;
import io.fullerstack.ses.core.evaluation.ReputationClassifier;
import io.fullerstack.ses.core.model.Action;
import io.fullerstack.ses.core.model.ManagementStrategy;
import io.fullerstack.ses.core.model.MetricPoint;
import io.fullerstack.ses.core.model.MetricSeries;
import io.fullerstack.ses.core.model.MetricThresholds;
import io.fullerstack.ses.core.model.QuotaVerdict;
import io.fullerstack.ses.core.model.ReputationVerdict;
import io.fullerstack.ses.core.model.SendingStats;
import io.fullerstack.ses.core.notify.NotificationBackend;
import io.fullerstack.ses.core.notify.NotificationQueue;
import io.fullerstack.ses.core.notify.Percentages;
import io.fullerstack.ses.core.notify.delivery.DeliveryOutcome;
import io.fullerstack.ses.core.notify.delivery.DeliveryReport;
import io.fullerstack.ses.core.notify.pagerduty.PagerDutyDispatcher;
import io.fullerstack.ses.core.notify.pagerduty.PagerDutyEvent;
import io.fullerstack.ses.core.notify.pagerduty.PagerDutyEventBuilder;
import io.fullerstack.ses.core.notify.slack.SlackDispatcher;
import io.fullerstack.ses.core.notify.slack.SlackMessage;
import io.fullerstack.ses.core.notify.slack.SlackMessageBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks an SES account's sending quota and reputation and queues the resulting notifications.
 * <p>
 * <b>Cycle</b>: {@link #handleSendingQuota()} and {@link #handleReputation()} evaluate fresh metrics,
 * apply the management strategy and fill one queue per backend. They return what is queued without
 * sending it. {@link #sendNotifications(boolean)} drains both queues, PagerDuty first.
 * <p>
 * <b>Sending quota</b>:
 * <ul>
 *   <li>CRITICAL: PagerDuty trigger, Slack CRITICAL message</li>
 *   <li>WARNING: PagerDuty resolve, Slack WARNING message</li>
 *   <li>OK: PagerDuty resolve</li>
 * </ul>
 * <b>Reputation</b>:
 * <ul>
 *   <li>CRITICAL: under {@code managed}, disable sending if enabled; PagerDuty trigger and Slack
 *       CRITICAL message listing critical then warning metrics</li>
 *   <li>WARNING: under {@code managed}, enable sending if disabled; Slack WARNING message</li>
 *   <li>OK: under {@code managed}, enable sending if disabled and post a Slack recovery message</li>
 * </ul>
 * Each signal is only sent to the backends its {@link NotifyConfig} flag allows. A check whose
 * monitoring flag is off, or whose configured strategy is unknown, does nothing at all.
 * <p>
 * Not thread-safe: run one cycle at a time.
 *
 * @author Fullerstack
 */
public class SesAccountMonitor {

    private static final Logger logger = LoggerFactory.getLogger(SesAccountMonitor.class);

    private final MonitorSettings settings;
    private final MetricsSource metricsSource;
    private final AccountControl accountControl;
    private final PagerDutyEventBuilder pagerDutyEvents;
    private final SlackMessageBuilder slackMessages;
    private final PagerDutyDispatcher pagerDutyDispatcher;
    private final SlackDispatcher slackDispatcher;
    private final Clock clock;

    private final NotificationQueue<PagerDutyEvent> pagerDutyQueue = new NotificationQueue<>();
    private final NotificationQueue<SlackMessage> slackQueue = new NotificationQueue<>();
    private NotificationResponses lastResponses = NotificationResponses.none();

    private SesAccountMonitor(Builder builder) {
        this.settings = builder.settings;
        this.metricsSource = builder.metricsSource;
        this.accountControl = builder.accountControl;
        this.pagerDutyDispatcher = builder.pagerDutyDispatcher;
        this.slackDispatcher = builder.slackDispatcher;
        this.clock = builder.clock;
        this.pagerDutyEvents = new PagerDutyEventBuilder(settings.account(), settings.pagerDuty().routingKey());
        this.slackMessages = new SlackMessageBuilder(settings.account(), settings.slack());
    }

    // =========================================================================
    // Sending quota
    // =========================================================================

    public PendingNotifications handleSendingQuota() {
        return handleSendingQuota(now());
    }

    /**
     * Evaluates the sending quota as of the given time and queues notifications.
     *
     * @param eventTime time the check is attributed to
     * @return contents of both queues
     * @throws InvalidQuotaConfigurationException if the account reports a non-positive quota; nothing is queued
     */
    public PendingNotifications handleSendingQuota(Instant eventTime) {
        Objects.requireNonNull(eventTime, "eventTime cannot be null");
        if (!settings.monitorSendingQuota()) {
            logger.debug("Sending quota monitoring is disabled, skipping");
            return PendingNotifications.empty();
        }
        if (activeStrategy().isEmpty()) {
            return PendingNotifications.empty();
        }

        SendingStats stats = metricsSource.getSendingStats();
        MetricThresholds thresholds = settings.sendingQuota();
        QuotaVerdict verdict = QuotaEvaluator.evaluate(
            stats.sentLast24Hours(),
            stats.max24HourSend(),
            thresholds.warning(),
            thresholds.critical(),
            eventTime.toString());
        logger.info("Sending quota utilization {} of {} is {}",
            Percentages.twoDecimals(verdict.utilizationPercent()), (long) verdict.maxVolume(), verdict.status());

        NotifyConfig notify = settings.notifyConfig();
        switch (verdict.status()) {
            case CRITICAL -> {
                if (notify.pagerDutyOnSendingQuota()) {
                    pagerDutyQueue.enqueue(pagerDutyEvents.sendingQuotaTrigger(verdict, thresholds.critical(), eventTime));
                }
                if (notify.slackOnSendingQuota()) {
                    slackQueue.enqueue(slackMessages.sendingQuotaAlert(
                        verdict.status(), verdict, thresholds.critical(), eventTime));
                }
            }
            case WARNING -> {
                if (notify.pagerDutyOnSendingQuota()) {
                    pagerDutyQueue.enqueue(pagerDutyEvents.sendingQuotaResolve());
                }
                if (notify.slackOnSendingQuota()) {
                    slackQueue.enqueue(slackMessages.sendingQuotaAlert(
                        verdict.status(), verdict, thresholds.warning(), eventTime));
                }
            }
            case OK -> {
                if (notify.pagerDutyOnSendingQuota()) {
                    pagerDutyQueue.enqueue(pagerDutyEvents.sendingQuotaResolve());
                }
            }
        }
        return pendingNotifications();
    }

    // =========================================================================
    // Reputation
    // =========================================================================

    public PendingNotifications handleReputation() {
        return handleReputation(now());
    }

    /**
     * Evaluates reputation metrics over the lookback window ending at the given time,
     * applies the management strategy and queues notifications.
     *
     * @param eventTime end of the metric window, also the time the check is attributed to
     * @return contents of both queues
     */
    public PendingNotifications handleReputation(Instant eventTime) {
        Objects.requireNonNull(eventTime, "eventTime cannot be null");
        if (!settings.monitorReputation()) {
            logger.debug("Reputation monitoring is disabled, skipping");
            return PendingNotifications.empty();
        }
        Optional<ManagementStrategy> strategy = activeStrategy();
        if (strategy.isEmpty()) {
            return PendingNotifications.empty();
        }

        Instant start = eventTime.minus(settings.reputationLookback());
        List<MetricSeries> series = metricsSource.getReputationMetrics(
            start, eventTime, (int) settings.reputationPeriod().toSeconds());
        ReputationVerdict verdict = ReputationClassifier.classify(series, settings.reputation());

        if (verdict.isEmpty()) {
            logger.info("No reputation data between {} and {}, nothing to evaluate", start, eventTime);
            return pendingNotifications();
        }
        logger.info("Reputation is {} (critical={}, warning={}, ok={})",
            verdict.status(), verdict.critical().size(), verdict.warning().size(), verdict.ok().size());

        boolean managed = strategy.get() == ManagementStrategy.MANAGED;
        switch (verdict.status()) {
            case CRITICAL -> reputationCritical(verdict, managed, eventTime);
            case WARNING -> reputationWarning(verdict, managed, eventTime);
            case OK -> reputationOk(verdict, managed, eventTime);
        }
        return pendingNotifications();
    }

    private void reputationCritical(ReputationVerdict verdict, boolean managed, Instant eventTime) {
        List<MetricPoint> danger = verdict.danger();
        Action action = Action.ALERT;
        if (managed) {
            if (accountControl.isSendingEnabled()) {
                logger.warn("Reputation is CRITICAL, disabling account sending");
                accountControl.disableSending();
            } else {
                logger.info("Reputation is CRITICAL, account sending is already disabled");
            }
            action = Action.DISABLE;
        }

        NotifyConfig notify = settings.notifyConfig();
        if (notify.pagerDutyOnReputation()) {
            pagerDutyQueue.enqueue(pagerDutyEvents.reputationTrigger(danger, action, eventTime));
        }
        if (notify.slackOnReputation()) {
            slackQueue.enqueue(slackMessages.reputationAlert(verdict.status(), danger, action, eventTime));
        }
    }

    private void reputationWarning(ReputationVerdict verdict, boolean managed, Instant eventTime) {
        Action action = Action.ALERT;
        if (managed && enableIfDisabled()) {
            action = Action.ENABLE;
        }
        if (settings.notifyConfig().slackOnReputation()) {
            slackQueue.enqueue(slackMessages.reputationAlert(verdict.status(), verdict.warning(), action, eventTime));
        }
    }

    private void reputationOk(ReputationVerdict verdict, boolean managed, Instant eventTime) {
        if (!managed || !enableIfDisabled()) {
            return;
        }
        if (settings.notifyConfig().slackOnReputation()) {
            slackQueue.enqueue(slackMessages.reputationRecovered(verdict.ok(), Action.ENABLE, eventTime));
        }
    }

    /**
     * @return true when sending was disabled and has now been enabled
     */
    private boolean enableIfDisabled() {
        if (accountControl.isSendingEnabled()) {
            return false;
        }
        logger.info("Account sending is disabled and reputation has recovered, enabling account sending");
        accountControl.enableSending();
        return true;
    }

    // =========================================================================
    // Delivery
    // =========================================================================

    /**
     * Drains both queues, PagerDuty first, using each dispatcher's dry-run default.
     *
     * @param raiseOnErrors when true, fail on the first live outcome that errored or returned 400-500
     * @return reports of both backends, also available through {@link #lastResponses()}
     * @throws NotificationFailureException if {@code raiseOnErrors} and a live delivery failed
     */
    public NotificationResponses sendNotifications(boolean raiseOnErrors) {
        logger.debug("Sending notifications...");
        DeliveryReport<PagerDutyEvent> pagerDuty = pagerDutyDispatcher.send(pagerDutyQueue);
        DeliveryReport<SlackMessage> slack = slackDispatcher.send(slackQueue);
        NotificationResponses responses = new NotificationResponses(pagerDuty, slack);
        lastResponses = responses;
        logger.debug("Finished sending notifications (pagerDuty={}, slack={})",
            pagerDuty.outcomes().size(), slack.outcomes().size());

        if (raiseOnErrors) {
            raiseOnFailure(NotificationBackend.PAGER_DUTY, pagerDuty, responses);
            raiseOnFailure(NotificationBackend.SLACK, slack, responses);
        }
        return responses;
    }

    private static <E> void raiseOnFailure(NotificationBackend backend, DeliveryReport<E> report,
                                           NotificationResponses responses) {
        if (!report.sent()) {
            logger.debug("{} dry run enabled, skipping response checks", backend.displayName());
            return;
        }
        Optional<DeliveryOutcome<E>> failure = report.firstFailure();
        if (failure.isPresent()) {
            DeliveryOutcome<E> outcome = failure.get();
            logger.error("{} notification failure for {}: {}", backend.displayName(), outcome.identifier(),
                outcome.statusCode().map(String::valueOf).orElse(String.valueOf(outcome.error())));
            throw new NotificationFailureException(backend, outcome.identifier(),
                outcome.statusCode().orElse(null), responses, outcome.error());
        }
    }

    /**
     * Runs one full cycle: quota check, reputation check, then delivery.
     * A quota configuration error is logged and does not stop the rest of the cycle.
     *
     * @param raiseOnErrors passed to {@link #sendNotifications(boolean)}
     * @return delivery reports
     */
    public NotificationResponses runCycle(boolean raiseOnErrors) {
        Instant eventTime = now();
        try {
            handleSendingQuota(eventTime);
        } catch (InvalidQuotaConfigurationException e) {
            logger.error("Skipping sending quota check: {}", e.getMessage());
        }
        handleReputation(eventTime);
        return sendNotifications(raiseOnErrors);
    }

    /**
     * @return reports of the most recent {@link #sendNotifications(boolean)} call
     */
    public NotificationResponses lastResponses() {
        return lastResponses;
    }

    /**
     * @return current contents of both queues
     */
    public PendingNotifications pendingNotifications() {
        return new PendingNotifications(pagerDutyQueue.snapshot(), slackQueue.snapshot());
    }

    private Optional<ManagementStrategy> activeStrategy() {
        Optional<ManagementStrategy> strategy = settings.strategy();
        if (strategy.isEmpty()) {
            logger.warn("Management strategy '{}' is not valid, skipping check", settings.strategyName());
        }
        return strategy;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for SesAccountMonitor. Every collaborator is required.
     */
    public static class Builder {
        private MonitorSettings settings;
        private MetricsSource metricsSource;
        private AccountControl accountControl;
        private PagerDutyDispatcher pagerDutyDispatcher;
        private SlackDispatcher slackDispatcher;
        private Clock clock = Clock.systemUTC();

        public Builder settings(MonitorSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder metricsSource(MetricsSource metricsSource) {
            this.metricsSource = metricsSource;
            return this;
        }

        public Builder accountControl(AccountControl accountControl) {
            this.accountControl = accountControl;
            return this;
        }

        public Builder pagerDutyDispatcher(PagerDutyDispatcher pagerDutyDispatcher) {
            this.pagerDutyDispatcher = pagerDutyDispatcher;
            return this;
        }

        public Builder slackDispatcher(SlackDispatcher slackDispatcher) {
            this.slackDispatcher = slackDispatcher;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public SesAccountMonitor build() {
            if (settings == null) {
                throw new IllegalArgumentException("settings is required");
            }
            if (metricsSource == null) {
                throw new IllegalArgumentException("metricsSource is required");
            }
            if (accountControl == null) {
                throw new IllegalArgumentException("accountControl is required");
            }
            if (pagerDutyDispatcher == null) {
                throw new IllegalArgumentException("pagerDutyDispatcher is required");
            }
            if (slackDispatcher == null) {
                throw new IllegalArgumentException("slackDispatcher is required");
            }
            if (clock == null) {
                throw new IllegalArgumentException("clock is required");
            }
            return new SesAccountMonitor(this);
        }
    }
}
