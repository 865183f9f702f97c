package io.fullerstack.ses.core.config;

/**
 * Which backend is told about which signal.
 *
 * @param pagerDutyOnReputation   page on reputation CRITICAL
 * @param pagerDutyOnSendingQuota page on quota CRITICAL, resolve otherwise
 * @param slackOnReputation       post reputation messages to Slack
 * @param slackOnSendingQuota     post quota messages to Slack
 */
public record NotifyConfig(
    boolean pagerDutyOnReputation,
    boolean pagerDutyOnSendingQuota,
    boolean slackOnReputation,
    boolean slackOnSendingQuota
) {

    public static NotifyConfig none() {
        return new NotifyConfig(false, false, false, false);
    }

    public static NotifyConfig all() {
        return new NotifyConfig(true, true, true, true);
    }
}
