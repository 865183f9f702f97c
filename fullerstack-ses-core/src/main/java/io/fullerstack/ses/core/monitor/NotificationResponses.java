package io.fullerstack.ses.core.monitor;

import io.fullerstack.ses.core.notify.delivery.DeliveryReport;
import io.fullerstack.ses.core.notify.pagerduty.PagerDutyEvent;
import io.fullerstack.ses.core.notify.slack.SlackMessage;

import java.util.Objects;

/**
 * Delivery reports of one {@link SesAccountMonitor#sendNotifications(boolean)} call.
 */
public record NotificationResponses(DeliveryReport<PagerDutyEvent> pagerDuty, DeliveryReport<SlackMessage> slack) {

    public NotificationResponses {
        Objects.requireNonNull(pagerDuty, "pagerDuty cannot be null");
        Objects.requireNonNull(slack, "slack cannot be null");
    }

    public static NotificationResponses none() {
        return new NotificationResponses(DeliveryReport.none(), DeliveryReport.none());
    }
}
