package io.fullerstack.ses.core.monitor;

import io.fullerstack.ses.core.notify.pagerduty.PagerDutyEvent;
import io.fullerstack.ses.core.notify.slack.SlackMessage;

import java.util.List;

/**
 * Snapshot of both notification queues after a check.
 *
 * @param pagerDuty queued PagerDuty events in queue order
 * @param slack     queued Slack messages in queue order, without channel
 */
public record PendingNotifications(List<PagerDutyEvent> pagerDuty, List<SlackMessage> slack) {

    public PendingNotifications {
        pagerDuty = pagerDuty == null ? List.of() : List.copyOf(pagerDuty);
        slack = slack == null ? List.of() : List.copyOf(slack);
    }

    public static PendingNotifications empty() {
        return new PendingNotifications(List.of(), List.of());
    }

    public boolean isEmpty() {
        return pagerDuty.isEmpty() && slack.isEmpty();
    }
}
