package io.fullerstack.ses.core.notify.pagerduty;

import io.fullerstack.ses.core.notify.NotificationBackend;
import io.fullerstack.ses.core.notify.delivery.NotificationDispatcher;
import io.fullerstack.ses.core.notify.transport.NotificationTransport;

import java.util.List;

/**
 * Delivers PagerDuty events, one post per event.
 * Outcomes are identified as {@code {event_action}::{dedup_key}}, prefixed with {@code debug::} on dry runs.
 */
public class PagerDutyDispatcher extends NotificationDispatcher<PagerDutyEvent> {

    public PagerDutyDispatcher(NotificationTransport transport, boolean defaultDryRun) {
        super(NotificationBackend.PAGER_DUTY, transport, defaultDryRun);
    }

    @Override
    protected List<Addressed<PagerDutyEvent>> address(PagerDutyEvent event, boolean dryRun) {
        String identifier = dryRun ? "debug::" + event.identifier() : event.identifier();
        return List.of(new Addressed<>(identifier, event));
    }
}
