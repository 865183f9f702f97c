package io.fullerstack.ses.core.config;

import java.util.Objects;

/**
 * PagerDuty Events API v2 settings.
 *
 * @param eventsUrl  events endpoint
 * @param routingKey integration key of the target service, may be null when paging is disabled
 * @param dryRun     default dry-run mode of the PagerDuty dispatcher
 */
public record PagerDutySettings(String eventsUrl, String routingKey, boolean dryRun) {

    public static final String DEFAULT_EVENTS_URL = "https://events.pagerduty.com/v2/enqueue";

    public PagerDutySettings {
        Objects.requireNonNull(eventsUrl, "eventsUrl cannot be null");
    }
}
