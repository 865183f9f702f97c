package io.fullerstack.ses.core.notify.pagerduty;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A PagerDuty Events API v2 event. Resolve events carry no payload, client or client URL.
 *
 * @param routingKey  integration key
 * @param dedupKey    correlates trigger and resolve of one incident
 * @param eventAction {@code trigger} or {@code resolve}
 * @param payload     incident details, trigger only
 * @param client      name of the linked tool, trigger only
 * @param clientUrl   link to the linked tool, trigger only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"payload", "routing_key", "dedup_key", "event_action", "client", "client_url"})
public record PagerDutyEvent(
    @JsonProperty("routing_key") String routingKey,
    @JsonProperty("dedup_key") String dedupKey,
    @JsonProperty("event_action") String eventAction,
    @JsonProperty("payload") PagerDutyPayload payload,
    @JsonProperty("client") String client,
    @JsonProperty("client_url") String clientUrl
) {

    public static final String TRIGGER = "trigger";
    public static final String RESOLVE = "resolve";

    public PagerDutyEvent {
        Objects.requireNonNull(dedupKey, "dedupKey cannot be null");
        Objects.requireNonNull(eventAction, "eventAction cannot be null");
    }

    public static PagerDutyEvent resolve(String routingKey, String dedupKey) {
        return new PagerDutyEvent(routingKey, dedupKey, RESOLVE, null, null, null);
    }

    /**
     * @return {@code {event_action}::{dedup_key}}
     */
    public String identifier() {
        return eventAction + "::" + dedupKey;
    }
}
