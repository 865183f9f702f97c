package io.fullerstack.ses.core.notify.pagerduty;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The {@code payload} object of a PagerDuty trigger event.
 *
 * @param summary       incident title
 * @param timestamp     ISO-8601 event time
 * @param source        emitting service
 * @param severity      critical, error, warning or info
 * @param component     affected component
 * @param group         logical grouping
 * @param eventClass    event class, also the suffix of the dedup key
 * @param customDetails free-form details, kept in insertion order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"summary", "timestamp", "source", "severity", "component", "group", "class", "custom_details"})
public record PagerDutyPayload(
    @JsonProperty("summary") String summary,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("source") String source,
    @JsonProperty("severity") String severity,
    @JsonProperty("component") String component,
    @JsonProperty("group") String group,
    @JsonProperty("class") String eventClass,
    @JsonProperty("custom_details") Map<String, Object> customDetails
) {

    public PagerDutyPayload {
        Objects.requireNonNull(summary, "summary cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        customDetails = customDetails == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(customDetails));
    }
}
