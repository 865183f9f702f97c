package io.fullerstack.ses.core.notify.slack;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One attachment field. {@code value} is a string or a number; {@code short} is omitted when null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"title", "value", "short"})
public record SlackField(
    @JsonProperty("title") String title,
    @JsonProperty("value") Object value,
    @JsonProperty("short") Boolean shortField
) {

    public SlackField {
        Objects.requireNonNull(title, "title cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }

    public static SlackField brief(String title, Object value) {
        return new SlackField(title, value, Boolean.TRUE);
    }

    public static SlackField wide(String title, Object value) {
        return new SlackField(title, value, Boolean.FALSE);
    }
}
