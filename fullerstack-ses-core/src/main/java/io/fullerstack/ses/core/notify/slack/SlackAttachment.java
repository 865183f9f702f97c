package io.fullerstack.ses.core.notify.slack;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"fallback", "color", "fields", "footer", "footer_icon", "ts"})
public record SlackAttachment(
    @JsonProperty("fallback") String fallback,
    @JsonProperty("color") String color,
    @JsonProperty("fields") List<SlackField> fields,
    @JsonProperty("footer") String footer,
    @JsonProperty("footer_icon") String footerIcon,
    @JsonProperty("ts") long ts
) {

    public SlackAttachment {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
