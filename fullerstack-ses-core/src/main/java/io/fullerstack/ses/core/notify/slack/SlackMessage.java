package io.fullerstack.ses.core.notify.slack;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A Slack incoming-webhook message. Built without a channel; the channel is stamped at send time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"channel", "attachments", "icon_emoji", "username"})
public record SlackMessage(
    @JsonProperty("channel") String channel,
    @JsonProperty("attachments") List<SlackAttachment> attachments,
    @JsonProperty("icon_emoji") String iconEmoji,
    @JsonProperty("username") String username
) {

    public SlackMessage {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    /**
     * @return copy of this message addressed to the channel
     */
    public SlackMessage withChannel(String channel) {
        return new SlackMessage(channel, attachments, iconEmoji, username);
    }
}
