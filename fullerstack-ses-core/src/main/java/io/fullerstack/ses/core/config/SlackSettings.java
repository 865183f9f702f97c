package io.fullerstack.ses.core.config;

import java.util.List;
import java.util.Objects;

/**
 * Slack incoming webhook settings.
 *
 * @param webhookUrl    webhook to post to, may be null when Slack is disabled
 * @param channels      channels every message is fanned out to, in order
 * @param footerIconUrl icon shown next to the attachment footer
 * @param iconEmoji     bot icon emoji, may be null
 * @param dryRun        default dry-run mode of the Slack dispatcher
 */
public record SlackSettings(
    String webhookUrl,
    List<String> channels,
    String footerIconUrl,
    String iconEmoji,
    boolean dryRun
) {

    public static final String DEFAULT_FOOTER_ICON_URL =
        "https://platform.slack-edge.com/img/default_application_icon.png";

    public SlackSettings {
        channels = channels == null ? List.of() : List.copyOf(channels);
        Objects.requireNonNull(footerIconUrl, "footerIconUrl cannot be null");
    }
}
