package io.fullerstack.ses.core.notify.slack;

import io.fullerstack.ses.core.notify.NotificationBackend;
import io.fullerstack.ses.core.notify.delivery.NotificationDispatcher;
import io.fullerstack.ses.core.notify.transport.NotificationTransport;

import java.util.List;
import java.util.Objects;

/**
 * Delivers Slack messages, fanning each one out to every configured channel in channel order.
 * Outcomes are identified by channel name.
 */
public class SlackDispatcher extends NotificationDispatcher<SlackMessage> {

    private final List<String> channels;

    public SlackDispatcher(NotificationTransport transport, List<String> channels, boolean defaultDryRun) {
        super(NotificationBackend.SLACK, transport, defaultDryRun);
        this.channels = List.copyOf(Objects.requireNonNull(channels, "channels cannot be null"));
    }

    @Override
    protected List<Addressed<SlackMessage>> address(SlackMessage message, boolean dryRun) {
        return channels.stream()
            .map(channel -> new Addressed<>(channel, message.withChannel(channel)))
            .toList();
    }
}
