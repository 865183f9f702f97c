package io.fullerstack.ses.core.notify.slack;

import io.fullerstack.ses.core.notify.NotificationQueue;
import io.fullerstack.ses.core.notify.delivery.DeliveryOutcome;
import io.fullerstack.ses.core.notify.delivery.DeliveryReport;
import io.fullerstack.ses.core.notify.transport.NotificationTransport;
import io.fullerstack.ses.core.notify.transport.TransportResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SlackDispatcherTest {

    private static final SlackMessage FIRST = new SlackMessage(null, List.of(), ":one:", "SES Account Monitor");
    private static final SlackMessage SECOND = new SlackMessage(null, List.of(), ":two:", "SES Account Monitor");

    @Mock
    private NotificationTransport transport;

    private NotificationQueue<SlackMessage> queue;

    @BeforeEach
    void setUp() {
        queue = new NotificationQueue<>();
        queue.enqueue(FIRST);
        queue.enqueue(SECOND);
    }

    @Test
    void shouldFanOutEveryMessageToEveryChannel() throws Exception {
        // Given
        SlackDispatcher dispatcher = new SlackDispatcher(transport, List.of("#a", "#b"), false);
        when(transport.postJson(any())).thenReturn(new TransportResponse(200, "ok"));

        // When
        DeliveryReport<SlackMessage> report = dispatcher.send(queue);

        // Then: channel order repeated per message in queue order
        assertThat(report.sent()).isTrue();
        assertThat(report.outcomes()).extracting(DeliveryOutcome::identifier).containsExactly("#a", "#b", "#a", "#b");

        ArgumentCaptor<Object> posted = ArgumentCaptor.forClass(Object.class);
        verify(transport, times(4)).postJson(posted.capture());
        assertThat(posted.getAllValues()).containsExactly(
            FIRST.withChannel("#a"), FIRST.withChannel("#b"),
            SECOND.withChannel("#a"), SECOND.withChannel("#b"));
    }

    @Test
    void shouldEchoChannelStampedMessagesOnDryRun() {
        // Given
        SlackDispatcher dispatcher = new SlackDispatcher(transport, List.of("#a", "#b"), true);

        // When
        DeliveryReport<SlackMessage> report = dispatcher.send(queue);

        // Then
        assertThat(report.sent()).isFalse();
        assertThat(report.outcomes()).extracting(DeliveryOutcome::payload)
            .extracting(SlackMessage::channel)
            .containsExactly("#a", "#b", "#a", "#b");
        assertThat(report.firstFailure()).isEmpty();
        assertThat(queue.isEmpty()).isTrue();
        verifyNoInteractions(transport);
    }

    @Test
    void shouldReportFailedChannel() throws Exception {
        // Given
        SlackDispatcher dispatcher = new SlackDispatcher(transport, List.of("#a"), false);
        when(transport.postJson(any())).thenReturn(new TransportResponse(404, "channel_not_found"));

        // When
        DeliveryReport<SlackMessage> report = dispatcher.send(queue);

        // Then
        assertThat(report.firstFailure()).get()
            .satisfies(outcome -> {
                assertThat(outcome.identifier()).isEqualTo("#a");
                assertThat(outcome.response().body()).isEqualTo("channel_not_found");
            });
    }

    @Test
    void shouldRecordUncheckedTransportErrorAndKeepDraining() throws Exception {
        // Given: the first post blows up with an unchecked exception
        SlackDispatcher dispatcher = new SlackDispatcher(transport, List.of("#a"), false);
        IllegalArgumentException badUri = new IllegalArgumentException("URI with undefined scheme");
        when(transport.postJson(any()))
            .thenThrow(badUri)
            .thenReturn(new TransportResponse(200, "ok"));

        // When
        DeliveryReport<SlackMessage> report = dispatcher.send(queue);

        // Then: both messages accounted for, the failure is data
        assertThat(report.outcomes()).hasSize(2);
        assertThat(report.firstFailure()).get()
            .satisfies(outcome -> {
                assertThat(outcome.identifier()).isEqualTo("#a");
                assertThat(outcome.payload()).isEqualTo(FIRST.withChannel("#a"));
                assertThat(outcome.error()).isSameAs(badUri);
                assertThat(outcome.statusCode()).isEmpty();
            });
        assertThat(report.outcomes().get(1).isFailure()).isFalse();
        assertThat(queue.isEmpty()).isTrue();
    }
}
