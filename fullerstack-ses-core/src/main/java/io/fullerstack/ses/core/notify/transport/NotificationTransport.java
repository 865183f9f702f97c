package io.fullerstack.ses.core.notify.transport;

import java.io.IOException;

/**
 * Outbound channel for one notification backend.
 *
 * <p>Implementations post a payload as JSON to a fixed endpoint and report the raw status.
 * They never interpret the status code; success or failure is judged by the caller.
 *
 * <h3>Implementation Notes:</h3>
 * <ul>
 *   <li>PagerDuty: Events API v2 enqueue endpoint</li>
 *   <li>Slack: incoming webhook URL</li>
 *   <li>No retries; one call per invocation</li>
 * </ul>
 *
 * @see HttpNotificationTransport
 */
public interface NotificationTransport {

    /**
     * Posts a payload serialised as JSON.
     *
     * @param payload Jackson-serialisable payload
     * @return status and body of the response
     * @throws IOException if the request could not be completed
     */
    TransportResponse postJson(Object payload) throws IOException;
}
