package io.fullerstack.ses.core.monitor;

import io.fullerstack.ses.core.SesMonitorException;
import io.fullerstack.ses.core.notify.NotificationBackend;

import java.util.Optional;

/**
 * Thrown when a live notification was rejected or could not be posted.
 * Carries every response of the send, not only the failed one.
 */
public class NotificationFailureException extends SesMonitorException {

    private final NotificationBackend backend;
    private final String identifier;
    private final Integer statusCode;
    private final NotificationResponses responses;

    public NotificationFailureException(NotificationBackend backend, String identifier, Integer statusCode,
                                        NotificationResponses responses, Throwable cause) {
        super(message(backend, identifier, statusCode), cause);
        this.backend = backend;
        this.identifier = identifier;
        this.statusCode = statusCode;
        this.responses = responses;
    }

    private static String message(NotificationBackend backend, String identifier, Integer statusCode) {
        String status = statusCode == null ? "no response" : String.valueOf(statusCode);
        return switch (backend) {
            case PAGER_DUTY -> "Failed to post event to PagerDuty: " + identifier + ", status: " + status;
            case SLACK -> "Failed to post to Slack channel: " + identifier + ", status: " + status + ".";
        };
    }

    public NotificationBackend getBackend() {
        return backend;
    }

    /**
     * @return event identifier for PagerDuty, channel for Slack
     */
    public String getIdentifier() {
        return identifier;
    }

    /**
     * @return HTTP status, empty when the transport call itself failed
     */
    public Optional<Integer> getStatusCode() {
        return Optional.ofNullable(statusCode);
    }

    public NotificationResponses getResponses() {
        return responses;
    }
}
