package io.fullerstack.ses.core.notify.delivery;

import io.fullerstack.ses.core.notify.NotificationBackend;
import io.fullerstack.ses.core.notify.NotificationQueue;
import io.fullerstack.ses.core.notify.transport.NotificationTransport;
import io.fullerstack.ses.core.notify.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drains a {@link NotificationQueue} through a {@link NotificationTransport}.
 * <p>
 * <b>Dry run</b>: the queue is emptied, no transport call is made and every payload comes back
 * as a simulated outcome. <b>Live</b>: each event is removed from the queue right before it is
 * posted, once per address, and every response or transport failure is recorded. Nothing is retried
 * and nothing is thrown for a failed post; callers inspect the report.
 *
 * @param <E> payload type
 * @author Fullerstack
 */
public abstract class NotificationDispatcher<E> {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationBackend backend;
    private final NotificationTransport transport;
    private final boolean defaultDryRun;

    protected NotificationDispatcher(NotificationBackend backend, NotificationTransport transport, boolean defaultDryRun) {
        this.backend = Objects.requireNonNull(backend, "backend cannot be null");
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.defaultDryRun = defaultDryRun;
    }

    /**
     * Sends using the configured dry-run default.
     */
    public DeliveryReport<E> send(NotificationQueue<E> queue) {
        return send(queue, defaultDryRun);
    }

    /**
     * Sends every queued event.
     *
     * @param queue  queue to drain
     * @param dryRun when true, simulate instead of posting; overrides the configured default
     * @return report of every delivery
     */
    public DeliveryReport<E> send(NotificationQueue<E> queue, boolean dryRun) {
        Objects.requireNonNull(queue, "queue cannot be null");

        List<DeliveryOutcome<E>> outcomes = new ArrayList<>();
        if (dryRun) {
            logger.debug("{} dry run enabled, not sending {} notifications", backend.displayName(), queue.size());
            for (E event : queue.drain()) {
                for (Addressed<E> address : address(event, true)) {
                    logger.debug("{} dry run: {}", backend.displayName(), address.identifier());
                    outcomes.add(DeliveryOutcome.simulated(address.identifier(), address.payload()));
                }
            }
            return new DeliveryReport<>(false, outcomes);
        }

        logger.debug("Sending {} notifications to {}", queue.size(), backend.displayName());
        Optional<E> next;
        while ((next = queue.poll()).isPresent()) {
            for (Addressed<E> address : address(next.get(), false)) {
                outcomes.add(post(address));
            }
        }
        return new DeliveryReport<>(true, outcomes);
    }

    private DeliveryOutcome<E> post(Addressed<E> address) {
        logger.debug("Sending {} notification {}", backend.displayName(), address.identifier());
        try {
            TransportResponse response = transport.postJson(address.payload());
            if (response.isFailure()) {
                logger.warn("{} rejected notification {} with status {}",
                    backend.displayName(), address.identifier(), response.statusCode());
            }
            return DeliveryOutcome.delivered(address.identifier(), address.payload(), response);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to post {} notification {}: {}",
                backend.displayName(), address.identifier(), e.toString());
            return DeliveryOutcome.failed(address.identifier(), address.payload(), e);
        }
    }

    /**
     * Expands one queued event into the payloads actually posted and their identifiers.
     *
     * @param event  queued event
     * @param dryRun whether the deliveries are simulated
     * @return deliveries in posting order
     */
    protected abstract List<Addressed<E>> address(E event, boolean dryRun);

    /**
     * One concrete delivery of an event.
     */
    public record Addressed<E>(String identifier, E payload) {
    }
}
