package io.fullerstack.ses.core.notify.delivery;

import io.fullerstack.ses.core.notify.transport.TransportResponse;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of delivering (or simulating delivery of) one payload.
 * <p>
 * A dry-run outcome carries neither a response nor an error. A live outcome carries exactly one of them.
 *
 * @param identifier identifier of the delivery, e.g. {@code trigger::svc/ses_account_reputation} or a channel
 * @param payload    the payload as it was (or would have been) posted
 * @param response   transport response, null for dry runs and failed calls
 * @param error      transport failure, null unless the call threw
 * @param <E>        payload type
 */
public record DeliveryOutcome<E>(
    String identifier,
    E payload,
    TransportResponse response,
    Exception error
) {

    public DeliveryOutcome {
        Objects.requireNonNull(identifier, "identifier cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
        if (response != null && error != null) {
            throw new IllegalArgumentException("outcome cannot hold both a response and an error");
        }
    }

    public static <E> DeliveryOutcome<E> simulated(String identifier, E payload) {
        return new DeliveryOutcome<>(identifier, payload, null, null);
    }

    public static <E> DeliveryOutcome<E> delivered(String identifier, E payload, TransportResponse response) {
        return new DeliveryOutcome<>(identifier, payload, Objects.requireNonNull(response, "response cannot be null"), null);
    }

    public static <E> DeliveryOutcome<E> failed(String identifier, E payload, Exception error) {
        return new DeliveryOutcome<>(identifier, payload, null, Objects.requireNonNull(error, "error cannot be null"));
    }

    public Optional<Integer> statusCode() {
        return response == null ? Optional.empty() : Optional.of(response.statusCode());
    }

    /**
     * @return true when the call threw, or returned a status between 400 and 500 inclusive
     */
    public boolean isFailure() {
        return error != null || (response != null && response.isFailure());
    }
}
