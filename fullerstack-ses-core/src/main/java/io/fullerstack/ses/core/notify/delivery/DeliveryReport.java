package io.fullerstack.ses.core.notify.delivery;

import java.util.List;
import java.util.Optional;

/**
 * Everything one dispatcher did with one queue.
 *
 * @param sent     false for a dry run, true when transport calls were made
 * @param outcomes one outcome per delivery, in delivery order
 * @param <E>      payload type
 */
public record DeliveryReport<E>(boolean sent, List<DeliveryOutcome<E>> outcomes) {

    public DeliveryReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static <E> DeliveryReport<E> none() {
        return new DeliveryReport<>(false, List.of());
    }

    /**
     * @return the first failed outcome of a live delivery; always empty for dry runs
     */
    public Optional<DeliveryOutcome<E>> firstFailure() {
        if (!sent) {
            return Optional.empty();
        }
        return outcomes.stream().filter(DeliveryOutcome::isFailure).findFirst();
    }
}
