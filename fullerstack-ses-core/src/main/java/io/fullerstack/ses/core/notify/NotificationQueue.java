package io.fullerstack.ses.core.notify;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FIFO queue of outbound notifications for one backend.
 * <p>
 * Not thread-safe. A queue belongs to a single monitor and is filled and drained within one cycle.
 *
 * @param <E> payload type
 */
public final class NotificationQueue<E> {

    private final Deque<E> items = new ArrayDeque<>();

    /**
     * Appends an event to the tail.
     */
    public void enqueue(E event) {
        items.addLast(Objects.requireNonNull(event, "event cannot be null"));
    }

    /**
     * Removes and returns the head, if any.
     */
    public Optional<E> poll() {
        return Optional.ofNullable(items.pollFirst());
    }

    /**
     * Removes and returns every event in insertion order, leaving the queue empty.
     */
    public List<E> drain() {
        List<E> drained = new ArrayList<>(items);
        items.clear();
        return List.copyOf(drained);
    }

    /**
     * @return immutable copy of the current contents in insertion order
     */
    public List<E> snapshot() {
        return List.copyOf(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public String toString() {
        return "NotificationQueue[size=" + items.size() + "]";
    }
}
