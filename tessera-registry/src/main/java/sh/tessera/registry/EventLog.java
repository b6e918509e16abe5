// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import sh.tessera.registry.event.LedgerEvent;

/**
 * Append-only record of every committed event, in commit order.
 *
 * @since 0.1.0
 */
public final class EventLog {

    private final List<LedgerEvent> events = new ArrayList<>();

    synchronized void appendAll(final Collection<? extends LedgerEvent> committed) {
        events.addAll(committed);
    }

    public synchronized List<LedgerEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns the committed events of one type, in commit order.
     *
     * @param type the event type
     * @param <E>  the event type
     * @return matching events
     */
    public synchronized <E extends LedgerEvent> List<E> eventsOfType(final Class<E> type) {
        Objects.requireNonNull(type, "type");
        final List<E> matching = new ArrayList<>();
        for (LedgerEvent event : events) {
            if (type.isInstance(event)) {
                matching.add(type.cast(event));
            }
        }
        return List.copyOf(matching);
    }

    public synchronized int size() {
        return events.size();
    }
}
