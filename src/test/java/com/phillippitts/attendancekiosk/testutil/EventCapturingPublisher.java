package com.phillippitts.attendancekiosk.testutil;

import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 *
 * <p>Thread-safe implementation using CopyOnWriteArrayList for concurrent test scenarios.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(ApplicationEvent event) {
        events.add(event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    /**
     * Returns captured events of the given type in publication order.
     */
    public <T> List<T> eventsOf(Class<T> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    /**
     * Finds the last captured event of the given type.
     *
     * @return last matching event, or null if none found
     */
    public <T> T lastOf(Class<T> type) {
        List<T> matching = eventsOf(type);
        return matching.isEmpty() ? null : matching.get(matching.size() - 1);
    }

    /**
     * Clears all captured events (useful for multi-iteration tests).
     */
    public void clear() {
        events.clear();
    }
}
