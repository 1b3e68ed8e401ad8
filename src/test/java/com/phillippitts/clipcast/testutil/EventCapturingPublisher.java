package com.phillippitts.clipcast.testutil;

import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 *
 * <p>Thread-safe; capture and encode threads may publish concurrently.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    private final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(ApplicationEvent event) {
        events.add(event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    public List<Object> events() {
        return List.copyOf(events);
    }

    /** All captured events of the given type, in publish order. */
    public <T> List<T> eventsOf(Class<T> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    /** First captured event of the given type, or null. */
    public <T> T first(Class<T> type) {
        return eventsOf(type).stream().findFirst().orElse(null);
    }

    public void clear() {
        events.clear();
    }
}
