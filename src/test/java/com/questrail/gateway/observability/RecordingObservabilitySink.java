package com.questrail.gateway.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements GatewayObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onListenerTransition(ListenerTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onClientConnection(ClientConnectionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onPublish(PublishEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(GatewayErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ListenerTransitionEvent> getListenerTransitions() {
        return ofType(ListenerTransitionEvent.class);
    }

    public synchronized List<GatewayErrorEvent> getErrors() {
        return ofType(GatewayErrorEvent.class);
    }

    public synchronized List<PublishEvent> getPublications() {
        return ofType(PublishEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
