package com.questrail.gateway.broker.internal;

import com.questrail.gateway.api.QualityOfService;
import com.questrail.gateway.broker.MessageListener;
import com.questrail.gateway.internal.time.WallClock;
import com.questrail.gateway.observability.GatewayErrorEvent;
import com.questrail.gateway.observability.GatewayObservabilitySink;
import com.questrail.gateway.observability.PublishEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * BrokerCore
 * =============================================================================
 * Routing engine of the embedded broker: subscription table, retained store
 * and connected client sessions.
 *
 * <h2>Ownership</h2>
 * All broker state is owned here. Transport adapters and the publishing API
 * only call the methods of this class; nothing reaches into the tables
 * directly. All methods are safe for concurrent use.
 *
 * <h2>Delivery</h2>
 * <ul>
 *   <li>Network sessions: written to the client connection; the transport
 *       performs the I/O asynchronously.</li>
 *   <li>Local callbacks: executed on the single {@code mqtt-delivery} thread,
 *       in routing order.</li>
 * </ul>
 */
public final class BrokerCore
{
    private static final long DELIVERY_DRAIN_SECONDS = 5;

    private final GatewayObservabilitySink observabilitySink;
    private final WallClock clock;

    private final SubscriptionRegistry subscriptions = new SubscriptionRegistry();
    private final RetainedMessageStore retained = new RetainedMessageStore();
    private final ConcurrentHashMap<String, ClientSession> sessions = new ConcurrentHashMap<>();
    private final ExecutorService localDelivery;

    public BrokerCore(GatewayObservabilitySink observabilitySink, WallClock clock) {
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.localDelivery = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mqtt-delivery");
            t.setDaemon(true);
            return t;
        });
    }

    // -------------------------------------------------------------------------
    // Routing
    // -------------------------------------------------------------------------

    /**
     * Routes a validated publication to all matching subscribers and updates
     * the retained store.
     */
    public void publish(BrokerMessage message) {
        Objects.requireNonNull(message, "message");
        if (message.retain()) {
            retained.update(message);
        }
        observabilitySink.onPublish(new PublishEvent(
                clock.now(), message.topic(), message.payload(), message.qos(), message.retain()));

        BrokerMessage routed = message.withRetain(false);
        for (Map.Entry<Subscriber, QualityOfService> e : subscriptions.match(message.topic()).entrySet()) {
            deliver(e.getKey(), routed, QualityOfService.min(e.getValue(), message.qos()));
        }
    }

    /**
     * Current retained message of a topic.
     */
    public Optional<BrokerMessage> retained(String topic) {
        return retained.get(topic);
    }

    // -------------------------------------------------------------------------
    // Local subscriptions
    // -------------------------------------------------------------------------

    public void subscribeLocal(String filter, QualityOfService qos, MessageListener listener) {
        Objects.requireNonNull(qos, "qos");
        Objects.requireNonNull(listener, "listener");
        String invalid = TopicNames.validateFilter(filter);
        if (invalid != null) {
            throw new IllegalArgumentException("Invalid topic filter '" + filter + "': " + invalid);
        }
        LocalSubscriber subscriber = new LocalSubscriber(listener);
        subscriptions.add(filter, subscriber, qos);
        deliverRetained(subscriber, filter, qos);
    }

    public void unsubscribeLocal(String filter, MessageListener listener) {
        Objects.requireNonNull(listener, "listener");
        subscriptions.remove(filter, new LocalSubscriber(listener));
    }

    // -------------------------------------------------------------------------
    // Client sessions
    // -------------------------------------------------------------------------

    /**
     * Registers a connected client. An existing session with the same client
     * id is taken over: its subscriptions are dropped and its connection is
     * closed without publishing its will.
     *
     * @param will will message, or {@code null}
     */
    public ClientSession connect(String clientId, SessionOutlet outlet, BrokerMessage will) {
        ClientSession session = new ClientSession(clientId, outlet, will);
        ClientSession previous = sessions.put(clientId, session);
        if (previous != null) {
            previous.clearWill();
            dropSubscriptions(previous);
            previous.outlet().close();
        }
        return session;
    }

    /**
     * Unregisters a client. The will message is published unless the client
     * disconnected gracefully.
     */
    public void disconnect(ClientSession session, boolean graceful) {
        sessions.remove(session.clientId(), session);
        dropSubscriptions(session);
        BrokerMessage will = session.takeWill();
        if (!graceful && will != null) {
            publish(will);
        }
    }

    /**
     * Adds client subscriptions and delivers matching retained messages.
     *
     * @return granted QoS per request, empty for rejected filters
     */
    public List<Optional<QualityOfService>> subscribe(ClientSession session, List<SubscriptionRequest> requests) {
        List<Optional<QualityOfService>> granted = new ArrayList<>(requests.size());
        for (SubscriptionRequest r : requests) {
            String invalid = TopicNames.validateFilter(r.filter());
            if (invalid != null) {
                observabilitySink.onError(new GatewayErrorEvent(clock.now(),
                        "Client " + session.clientId() + " subscribed invalid filter '" + r.filter() + "': " + invalid,
                        null));
                granted.add(Optional.empty());
                continue;
            }
            session.subscriptions().put(r.filter(), r.qos());
            subscriptions.add(r.filter(), session, r.qos());
            granted.add(Optional.of(r.qos()));
        }
        return granted;
    }

    /**
     * Delivers retained messages for freshly granted subscriptions. Called by
     * the transport after SUBACK has been written.
     */
    public void deliverRetained(ClientSession session, List<SubscriptionRequest> granted) {
        for (SubscriptionRequest r : granted) {
            deliverRetained(session, r.filter(), r.qos());
        }
    }

    public void unsubscribe(ClientSession session, List<String> filters) {
        for (String filter : filters) {
            session.subscriptions().remove(filter);
            subscriptions.remove(filter, session);
        }
    }

    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Closes all client connections and stops local delivery after pending
     * callbacks ran.
     */
    public void close() {
        for (ClientSession session : new ArrayList<>(sessions.values())) {
            session.clearWill();
            session.outlet().close();
        }
        localDelivery.shutdown();
        try {
            if (!localDelivery.awaitTermination(DELIVERY_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                localDelivery.shutdownNow();
            }
        } catch (InterruptedException e) {
            localDelivery.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private void deliverRetained(Subscriber subscriber, String filter, QualityOfService qos) {
        for (BrokerMessage m : retained.matching(filter)) {
            deliver(subscriber, m, QualityOfService.min(qos, m.qos()));
        }
    }

    private void deliver(Subscriber subscriber, BrokerMessage message, QualityOfService qos) {
        try {
            subscriber.deliver(message, qos);
        } catch (RuntimeException e) {
            observabilitySink.onError(new GatewayErrorEvent(clock.now(),
                    "Delivery of " + message.topic() + " to " + subscriber + " failed", e));
        }
    }

    private void dropSubscriptions(ClientSession session) {
        for (String filter : session.subscriptions().keySet()) {
            subscriptions.remove(filter, session);
        }
        session.subscriptions().clear();
    }

    /**
     * Local callback, dispatched on the delivery thread. Equal by listener
     * identity so that unsubscribe can find it.
     */
    private final class LocalSubscriber implements Subscriber
    {
        private final MessageListener listener;

        LocalSubscriber(MessageListener listener) {
            this.listener = listener;
        }

        @Override
        public void deliver(BrokerMessage message, QualityOfService qos) {
            localDelivery.execute(() -> {
                try {
                    listener.onMessage(message.topic(), message.payload().clone(), qos, message.retain());
                } catch (RuntimeException e) {
                    observabilitySink.onError(new GatewayErrorEvent(clock.now(),
                            "Subscriber callback for " + message.topic() + " failed", e));
                }
            });
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof LocalSubscriber && ((LocalSubscriber) o).listener == listener;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(listener);
        }

        @Override
        public String toString() {
            return "LocalSubscriber[" + listener + "]";
        }
    }
}
