package com.questrail.gateway.broker;

import com.questrail.gateway.api.ProcessValue;
import com.questrail.gateway.api.QualityOfService;
import com.questrail.gateway.broker.internal.BrokerCore;
import com.questrail.gateway.broker.internal.BrokerMessage;
import com.questrail.gateway.broker.internal.TopicNames;
import com.questrail.gateway.codec.PvEncoder;
import com.questrail.gateway.codec.impl.JsonPvCodec;
import com.questrail.gateway.config.BrokerConfig;
import com.questrail.gateway.config.ListenerConfig;
import com.questrail.gateway.internal.time.SystemWallClock;
import com.questrail.gateway.internal.time.WallClock;
import com.questrail.gateway.observability.GatewayObservabilitySink;
import com.questrail.gateway.observability.NullObservabilitySink;
import com.questrail.gateway.transport.ListenerFactory;
import com.questrail.gateway.transport.ListenerFailure;
import com.questrail.gateway.transport.ListenerManager;
import com.questrail.gateway.transport.ListenerState;
import com.questrail.gateway.transport.NetworkListener;
import com.questrail.gateway.transport.netty.NettyListenerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * MqttBroker
 * =============================================================================
 * Embedded MQTT broker: {@link BrokerCore} for routing plus one network
 * listener per configured {@link ListenerConfig}.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   NEW --start()--> RUNNING --stop()--> STOPPED
 * </pre>
 * Local subscriptions may be registered in any state. Publications are
 * accepted only while {@code RUNNING}.
 *
 * <h2>Listener failures</h2>
 * A failing listener does not stop the broker. Failures are reported to the
 * error consumer given to the {@link Builder} and to the observability sink;
 * {@link #listenerStates()} shows which listeners are running.
 */
public final class MqttBroker implements MessageBroker
{
    private enum LifecycleState { NEW, RUNNING, STOPPED }

    private final BrokerConfig config;
    private final GatewayObservabilitySink observabilitySink;
    private final WallClock clock;
    private final Consumer<ListenerFailure> errorConsumer;
    private final PvEncoder encoder;
    private final BrokerCore core;

    private final Object lifecycleLock = new Object();
    private volatile LifecycleState state = LifecycleState.NEW;
    private NettyListenerFactory listenerFactory;
    private ListenerManager listenerManager;

    private MqttBroker(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.observabilitySink = Objects.requireNonNullElse(b.observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNullElse(b.clock, SystemWallClock.INSTANCE);
        this.errorConsumer = b.errorConsumer;
        this.encoder = Objects.requireNonNullElseGet(b.encoder, () -> new JsonPvCodec(this.clock));
        this.core = new BrokerCore(observabilitySink, clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (state != LifecycleState.NEW) {
                throw new IllegalStateException("Broker already started");
            }
            listenerFactory = new NettyListenerFactory(config, core, observabilitySink, clock);
            listenerManager = new ListenerManager(
                    createListeners(listenerFactory), errorConsumer, observabilitySink, clock);
            state = LifecycleState.RUNNING;
            listenerManager.start();
        }
    }

    /**
     * Stops all listeners and blocks until their tasks have exited. The
     * lifecycle lock is released before blocking, so the error consumer may
     * still inspect the broker while failures are being drained.
     */
    @Override
    public void stop() {
        ListenerManager manager;
        NettyListenerFactory factory;
        synchronized (lifecycleLock) {
            if (state == LifecycleState.STOPPED) {
                return;
            }
            state = LifecycleState.STOPPED;
            manager = listenerManager;
            factory = listenerFactory;
        }
        if (manager == null) {
            core.close();
            return;
        }
        try {
            manager.stop();
            core.close();
        } finally {
            factory.close();
        }
    }

    private List<NetworkListener> createListeners(ListenerFactory factory) {
        List<NetworkListener> listeners = new ArrayList<>();
        for (ListenerConfig l : config.listeners()) {
            listeners.add(factory.create(l));
        }
        return listeners;
    }

    // -------------------------------------------------------------------------
    // Publishing
    // -------------------------------------------------------------------------

    @Override
    public void publish(String topic, byte[] payload, int qos, boolean retain) {
        Objects.requireNonNull(payload, "payload");
        String invalid = TopicNames.validateName(topic);
        if (invalid != null) {
            throw new PublishException("Invalid topic '" + topic + "': " + invalid);
        }
        if (qos < 0 || qos > 2) {
            throw new PublishException("Invalid QoS: " + qos);
        }
        if (state != LifecycleState.RUNNING) {
            throw new PublishException("Publish failed: broker not running");
        }
        core.publish(new BrokerMessage(topic, payload.clone(), QualityOfService.fromValue(qos), retain));
    }

    @Override
    public void publishPv(String topic, ProcessValue pv, QualityOfService qos, boolean retain) {
        Objects.requireNonNull(pv, "pv");
        Objects.requireNonNull(qos, "qos");
        publish(topic, encoder.encode(pv), qos.value(), retain);
    }

    // -------------------------------------------------------------------------
    // Local subscriptions
    // -------------------------------------------------------------------------

    @Override
    public void subscribe(String topicFilter, QualityOfService qos, MessageListener listener) {
        core.subscribeLocal(topicFilter, qos, listener);
    }

    @Override
    public void unsubscribe(String topicFilter, MessageListener listener) {
        core.unsubscribeLocal(topicFilter, listener);
    }

    // -------------------------------------------------------------------------
    // Introspection
    // -------------------------------------------------------------------------

    /**
     * Listener states in configuration order; empty before {@link #start()}.
     */
    public Map<String, ListenerState> listenerStates() {
        ListenerManager manager;
        synchronized (lifecycleLock) {
            manager = listenerManager;
        }
        return manager == null ? Map.of() : manager.states();
    }

    /**
     * Local address a listener is bound to. Resolves ephemeral ports.
     */
    public Optional<InetSocketAddress> boundAddress(String listenerName) {
        ListenerManager manager;
        synchronized (lifecycleLock) {
            manager = listenerManager;
        }
        return manager == null ? Optional.empty() : manager.boundAddress(listenerName);
    }

    /**
     * Current retained payload of a topic.
     */
    public Optional<byte[]> retained(String topic) {
        return core.retained(topic).map(m -> m.payload().clone());
    }

    public int connectedClients() {
        return core.sessionCount();
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder
    {
        private BrokerConfig config;
        private GatewayObservabilitySink observabilitySink;
        private WallClock clock;
        private Consumer<ListenerFailure> errorConsumer;
        private PvEncoder encoder;

        private Builder() {
        }

        public Builder withConfig(BrokerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(GatewayObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Receives terminal listener failures on a dedicated reporter thread.
         */
        public Builder withErrorConsumer(Consumer<ListenerFailure> errorConsumer) {
            this.errorConsumer = errorConsumer;
            return this;
        }

        public Builder withEncoder(PvEncoder encoder) {
            this.encoder = encoder;
            return this;
        }

        public MqttBroker build() {
            return new MqttBroker(this);
        }
    }
}
