package com.questrail.gateway.runtime;

import com.questrail.gateway.api.ProcessValue;
import com.questrail.gateway.api.QualityOfService;
import com.questrail.gateway.broker.MessageListener;
import com.questrail.gateway.broker.MqttBroker;
import com.questrail.gateway.codec.impl.JsonPvCodec;
import com.questrail.gateway.config.GatewayConfig;
import com.questrail.gateway.events.HandlerChain;
import com.questrail.gateway.events.MqttEventTranslator;
import com.questrail.gateway.events.NotificationHandler;
import com.questrail.gateway.internal.time.SystemWallClock;
import com.questrail.gateway.internal.time.WallClock;
import com.questrail.gateway.observability.GatewayErrorEvent;
import com.questrail.gateway.observability.GatewayObservabilitySink;
import com.questrail.gateway.observability.NullObservabilitySink;
import com.questrail.gateway.topic.AddressFormatException;
import com.questrail.gateway.topic.Topic;
import com.questrail.gateway.topic.TopicCategory;
import com.questrail.gateway.topic.TopicService;
import com.questrail.gateway.transport.ListenerFailure;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * GatewayRuntime
 * =============================================================================
 * Composition root and lifecycle owner of the gateway core.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   controller notifications
 *        |
 *        v
 *   HandlerChain: [ MqttEventTranslator, downstream handlers... ]
 *        |
 *        v
 *   MqttBroker --> network clients, local subscribers
 * </pre>
 * Values published by clients on {@code {category}/set/...} are decoded and
 * handed to the optional {@link SetRequestHandler}.
 */
public final class GatewayRuntime
{
    private final MqttBroker broker;
    private final HandlerChain chain;
    private final SetRequestHandler setRequestHandler;
    private final JsonPvCodec codec;
    private final GatewayObservabilitySink observabilitySink;
    private final WallClock clock;
    private final MessageListener setListener = this::onSetMessage;

    private GatewayRuntime(MqttBroker broker,
                           HandlerChain chain,
                           SetRequestHandler setRequestHandler,
                           JsonPvCodec codec,
                           GatewayObservabilitySink observabilitySink,
                           WallClock clock)
    {
        this.broker = broker;
        this.chain = chain;
        this.setRequestHandler = setRequestHandler;
        this.codec = codec;
        this.observabilitySink = observabilitySink;
        this.clock = clock;
    }

    public void start() {
        if (setRequestHandler != null) {
            for (TopicCategory category : TopicCategory.values()) {
                broker.subscribe(Topic.filter(category, TopicService.SET), QualityOfService.EXACTLY_ONCE, setListener);
            }
        }
        broker.start();
    }

    /**
     * Stops the broker. Blocks until every listener has terminated.
     */
    public void stop() {
        broker.stop();
        if (setRequestHandler != null) {
            for (TopicCategory category : TopicCategory.values()) {
                broker.unsubscribe(Topic.filter(category, TopicService.SET), setListener);
            }
        }
    }

    /**
     * Entry point for controller notifications.
     */
    public NotificationHandler eventReceiver() {
        return chain;
    }

    public MqttBroker broker() {
        return broker;
    }

    private void onSetMessage(String topicName, byte[] payload, QualityOfService qos, boolean retained) {
        Topic topic;
        try {
            topic = Topic.parse(topicName);
        } catch (AddressFormatException e) {
            observabilitySink.onError(new GatewayErrorEvent(clock.now(), "Invalid set topic: " + topicName, e));
            return;
        }
        ProcessValue value = codec.decode(payload);
        try {
            setRequestHandler.onSetRequest(topic, value);
        } catch (RuntimeException e) {
            observabilitySink.onError(new GatewayErrorEvent(clock.now(), "Set request failed: " + topicName, e));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder
    {
        private GatewayConfig config;
        private GatewayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;
        private Consumer<ListenerFailure> errorConsumer;
        private final List<NotificationHandler> downstream = new ArrayList<>();
        private SetRequestHandler setRequestHandler;

        public Builder withConfig(GatewayConfig config) {
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

        public Builder withErrorConsumer(Consumer<ListenerFailure> consumer) {
            this.errorConsumer = consumer;
            return this;
        }

        /**
         * Appends a handler that receives every notification after the MQTT
         * translator, in registration order.
         */
        public Builder withDownstreamHandler(NotificationHandler handler) {
            this.downstream.add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder withSetRequestHandler(SetRequestHandler handler) {
            this.setRequestHandler = handler;
            return this;
        }

        public GatewayRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");

            // 1. Codec and broker
            JsonPvCodec codec = new JsonPvCodec(clock);
            MqttBroker broker = MqttBroker.builder()
                    .withConfig(config.broker())
                    .withObservabilitySink(observabilitySink)
                    .withClock(clock)
                    .withErrorConsumer(errorConsumer)
                    .withEncoder(codec)
                    .build();

            // 2. Handler chain, translator first
            List<NotificationHandler> handlers = new ArrayList<>();
            handlers.add(new MqttEventTranslator(broker, codec, config.publishPolicy(), observabilitySink, clock));
            handlers.addAll(downstream);

            return new GatewayRuntime(
                    broker, new HandlerChain(handlers), setRequestHandler, codec, observabilitySink, clock);
        }
    }
}
