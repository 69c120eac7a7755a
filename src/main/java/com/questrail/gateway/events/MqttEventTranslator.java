package com.questrail.gateway.events;

import com.questrail.gateway.api.ProcessValue;
import com.questrail.gateway.api.PublishDecision;
import com.questrail.gateway.broker.MessageBroker;
import com.questrail.gateway.broker.PublishException;
import com.questrail.gateway.codec.EncodingException;
import com.questrail.gateway.codec.PvEncoder;
import com.questrail.gateway.internal.time.WallClock;
import com.questrail.gateway.observability.GatewayErrorEvent;
import com.questrail.gateway.observability.GatewayObservabilitySink;
import com.questrail.gateway.topic.AddressFormatException;
import com.questrail.gateway.topic.PublishPolicy;
import com.questrail.gateway.topic.TopicResolver;

import java.util.Objects;

/**
 * MqttEventTranslator
 * =============================================================================
 * Publishes controller value changes on the broker.
 *
 * <h2>Translation</h2>
 * For every {@link ControllerNotification.ValueChanged}:
 * <ol>
 *   <li>topic {@code device/status/{serial}/{channel}/{parameter}}</li>
 *   <li>QoS and retain flag from the {@link PublishPolicy}</li>
 *   <li>process value stamped with the current time and GOOD status</li>
 *   <li>wire encoding and publication</li>
 * </ol>
 * Other notification kinds are ignored.
 *
 * <h2>Failures</h2>
 * Address, encoding and publication failures are reported to the
 * observability sink and never thrown, so later handlers of the chain always
 * receive the notification.
 */
public final class MqttEventTranslator implements NotificationHandler
{
    private final MessageBroker broker;
    private final PvEncoder encoder;
    private final PublishPolicy policy;
    private final GatewayObservabilitySink observabilitySink;
    private final WallClock clock;

    public MqttEventTranslator(MessageBroker broker,
                               PvEncoder encoder,
                               PublishPolicy policy,
                               GatewayObservabilitySink observabilitySink,
                               WallClock clock)
    {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void handle(ControllerNotification notification) {
        if (notification instanceof ControllerNotification.ValueChanged e) {
            publish(e);
        }
    }

    private void publish(ControllerNotification.ValueChanged e) {
        try {
            String topic = TopicResolver.deviceStatusTopic(e.address(), e.valueKey()).name();
            PublishDecision decision = policy.resolve(e.valueKey());
            byte[] payload = encoder.encode(ProcessValue.good(clock.now(), e.value()));
            broker.publish(topic, payload, decision.qos(), decision.retain());
        } catch (AddressFormatException | EncodingException | PublishException ex) {
            observabilitySink.onError(new GatewayErrorEvent(
                    clock.now(),
                    "Publish of event failed: " + e.address() + "." + e.valueKey() + ": " + ex.getMessage(),
                    ex));
        }
    }
}
