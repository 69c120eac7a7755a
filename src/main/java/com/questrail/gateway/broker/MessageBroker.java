package com.questrail.gateway.broker;

import com.questrail.gateway.api.ProcessValue;
import com.questrail.gateway.api.QualityOfService;

/**
 * MessageBroker
 * -----------------------------------------------------------------------------
 * Integration surface of the embedded publish/subscribe broker.
 *
 * <p>{@code publish}, {@code subscribe} and {@code unsubscribe} may be called
 * concurrently from any thread; the broker serializes access to its
 * subscription table and retained store internally.</p>
 */
public interface MessageBroker
{
    /**
     * Binds the configured listeners. Non-blocking: returns once the listener
     * tasks are spawned, not necessarily once they accept connections.
     *
     * @throws IllegalStateException if the broker was already started
     */
    void start();

    /**
     * Shuts down all listeners and the broker core. Blocks until every
     * listener task has terminated. Calls after the first are no-ops.
     */
    void stop();

    /**
     * Submits one message. Matching subscribers receive it asynchronously. A
     * retained message becomes the last known value of its topic; a retained
     * message with an empty payload clears it.
     *
     * @param qos QoS level, 0, 1 or 2
     * @throws PublishException if the topic is invalid, the QoS level is out of
     *         range, or the broker is not running
     */
    void publish(String topic, byte[] payload, int qos, boolean retain);

    /**
     * @see #publish(String, byte[], int, boolean)
     */
    default void publish(String topic, byte[] payload, QualityOfService qos, boolean retain) {
        publish(topic, payload, qos.value(), retain);
    }

    /**
     * Encodes a process value with the wire codec and publishes it.
     *
     * @throws com.questrail.gateway.codec.EncodingException if the value is not representable
     * @throws PublishException if the publication is rejected
     */
    void publishPv(String topic, ProcessValue pv, QualityOfService qos, boolean retain);

    /**
     * Registers a local delivery callback. Retained messages matching the
     * filter are delivered to the new subscription.
     *
     * @param topicFilter MQTT topic filter, wildcards {@code +} and {@code #} allowed
     * @throws IllegalArgumentException if the filter is invalid
     */
    void subscribe(String topicFilter, QualityOfService qos, MessageListener listener);

    /**
     * Removes a callback registered with {@link #subscribe}. Unknown
     * registrations are ignored.
     */
    void unsubscribe(String topicFilter, MessageListener listener);
}
