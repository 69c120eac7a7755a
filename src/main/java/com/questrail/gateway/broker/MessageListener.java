package com.questrail.gateway.broker;

import com.questrail.gateway.api.QualityOfService;

/**
 * Local delivery callback for broker subscriptions.
 *
 * <p>Callbacks of all local subscriptions are invoked on a single broker
 * delivery thread, in publication order. Implementations must not block.</p>
 */
@FunctionalInterface
public interface MessageListener
{
    /**
     * @param topic    topic the message was published on
     * @param payload  message payload; the array is owned by the listener
     * @param qos      delivered QoS (minimum of publication and subscription)
     * @param retained whether the message is a retained message delivered on subscribe
     */
    void onMessage(String topic, byte[] payload, QualityOfService qos, boolean retained);
}
