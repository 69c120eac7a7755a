package com.questrail.gateway.broker.internal;

import com.questrail.gateway.api.QualityOfService;

import java.util.Objects;

/**
 * A publication as routed inside the broker.
 */
public record BrokerMessage(String topic, byte[] payload, QualityOfService qos, boolean retain)
{
    public BrokerMessage {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(qos, "qos");
    }

    public BrokerMessage withRetain(boolean newRetain) {
        return newRetain == retain ? this : new BrokerMessage(topic, payload, qos, newRetain);
    }
}
