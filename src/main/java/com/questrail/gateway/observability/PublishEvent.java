package com.questrail.gateway.observability;

import com.questrail.gateway.api.QualityOfService;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Record representing a message accepted by the broker for delivery.
 *
 * <p>The payload is copied on construction and on access. Equality compares
 * payload contents.</p>
 */
public record PublishEvent(
    Instant timestamp,
    String topic,
    byte[] payload,
    QualityOfService qos,
    boolean retain
) {
    public PublishEvent {
        Objects.requireNonNull(payload, "payload");
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * Payload rendered as UTF-8 text, for logging.
     */
    public String payloadText() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PublishEvent that)) return false;
        return retain == that.retain
            && Objects.equals(timestamp, that.timestamp)
            && Objects.equals(topic, that.topic)
            && Arrays.equals(payload, that.payload)
            && qos == that.qos;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, topic, Arrays.hashCode(payload), qos, retain);
    }

    @Override
    public String toString() {
        return "PublishEvent[timestamp=" + timestamp + ", topic=" + topic + ", payload=" + payloadText()
            + ", qos=" + qos + ", retain=" + retain + "]";
    }
}
