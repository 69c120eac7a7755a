package com.questrail.gateway.broker.internal;

import com.questrail.gateway.api.QualityOfService;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one connected MQTT client.
 *
 * <p>Sessions are always clean: subscriptions and in-flight state live only as
 * long as the connection.</p>
 */
public final class ClientSession implements Subscriber
{
    private final String clientId;
    private final SessionOutlet outlet;
    private final AtomicReference<BrokerMessage> will;

    private final Map<String, QualityOfService> subscriptions = new ConcurrentHashMap<>();
    private final Set<Integer> pendingExactlyOnce = ConcurrentHashMap.newKeySet();
    private final AtomicInteger packetIds = new AtomicInteger();

    ClientSession(String clientId, SessionOutlet outlet, BrokerMessage will) {
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.outlet = Objects.requireNonNull(outlet, "outlet");
        this.will = new AtomicReference<>(will);
    }

    public String clientId() {
        return clientId;
    }

    public SessionOutlet outlet() {
        return outlet;
    }

    @Override
    public void deliver(BrokerMessage message, QualityOfService qos) {
        int packetId = qos == QualityOfService.AT_MOST_ONCE ? 0 : nextPacketId();
        outlet.send(message, qos, packetId);
    }

    /**
     * Records an inbound QoS 2 packet id.
     *
     * @return {@code true} if the id was not already pending, i.e. the
     *         publication has to be routed
     */
    public boolean beginExactlyOnce(int packetId) {
        return pendingExactlyOnce.add(packetId);
    }

    /**
     * Releases an inbound QoS 2 packet id on PUBREL.
     */
    public void completeExactlyOnce(int packetId) {
        pendingExactlyOnce.remove(packetId);
    }

    Map<String, QualityOfService> subscriptions() {
        return subscriptions;
    }

    BrokerMessage takeWill() {
        return will.getAndSet(null);
    }

    /**
     * Drops the will message; used on DISCONNECT and takeover.
     */
    public void clearWill() {
        will.set(null);
    }

    private int nextPacketId() {
        while (true) {
            int id = packetIds.incrementAndGet() & 0xFFFF;
            if (id != 0) {
                return id;
            }
        }
    }

    @Override
    public String toString() {
        return "ClientSession[" + clientId + "@" + outlet.remoteAddress() + "]";
    }
}
