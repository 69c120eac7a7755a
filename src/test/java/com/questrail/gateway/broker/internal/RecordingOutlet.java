package com.questrail.gateway.broker.internal;

import com.questrail.gateway.api.QualityOfService;

import java.util.ArrayList;
import java.util.List;

/**
 * Session outlet that records sent publications.
 */
final class RecordingOutlet implements SessionOutlet
{
    record Sent(BrokerMessage message, QualityOfService qos, int packetId) {}

    private final List<Sent> sent = new ArrayList<>();
    private boolean closed;

    @Override
    public synchronized void send(BrokerMessage message, QualityOfService qos, int packetId) {
        sent.add(new Sent(message, qos, packetId));
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    @Override
    public String remoteAddress() {
        return "test";
    }

    synchronized List<Sent> sent() {
        return new ArrayList<>(sent);
    }

    synchronized boolean isClosed() {
        return closed;
    }
}
