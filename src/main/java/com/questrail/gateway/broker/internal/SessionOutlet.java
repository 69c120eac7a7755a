package com.questrail.gateway.broker.internal;

import com.questrail.gateway.api.QualityOfService;

/**
 * Outbound side of a network client connection.
 *
 * <p>Implemented by the transport adapter. Calls may arrive from any
 * thread.</p>
 */
public interface SessionOutlet
{
    /**
     * Write a PUBLISH packet to the client.
     *
     * @param packetId packet identifier, {@code 0} for QoS 0
     */
    void send(BrokerMessage message, QualityOfService qos, int packetId);

    /**
     * Close the connection.
     */
    void close();

    String remoteAddress();
}
