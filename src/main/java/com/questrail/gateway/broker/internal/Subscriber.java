package com.questrail.gateway.broker.internal;

import com.questrail.gateway.api.QualityOfService;

/**
 * Receiver of routed publications: a network client session or a local
 * callback.
 */
interface Subscriber
{
    /**
     * @param message publication to deliver
     * @param qos     effective QoS for this subscriber
     */
    void deliver(BrokerMessage message, QualityOfService qos);
}
