package com.questrail.gateway.broker.internal;

import com.questrail.gateway.api.QualityOfService;

/**
 * One entry of a client SUBSCRIBE packet.
 */
public record SubscriptionRequest(String filter, QualityOfService qos) {
}
