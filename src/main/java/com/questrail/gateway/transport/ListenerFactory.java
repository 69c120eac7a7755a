package com.questrail.gateway.transport;

import com.questrail.gateway.config.ListenerConfig;

/**
 * Creates {@link NetworkListener}s for configured listener entries.
 */
@FunctionalInterface
public interface ListenerFactory
{
    NetworkListener create(ListenerConfig config);
}
