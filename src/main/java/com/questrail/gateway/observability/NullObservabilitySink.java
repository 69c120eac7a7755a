package com.questrail.gateway.observability;

/**
 * No-op implementation of GatewayObservabilitySink.
 */
public final class NullObservabilitySink implements GatewayObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onListenerTransition(ListenerTransitionEvent event) {}

    @Override
    public void onClientConnection(ClientConnectionEvent event) {}

    @Override
    public void onPublish(PublishEvent event) {}

    @Override
    public void onError(GatewayErrorEvent event) {}
}
