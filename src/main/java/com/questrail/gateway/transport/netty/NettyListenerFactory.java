package com.questrail.gateway.transport.netty;

import com.questrail.gateway.broker.internal.BrokerCore;
import com.questrail.gateway.config.BrokerConfig;
import com.questrail.gateway.config.ListenerConfig;
import com.questrail.gateway.internal.time.WallClock;
import com.questrail.gateway.observability.GatewayObservabilitySink;
import com.questrail.gateway.transport.ListenerFactory;
import com.questrail.gateway.transport.NetworkListener;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Creates Netty listeners sharing one boss and one worker event loop group.
 *
 * <p>{@link #close()} must be called after all listeners have stopped.</p>
 */
public final class NettyListenerFactory implements ListenerFactory, AutoCloseable
{
    private final BrokerConfig brokerConfig;
    private final BrokerCore core;
    private final GatewayObservabilitySink observabilitySink;
    private final WallClock clock;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;

    public NettyListenerFactory(BrokerConfig brokerConfig,
                                BrokerCore core,
                                GatewayObservabilitySink observabilitySink,
                                WallClock clock)
    {
        this.brokerConfig = Objects.requireNonNull(brokerConfig, "brokerConfig");
        this.core = Objects.requireNonNull(core, "core");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
    }

    @Override
    public NetworkListener create(ListenerConfig config) {
        return new NettyMqttListener(config, brokerConfig, bossGroup, workerGroup, core, observabilitySink, clock);
    }

    /**
     * Shuts down the event loop groups and waits for their termination.
     */
    @Override
    public void close() {
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }
}
