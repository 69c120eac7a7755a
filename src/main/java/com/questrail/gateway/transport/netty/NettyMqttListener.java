package com.questrail.gateway.transport.netty;

import com.questrail.gateway.broker.internal.BrokerCore;
import com.questrail.gateway.config.BrokerConfig;
import com.questrail.gateway.config.ListenerConfig;
import com.questrail.gateway.internal.time.WallClock;
import com.questrail.gateway.observability.GatewayObservabilitySink;
import com.questrail.gateway.transport.ListenerBindException;
import com.questrail.gateway.transport.ListenerException;
import com.questrail.gateway.transport.ListenerKind;
import com.questrail.gateway.transport.NetworkListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.ssl.SslContext;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * NettyMqttListener
 * =============================================================================
 * Netty-backed implementation of the {@link NetworkListener} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>: it binds a server
 * socket and installs the MQTT pipeline on accepted connections. Protocol
 * handling lives in {@link MqttConnectionHandler}; routing lives in
 * {@link BrokerCore}.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code SslContext})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * {@link #serve(Runnable)} loads TLS material (TLS listeners only), binds,
 * reports the bind and then waits for the server channel to close. The event
 * loop groups are shared between listeners and owned by
 * {@link NettyListenerFactory}.
 */
final class NettyMqttListener implements NetworkListener
{
    private final ListenerConfig config;
    private final BrokerConfig brokerConfig;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final BrokerCore core;
    private final GatewayObservabilitySink observabilitySink;
    private final WallClock clock;

    private final Object lock = new Object();
    private Channel serverChannel;
    private boolean closeRequested;

    NettyMqttListener(ListenerConfig config,
                      BrokerConfig brokerConfig,
                      EventLoopGroup bossGroup,
                      EventLoopGroup workerGroup,
                      BrokerCore core,
                      GatewayObservabilitySink observabilitySink,
                      WallClock clock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.brokerConfig = Objects.requireNonNull(brokerConfig, "brokerConfig");
        this.bossGroup = Objects.requireNonNull(bossGroup, "bossGroup");
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
        this.core = Objects.requireNonNull(core, "core");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public ListenerConfig config() {
        return config;
    }

    @Override
    public void serve(Runnable onBound) {
        SslContext sslContext = null;
        if (config.kind() == ListenerKind.TLS) {
            sslContext = TlsContexts.serverContext(config.certFile(), config.keyFile());
        }

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new MqttChannelInitializer(
                        config, brokerConfig, sslContext, core, observabilitySink, clock));

        ChannelFuture bind = bootstrap.bind(resolve(config.bindAddress())).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            throw new ListenerBindException("Binding " + config.kind() + " listener to "
                    + config.bindAddressText() + " failed: " + bind.cause().getMessage(), bind.cause());
        }

        Channel ch = bind.channel();
        boolean closeNow;
        synchronized (lock) {
            serverChannel = ch;
            closeNow = closeRequested;
        }
        if (closeNow) {
            ch.close().awaitUninterruptibly();
            return;
        }

        onBound.run();
        ch.closeFuture().awaitUninterruptibly();

        synchronized (lock) {
            if (closeRequested) {
                return;
            }
        }
        Throwable cause = ch.closeFuture().cause();
        throw new ListenerException("Running " + config.kind() + " listener on "
                + config.bindAddressText() + " failed: server socket closed unexpectedly", cause);
    }

    @Override
    public void close() {
        Channel ch;
        synchronized (lock) {
            closeRequested = true;
            ch = serverChannel;
        }
        if (ch != null) {
            ch.close();
        }
    }

    @Override
    public Optional<InetSocketAddress> boundAddress() {
        Channel ch;
        synchronized (lock) {
            ch = serverChannel;
        }
        if (ch == null) {
            return Optional.empty();
        }
        SocketAddress local = ch.localAddress();
        return local instanceof InetSocketAddress ? Optional.of((InetSocketAddress) local) : Optional.empty();
    }

    private static InetSocketAddress resolve(InetSocketAddress address) {
        if (address.isUnresolved()) {
            return new InetSocketAddress(address.getHostString(), address.getPort());
        }
        return address;
    }
}
