package com.questrail.gateway.transport.netty;

import com.questrail.gateway.broker.internal.BrokerCore;
import com.questrail.gateway.config.BrokerConfig;
import com.questrail.gateway.config.ListenerConfig;
import com.questrail.gateway.internal.time.WallClock;
import com.questrail.gateway.observability.GatewayObservabilitySink;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.timeout.IdleStateHandler;

import java.util.concurrent.TimeUnit;

/**
 * Builds the pipeline of an accepted connection.
 *
 * <pre>
 *   PLAIN:     idle → mqtt-decoder → mqtt-encoder → mqtt-handler
 *   TLS:       tls → idle → mqtt-decoder → mqtt-encoder → mqtt-handler
 *   WEBSOCKET: http-codec → http-aggregator → ws-protocol → ws-aggregator
 *              → ws-frames → idle → mqtt-decoder → mqtt-encoder → mqtt-handler
 * </pre>
 *
 * <p>The {@code idle} handler first enforces the CONNECT timeout and is
 * replaced by the keep-alive timeout once the client connected.</p>
 */
final class MqttChannelInitializer extends ChannelInitializer<SocketChannel>
{
    static final String IDLE_HANDLER = "idle";

    private static final String WEBSOCKET_SUBPROTOCOLS = "mqtt, mqttv3.1, mqttv3.1.1";

    private final ListenerConfig listener;
    private final BrokerConfig brokerConfig;
    private final SslContext sslContext;
    private final BrokerCore core;
    private final GatewayObservabilitySink observabilitySink;
    private final WallClock clock;

    MqttChannelInitializer(ListenerConfig listener,
                           BrokerConfig brokerConfig,
                           SslContext sslContext,
                           BrokerCore core,
                           GatewayObservabilitySink observabilitySink,
                           WallClock clock)
    {
        this.listener = listener;
        this.brokerConfig = brokerConfig;
        this.sslContext = sslContext;
        this.core = core;
        this.observabilitySink = observabilitySink;
        this.clock = clock;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline p = ch.pipeline();

        switch (listener.kind()) {
            case TLS:
                p.addLast("tls", sslContext.newHandler(ch.alloc()));
                break;
            case WEBSOCKET:
                p.addLast("http-codec", new HttpServerCodec());
                p.addLast("http-aggregator", new HttpObjectAggregator(65536));
                p.addLast("ws-protocol", new WebSocketServerProtocolHandler(
                        listener.path(), WEBSOCKET_SUBPROTOCOLS, false, brokerConfig.maxMessageSize()));
                p.addLast("ws-aggregator", new WebSocketFrameAggregator(brokerConfig.maxMessageSize()));
                p.addLast("ws-frames", new WebSocketFrameCodec());
                break;
            default:
                break;
        }

        p.addLast(IDLE_HANDLER, new IdleStateHandler(
                brokerConfig.connectTimeout().toMillis(), 0, 0, TimeUnit.MILLISECONDS));
        p.addLast("mqtt-decoder", new MqttDecoder(brokerConfig.maxMessageSize()));
        p.addLast("mqtt-encoder", MqttEncoder.INSTANCE);
        p.addLast("mqtt-handler", new MqttConnectionHandler(core, observabilitySink, clock));
    }
}
