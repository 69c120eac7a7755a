package com.questrail.gateway.transport.netty;

import com.questrail.gateway.api.QualityOfService;
import com.questrail.gateway.broker.internal.BrokerCore;
import com.questrail.gateway.broker.internal.BrokerMessage;
import com.questrail.gateway.broker.internal.ClientSession;
import com.questrail.gateway.broker.internal.SessionOutlet;
import com.questrail.gateway.broker.internal.SubscriptionRequest;
import com.questrail.gateway.broker.internal.TopicNames;
import com.questrail.gateway.internal.time.WallClock;
import com.questrail.gateway.observability.ClientConnectionEvent;
import com.questrail.gateway.observability.GatewayErrorEvent;
import com.questrail.gateway.observability.GatewayObservabilitySink;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttConnAckVariableHeader;
import io.netty.handler.codec.mqtt.MqttConnectMessage;
import io.netty.handler.codec.mqtt.MqttConnectPayload;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttConnectVariableHeader;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttIdentifierRejectedException;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageIdVariableHeader;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPubAckMessage;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttPublishVariableHeader;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttSubAckMessage;
import io.netty.handler.codec.mqtt.MqttSubAckPayload;
import io.netty.handler.codec.mqtt.MqttSubscribeMessage;
import io.netty.handler.codec.mqtt.MqttTopicSubscription;
import io.netty.handler.codec.mqtt.MqttUnacceptableProtocolVersionException;
import io.netty.handler.codec.mqtt.MqttUnsubAckMessage;
import io.netty.handler.codec.mqtt.MqttUnsubscribeMessage;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * MqttConnectionHandler
 * =============================================================================
 * Server side of one MQTT 3.1 / 3.1.1 connection.
 *
 * <p>Translates decoded MQTT packets into {@link BrokerCore} calls and
 * implements {@link SessionOutlet} so the core can push publications to the
 * client. Netty types do not leave this package: the core only sees
 * {@link BrokerMessage}s and the outlet interface.</p>
 *
 * <h2>Protocol rules enforced</h2>
 * <ul>
 *   <li>The first packet must be CONNECT; a second CONNECT closes the connection.</li>
 *   <li>Sessions are clean. An empty client id is replaced by a generated one
 *       (rejected if the client asked for a persistent session).</li>
 *   <li>Keep-alive: the connection is closed after 1.5 × keep-alive without
 *       inbound traffic.</li>
 *   <li>The will message is published when the connection ends without
 *       DISCONNECT.</li>
 *   <li>Inbound QoS 2 publications are routed on PUBLISH; the packet id is
 *       remembered until PUBREL so duplicates are not routed twice.</li>
 * </ul>
 *
 * <p>All inbound callbacks run on the channel's event loop. {@link #send}
 * may be called from any thread.</p>
 */
final class MqttConnectionHandler extends SimpleChannelInboundHandler<MqttMessage> implements SessionOutlet
{
    private static final int MQTT_3_1 = 3;
    private static final int MQTT_3_1_1 = 4;

    private final BrokerCore core;
    private final GatewayObservabilitySink observabilitySink;
    private final WallClock clock;

    private volatile Channel channel;
    private ClientSession session;
    private boolean graceful;

    MqttConnectionHandler(BrokerCore core, GatewayObservabilitySink observabilitySink, WallClock clock) {
        this.core = core;
        this.observabilitySink = observabilitySink;
        this.clock = clock;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        channel = ctx.channel();
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, MqttMessage msg) {
        if (msg.decoderResult().isFailure()) {
            onDecoderFailure(ctx, msg.decoderResult().cause());
            return;
        }

        MqttMessageType type = msg.fixedHeader().messageType();
        if (session == null && type != MqttMessageType.CONNECT) {
            protocolViolation(ctx, "first packet is " + type + ", expected CONNECT");
            return;
        }

        switch (type) {
            case CONNECT:
                onConnect(ctx, (MqttConnectMessage) msg);
                break;
            case PUBLISH:
                onPublish(ctx, (MqttPublishMessage) msg);
                break;
            case PUBACK:
                // no retransmission, nothing to release
                break;
            case PUBREC:
                ctx.writeAndFlush(ack(MqttMessageType.PUBREL, MqttQoS.AT_LEAST_ONCE, messageId(msg)));
                break;
            case PUBREL:
                session.completeExactlyOnce(messageId(msg));
                ctx.writeAndFlush(ack(MqttMessageType.PUBCOMP, MqttQoS.AT_MOST_ONCE, messageId(msg)));
                break;
            case PUBCOMP:
                break;
            case SUBSCRIBE:
                onSubscribe(ctx, (MqttSubscribeMessage) msg);
                break;
            case UNSUBSCRIBE:
                onUnsubscribe(ctx, (MqttUnsubscribeMessage) msg);
                break;
            case PINGREQ:
                ctx.writeAndFlush(new MqttMessage(fixedHeader(MqttMessageType.PINGRESP, MqttQoS.AT_MOST_ONCE)));
                break;
            case DISCONNECT:
                graceful = true;
                session.clearWill();
                ctx.close();
                break;
            default:
                protocolViolation(ctx, "unexpected packet " + type);
                break;
        }
    }

    // -------------------------------------------------------------------------
    // Inbound packets
    // -------------------------------------------------------------------------

    private void onConnect(ChannelHandlerContext ctx, MqttConnectMessage connect) {
        if (session != null) {
            protocolViolation(ctx, "second CONNECT");
            return;
        }
        MqttConnectVariableHeader header = connect.variableHeader();
        MqttConnectPayload payload = connect.payload();

        if (header.version() != MQTT_3_1 && header.version() != MQTT_3_1_1) {
            refuse(ctx, MqttConnectReturnCode.CONNECTION_REFUSED_UNSUPPORTED_PROTOCOL_VERSION);
            return;
        }

        String clientId = payload.clientIdentifier();
        if (clientId == null || clientId.isEmpty()) {
            if (!header.isCleanSession()) {
                refuse(ctx, MqttConnectReturnCode.CONNECTION_REFUSED_IDENTIFIER_REJECTED);
                return;
            }
            clientId = "auto-" + UUID.randomUUID();
        }

        BrokerMessage will = null;
        if (header.isWillFlag()) {
            String invalid = TopicNames.validateName(payload.willTopic());
            if (invalid != null) {
                protocolViolation(ctx, "invalid will topic '" + payload.willTopic() + "': " + invalid);
                return;
            }
            will = new BrokerMessage(
                    payload.willTopic(),
                    payload.willMessageInBytes(),
                    QualityOfService.fromValue(header.willQos()),
                    header.isWillRetain());
        }

        int keepAlive = header.keepAliveTimeSeconds();
        if (keepAlive > 0) {
            long timeoutMillis = keepAlive * 1500L;
            ctx.pipeline().replace(MqttChannelInitializer.IDLE_HANDLER, MqttChannelInitializer.IDLE_HANDLER,
                    new IdleStateHandler(timeoutMillis, 0, 0, TimeUnit.MILLISECONDS));
        } else {
            ctx.pipeline().remove(MqttChannelInitializer.IDLE_HANDLER);
        }

        session = core.connect(clientId, this, will);
        ctx.writeAndFlush(new MqttConnAckMessage(
                fixedHeader(MqttMessageType.CONNACK, MqttQoS.AT_MOST_ONCE),
                new MqttConnAckVariableHeader(MqttConnectReturnCode.CONNECTION_ACCEPTED, false)));

        observabilitySink.onClientConnection(new ClientConnectionEvent(
                clock.now(), clientId, remoteAddress(), true, false));
    }

    private void onPublish(ChannelHandlerContext ctx, MqttPublishMessage publish) {
        String topic = publish.variableHeader().topicName();
        String invalid = TopicNames.validateName(topic);
        if (invalid != null) {
            protocolViolation(ctx, "invalid topic '" + topic + "': " + invalid);
            return;
        }

        MqttQoS mqttQos = publish.fixedHeader().qosLevel();
        int packetId = publish.variableHeader().packetId();
        BrokerMessage message = new BrokerMessage(
                topic,
                copy(publish.payload()),
                QualityOfService.fromValue(mqttQos.value()),
                publish.fixedHeader().isRetain());

        switch (mqttQos) {
            case AT_MOST_ONCE:
                core.publish(message);
                break;
            case AT_LEAST_ONCE:
                core.publish(message);
                ctx.writeAndFlush(new MqttPubAckMessage(
                        fixedHeader(MqttMessageType.PUBACK, MqttQoS.AT_MOST_ONCE),
                        MqttMessageIdVariableHeader.from(packetId)));
                break;
            case EXACTLY_ONCE:
                if (session.beginExactlyOnce(packetId)) {
                    core.publish(message);
                }
                ctx.writeAndFlush(ack(MqttMessageType.PUBREC, MqttQoS.AT_MOST_ONCE, packetId));
                break;
            default:
                protocolViolation(ctx, "invalid QoS " + mqttQos);
                break;
        }
    }

    private void onSubscribe(ChannelHandlerContext ctx, MqttSubscribeMessage subscribe) {
        List<SubscriptionRequest> requests = new ArrayList<>();
        for (MqttTopicSubscription s : subscribe.payload().topicSubscriptions()) {
            requests.add(new SubscriptionRequest(
                    s.topicName(),
                    QualityOfService.fromValue(s.qualityOfService().value())));
        }

        List<Optional<QualityOfService>> granted = core.subscribe(session, requests);

        int[] codes = new int[granted.size()];
        List<SubscriptionRequest> accepted = new ArrayList<>();
        for (int i = 0; i < codes.length; i++) {
            Optional<QualityOfService> g = granted.get(i);
            codes[i] = g.map(QualityOfService::value).orElse(MqttQoS.FAILURE.value());
            if (g.isPresent()) {
                accepted.add(new SubscriptionRequest(requests.get(i).filter(), g.get()));
            }
        }

        ctx.writeAndFlush(new MqttSubAckMessage(
                fixedHeader(MqttMessageType.SUBACK, MqttQoS.AT_MOST_ONCE),
                MqttMessageIdVariableHeader.from(subscribe.variableHeader().messageId()),
                new MqttSubAckPayload(codes)));

        core.deliverRetained(session, accepted);
    }

    private void onUnsubscribe(ChannelHandlerContext ctx, MqttUnsubscribeMessage unsubscribe) {
        core.unsubscribe(session, unsubscribe.payload().topics());
        ctx.writeAndFlush(new MqttUnsubAckMessage(
                fixedHeader(MqttMessageType.UNSUBACK, MqttQoS.AT_MOST_ONCE),
                MqttMessageIdVariableHeader.from(unsubscribe.variableHeader().messageId())));
    }

    private void onDecoderFailure(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof MqttUnacceptableProtocolVersionException) {
            refuse(ctx, MqttConnectReturnCode.CONNECTION_REFUSED_UNACCEPTABLE_PROTOCOL_VERSION);
        } else if (cause instanceof MqttIdentifierRejectedException) {
            refuse(ctx, MqttConnectReturnCode.CONNECTION_REFUSED_IDENTIFIER_REJECTED);
        } else {
            protocolViolation(ctx, "malformed packet: " + cause.getMessage());
        }
    }

    // -------------------------------------------------------------------------
    // Connection lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        ClientSession s = session;
        if (s != null) {
            core.disconnect(s, graceful);
            observabilitySink.onClientConnection(new ClientConnectionEvent(
                    clock.now(), s.clientId(), remoteAddress(), false, graceful));
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        observabilitySink.onError(new GatewayErrorEvent(
                clock.now(),
                "Connection from " + remoteAddress() + " failed: " + cause.getMessage(),
                cause));
        ctx.close();
    }

    // -------------------------------------------------------------------------
    // SessionOutlet
    // -------------------------------------------------------------------------

    @Override
    public void send(BrokerMessage message, QualityOfService qos, int packetId) {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return;
        }
        MqttQoS mqttQos = MqttQoS.valueOf(qos.value());
        ch.writeAndFlush(new MqttPublishMessage(
                new MqttFixedHeader(MqttMessageType.PUBLISH, false, mqttQos, message.retain(), 0),
                new MqttPublishVariableHeader(message.topic(), packetId),
                Unpooled.wrappedBuffer(message.payload())));
    }

    @Override
    public void close() {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }

    @Override
    public String remoteAddress() {
        Channel ch = channel;
        SocketAddress remote = ch == null ? null : ch.remoteAddress();
        return remote == null ? "unknown" : remote.toString();
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void refuse(ChannelHandlerContext ctx, MqttConnectReturnCode code) {
        ctx.writeAndFlush(new MqttConnAckMessage(
                fixedHeader(MqttMessageType.CONNACK, MqttQoS.AT_MOST_ONCE),
                new MqttConnAckVariableHeader(code, false)))
                .addListener(ChannelFutureListener.CLOSE);
    }

    private void protocolViolation(ChannelHandlerContext ctx, String reason) {
        observabilitySink.onError(new GatewayErrorEvent(
                clock.now(),
                "Protocol violation by " + remoteAddress() + ": " + reason,
                null));
        ctx.close();
    }

    private static MqttMessage ack(MqttMessageType type, MqttQoS headerQos, int packetId) {
        return new MqttMessage(fixedHeader(type, headerQos), MqttMessageIdVariableHeader.from(packetId));
    }

    private static MqttFixedHeader fixedHeader(MqttMessageType type, MqttQoS qos) {
        return new MqttFixedHeader(type, false, qos, false, 0);
    }

    private static int messageId(MqttMessage msg) {
        return ((MqttMessageIdVariableHeader) msg.variableHeader()).messageId();
    }

    private static byte[] copy(ByteBuf buf) {
        byte[] bytes = new byte[buf.readableBytes()];
        buf.getBytes(buf.readerIndex(), bytes);
        return bytes;
    }
}
