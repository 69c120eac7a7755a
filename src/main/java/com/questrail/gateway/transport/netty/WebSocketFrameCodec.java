package com.questrail.gateway.transport.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;

import java.util.List;

/**
 * Unwraps MQTT bytes from binary WebSocket frames and wraps outbound MQTT
 * bytes into them. Sits between the WebSocket protocol handler and the MQTT
 * codec.
 */
final class WebSocketFrameCodec extends MessageToMessageCodec<BinaryWebSocketFrame, ByteBuf>
{
    @Override
    protected void encode(ChannelHandlerContext ctx, ByteBuf msg, List<Object> out) {
        out.add(new BinaryWebSocketFrame(msg.retain()));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, BinaryWebSocketFrame frame, List<Object> out) {
        out.add(frame.content().retain());
    }
}
