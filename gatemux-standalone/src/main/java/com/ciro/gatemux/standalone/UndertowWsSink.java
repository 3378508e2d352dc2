package com.ciro.gatemux.standalone;

import com.ciro.gatemux.bridge.BridgeMessage;
import com.ciro.gatemux.spi.BridgeSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.xnio.IoUtils;

import java.io.IOException;

/** Un mensaje del bridge = un frame de texto {@code {event, data}}. */
final class UndertowWsSink implements BridgeSink {

    private final WebSocketChannel channel;
    private final ObjectMapper mapper;

    UndertowWsSink(WebSocketChannel channel, ObjectMapper mapper) {
        this.channel = channel;
        this.mapper = mapper;
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameSent();
    }

    @Override
    public void send(BridgeMessage message) throws IOException {
        WebSockets.sendTextBlocking(message.toJson(mapper), channel);
    }

    @Override
    public void close() {
        IoUtils.safeClose(channel);
    }
}
