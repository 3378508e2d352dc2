package com.ciro.gatemux.standalone;

import com.ciro.gatemux.bridge.BridgeChannel;
import com.ciro.gatemux.bridge.BrowserBridge;
import com.ciro.gatemux.error.Errors;
import com.ciro.gatemux.error.SessionNotFoundException;
import com.ciro.gatemux.error.SessionNotReadyException;
import com.ciro.gatemux.web.TerminalParams;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * {@code /ws/terminal}: la terminal por WebSocket. Salida igual que por SSE
 * ({@code {event, data}}); entrada {@code {type:"input"|"resize"|"close", ...}}.
 */
final class WsTerminalEndpoint {

    private static final Logger log = LoggerFactory.getLogger(WsTerminalEndpoint.class);

    private final BrowserBridge bridge;
    private final ObjectMapper mapper;

    WsTerminalEndpoint(BrowserBridge bridge, ObjectMapper mapper) {
        this.bridge = bridge;
        this.mapper = mapper;
    }

    public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        BridgeChannel ch = bridge.open(new UndertowWsSink(channel, mapper));
        channel.addCloseTask(c -> ch.close());

        AtomicReference<String> sessionId = new AtomicReference<>();

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel wsChannel, BufferedTextMessage message) {
                handleInbound(ch, sessionId.get(), message.getData());
            }
        });
        channel.resumeReceives();

        TerminalParams params;
        try {
            params = TerminalParams.fromQuery(exchange.getRequestParameters(), bridge.settings().defaultCommand());
        } catch (IllegalArgumentException e) {
            fail(ch, e);
            return;
        }

        if (params.attach()) {
            if (bridge.attachTerminal(ch, params.sessionId())) {
                sessionId.set(params.sessionId());
            } else {
                fail(ch, new SessionNotFoundException(params.sessionId()));
            }
            return;
        }

        bridge.openTerminal(ch, params.request()).whenComplete((s, err) -> {
            if (err == null) {
                sessionId.set(s.id());
            } else {
                log.warn("WebSocket terminal {} failed to start: {}", ch.id(), Errors.message(err));
            }
        });
    }

    void handleInbound(BridgeChannel ch, String sessionId, String text) {
        JsonNode msg;
        try {
            msg = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            ch.offer(bridge.error(new IllegalArgumentException("Invalid JSON message")));
            return;
        }
        if (sessionId == null) {
            ch.offer(bridge.error(new SessionNotReadyException(ch.id(), "starting")));
            return;
        }
        bridge.command(sessionId, msg).whenComplete((v, err) -> {
            if (err != null) ch.offer(bridge.error(err));
        });
    }

    private void fail(BridgeChannel ch, Throwable t) {
        ch.offer(bridge.error(t));
        ch.finish();
    }
}
