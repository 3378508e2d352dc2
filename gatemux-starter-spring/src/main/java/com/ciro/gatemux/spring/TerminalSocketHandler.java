package com.ciro.gatemux.spring;

import com.ciro.gatemux.bridge.BridgeChannel;
import com.ciro.gatemux.bridge.BrowserBridge;
import com.ciro.gatemux.error.Errors;
import com.ciro.gatemux.error.SessionNotFoundException;
import com.ciro.gatemux.error.SessionNotReadyException;
import com.ciro.gatemux.web.TerminalParams;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ADAPTADOR: Spring WebSocket -> BrowserBridge. Una conexión = una terminal.
 */
public class TerminalSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TerminalSocketHandler.class);

    private final BrowserBridge bridge;
    private final ObjectMapper mapper;
    private final Map<String, Terminal> terminals = new ConcurrentHashMap<>();

    public TerminalSocketHandler(BrowserBridge bridge, ObjectMapper mapper) {
        this.bridge = bridge;
        this.mapper = mapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        BridgeChannel ch = bridge.open(new SpringWsSink(session, mapper));
        Terminal t = new Terminal(ch);
        terminals.put(session.getId(), t);

        TerminalParams params;
        try {
            params = TerminalParams.fromQuery(query(session.getUri()), bridge.settings().defaultCommand());
        } catch (IllegalArgumentException e) {
            fail(ch, e);
            return;
        }

        if (params.attach()) {
            if (bridge.attachTerminal(ch, params.sessionId())) {
                t.sessionId.set(params.sessionId());
            } else {
                fail(ch, new SessionNotFoundException(params.sessionId()));
            }
            return;
        }

        bridge.openTerminal(ch, params.request()).whenComplete((s, err) -> {
            if (err == null) {
                t.sessionId.set(s.id());
            } else {
                log.warn("WebSocket terminal {} failed to start: {}", ch.id(), Errors.message(err));
            }
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Terminal t = terminals.get(session.getId());
        if (t == null) return;

        JsonNode msg;
        try {
            msg = mapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            t.channel.offer(bridge.error(new IllegalArgumentException("Invalid JSON message")));
            return;
        }
        String sessionId = t.sessionId.get();
        if (sessionId == null) {
            t.channel.offer(bridge.error(new SessionNotReadyException(t.channel.id(), "starting")));
            return;
        }
        bridge.command(sessionId, msg).whenComplete((v, err) -> {
            if (err != null) t.channel.offer(bridge.error(err));
        });
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Terminal t = terminals.remove(session.getId());
        if (t != null) t.channel.close();
    }

    int openTerminals() {
        return terminals.size();
    }

    private void fail(BridgeChannel ch, Throwable t) {
        ch.offer(bridge.error(t));
        ch.finish();
    }

    static Map<String, List<String>> query(URI uri) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        if (uri == null) return out;
        MultiValueMap<String, String> raw = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        raw.forEach((k, values) -> {
            List<String> decoded = new ArrayList<>();
            for (String v : values) decoded.add(v == null ? "" : UriUtils.decode(v, StandardCharsets.UTF_8));
            out.put(UriUtils.decode(k, StandardCharsets.UTF_8), decoded);
        });
        return out;
    }

    private static final class Terminal {
        final BridgeChannel channel;
        final AtomicReference<String> sessionId = new AtomicReference<>();

        Terminal(BridgeChannel channel) {
            this.channel = channel;
        }
    }
}
