package com.ciro.gatemux.spring;

import com.ciro.gatemux.bridge.BridgeMessage;
import com.ciro.gatemux.spi.BridgeSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link BridgeSink} sobre un {@link WebSocketSession}. El canal del bridge escribe de a un
 * mensaje por vez, así que no hace falta decorar la sesión.
 */
class SpringWsSink implements BridgeSink {

    private static final Logger log = LoggerFactory.getLogger(SpringWsSink.class);

    private final WebSocketSession session;
    private final ObjectMapper mapper;

    SpringWsSink(WebSocketSession session, ObjectMapper mapper) {
        this.session = session;
        this.mapper = mapper;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(BridgeMessage message) throws IOException {
        session.sendMessage(new TextMessage(message.toJson(mapper)));
    }

    @Override
    public void close() {
        if (!session.isOpen()) return;
        try {
            session.close();
        } catch (IOException e) {
            log.debug("Closing WebSocket {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
