package com.ciro.gatemux.standalone;

import com.ciro.gatemux.bridge.BrowserBridge;
import com.ciro.gatemux.web.TerminalParams;
import com.fasterxml.jackson.databind.JsonNode;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;

/**
 * POSTs que controlan una terminal abierta: input, resize y close.
 */
final class TerminalControlEndpoint {

    private final BrowserBridge bridge;
    private final JsonExchange json;

    TerminalControlEndpoint(BrowserBridge bridge, JsonExchange json) {
        this.bridge = bridge;
        this.json = json;
    }

    /** {@code {sessionId, data}} */
    HttpHandler input() {
        return post((ex, body) -> {
            String sessionId = TerminalParams.requireSessionId(body);
            JsonNode data = body.path("data");
            if (!data.isTextual()) throw new IllegalArgumentException("data must be a string");
            json.complete(ex, bridge.input(sessionId, data.asText()), v -> json.ok());
        });
    }

    /** {@code {sessionId, cols, rows}} */
    HttpHandler resize() {
        return post((ex, body) -> {
            String sessionId = TerminalParams.requireSessionId(body);
            Integer cols = TerminalParams.size(body, "cols");
            Integer rows = TerminalParams.size(body, "rows");
            if (cols == null || rows == null) throw new IllegalArgumentException("cols and rows are required");
            json.complete(ex, bridge.resize(sessionId, cols, rows), v -> json.ok());
        });
    }

    /** {@code {sessionId}} */
    HttpHandler close() {
        return post((ex, body) -> json.complete(ex, bridge.closeTerminal(TerminalParams.requireSessionId(body)), v -> json.ok()));
    }

    private HttpHandler post(BodyHandler handler) {
        return exchange -> {
            if (!json.requireMethod(exchange, "POST")) return;
            json.readBody(exchange, (ex, body) -> {
                try {
                    handler.handle(ex, body);
                } catch (IllegalArgumentException e) {
                    json.fail(ex, e);
                }
            });
        };
    }

    @FunctionalInterface
    private interface BodyHandler {
        void handle(HttpServerExchange exchange, JsonNode body);
    }
}
