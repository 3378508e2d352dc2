package com.ciro.gatemux.standalone;

import com.ciro.gatemux.bridge.BridgeChannel;
import com.ciro.gatemux.bridge.BrowserBridge;
import com.ciro.gatemux.error.Errors;
import com.ciro.gatemux.error.SessionNotFoundException;
import com.ciro.gatemux.exec.ExecSessionManager;
import com.ciro.gatemux.web.TerminalParams;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * {@code /api/terminal-stream}: SSE de una terminal. GET con query string o POST con
 * body JSON; con {@code sessionId} se adjunta a una sesión que ya existe.
 */
final class TerminalStreamEndpoint implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(TerminalStreamEndpoint.class);

    private final BrowserBridge bridge;
    private final ExecSessionManager exec;
    private final JsonExchange json;
    private final Duration writeTimeout;

    TerminalStreamEndpoint(BrowserBridge bridge, ExecSessionManager exec, JsonExchange json, Duration writeTimeout) {
        this.bridge = bridge;
        this.exec = exec;
        this.json = json;
        this.writeTimeout = writeTimeout;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        List<String> defaults = bridge.settings().defaultCommand();

        if (Methods.GET.equals(exchange.getRequestMethod())) {
            TerminalParams params;
            try {
                params = TerminalParams.fromQuery(exchange.getQueryParameters(), defaults);
            } catch (IllegalArgumentException e) {
                json.fail(exchange, e);
                return;
            }
            stream(exchange, params);
            return;
        }

        if (Methods.POST.equals(exchange.getRequestMethod())) {
            json.readBody(exchange, (ex, body) -> {
                TerminalParams params;
                try {
                    params = TerminalParams.fromJson(body, defaults);
                } catch (IllegalArgumentException e) {
                    json.fail(ex, e);
                    return;
                }
                try {
                    stream(ex, params);
                } catch (Exception e) {
                    json.fail(ex, e);
                }
            });
            return;
        }

        json.fail(exchange, 405, "METHOD_NOT_ALLOWED", "Only GET and POST are allowed");
    }

    private void stream(HttpServerExchange exchange, TerminalParams params) throws Exception {
        if (params.attach() && exec.get(params.sessionId()).isEmpty()) {
            json.fail(exchange, new SessionNotFoundException(params.sessionId()));
            return;
        }

        Handlers.serverSentEvents((connection, lastEventId) -> {
            BridgeChannel ch = bridge.open(new UndertowSseSink(connection, json.mapper(), writeTimeout));
            connection.addCloseTask(c -> ch.close());

            if (params.attach()) {
                if (!bridge.attachTerminal(ch, params.sessionId())) {
                    // se cerró entre el chequeo y el upgrade
                    ch.offer(bridge.error(new SessionNotFoundException(params.sessionId())));
                    ch.finish();
                    return;
                }
                log.debug("Channel {} attached to exec session {}", ch.id(), params.sessionId());
                return;
            }

            bridge.openTerminal(ch, params.request()).whenComplete((s, err) -> {
                if (err != null) {
                    log.warn("Terminal for channel {} failed to start: {}", ch.id(), Errors.message(err));
                } else {
                    log.debug("Channel {} streaming exec session {}", ch.id(), s.id());
                }
            });
        }).handleRequest(exchange);
    }
}
