package com.ciro.gatemux.standalone;

import com.ciro.gatemux.bridge.BridgeChannel;
import com.ciro.gatemux.bridge.BrowserBridge;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** {@code GET /api/activity-stream?topic=a&topic=b} (o {@code topic=a,b}). Sin topic: todo. */
final class ActivityStreamEndpoint implements HttpHandler {

    private final BrowserBridge bridge;
    private final JsonExchange json;
    private final Duration writeTimeout;

    ActivityStreamEndpoint(BrowserBridge bridge, JsonExchange json, Duration writeTimeout) {
        this.bridge = bridge;
        this.json = json;
        this.writeTimeout = writeTimeout;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (!json.requireMethod(exchange, "GET")) return;

        List<String> topics = topics(exchange.getQueryParameters().get("topic"));
        Handlers.serverSentEvents((connection, lastEventId) -> {
            BridgeChannel ch = bridge.open(new UndertowSseSink(connection, json.mapper(), writeTimeout));
            connection.addCloseTask(c -> ch.close());
            bridge.openActivityFeed(ch, topics);
        }).handleRequest(exchange);
    }

    static List<String> topics(Deque<String> raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        for (String v : raw) {
            for (String t : v.split(",")) {
                String topic = t.trim();
                if (!topic.isEmpty() && !out.contains(topic)) out.add(topic);
            }
        }
        return out;
    }
}
