package com.ciro.gatemux.standalone;

import com.ciro.gatemux.Gatemux;
import com.ciro.gatemux.connection.GatewayConnection;
import com.ciro.gatemux.connection.GatewayEndpoint;
import com.ciro.gatemux.error.Errors;
import com.ciro.gatemux.web.GatewayConfigRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Methods;
import io.undertow.util.SameThreadExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Estado y administración de la conexión al gateway: status, reconexión manual y
 * cambio de URL/token en caliente.
 */
final class GatewayAdminEndpoint {

    private static final Logger log = LoggerFactory.getLogger(GatewayAdminEndpoint.class);

    private final Gatemux gatemux;
    private final JsonExchange json;
    private final Duration reconnectTimeout;

    GatewayAdminEndpoint(Gatemux gatemux, JsonExchange json, Duration reconnectTimeout) {
        this.gatemux = gatemux;
        this.json = json;
        this.reconnectTimeout = reconnectTimeout;
    }

    /** {@code GET /api/gateway-status} */
    HttpHandler status() {
        return exchange -> {
            if (!json.requireMethod(exchange, "GET")) return;
            ObjectNode body = json.ok();
            body.setAll(gatemux.connection().status().toJson(json.mapper()));
            body.put("execSessions", gatemux.exec().size());
            body.put("bridgeChannels", gatemux.bridge().activeChannels());
            json.send(exchange, 200, body);
        };
    }

    /** {@code POST /api/debug/reconnect}: 503 si el enlace nuevo no abre. */
    HttpHandler reconnect() {
        return exchange -> {
            if (!json.requireMethod(exchange, "POST")) return;
            GatewayConnection connection = gatemux.connection();
            CompletableFuture<Void> opened = connection.reconnectNow()
                    .orTimeout(reconnectTimeout.toMillis(), TimeUnit.MILLISECONDS);

            exchange.dispatch(SameThreadExecutor.INSTANCE, () -> opened.whenComplete((v, err) -> {
                ObjectNode body = json.mapper().createObjectNode();
                body.put("ok", err == null);
                body.put("state", connection.state().label());
                if (err != null) {
                    log.warn("Manual reconnect failed: {}", Errors.message(err));
                    body.put("error", Errors.message(err));
                    json.send(exchange, 503, body);
                } else {
                    json.send(exchange, 200, body);
                }
            }));
        };
    }

    /** {@code GET|POST /api/gateway-config} */
    HttpHandler config() {
        return exchange -> {
            if (Methods.GET.equals(exchange.getRequestMethod())) {
                GatewayEndpoint current = gatemux.connection().endpoint();
                ObjectNode body = json.ok();
                body.put("url", current.url().toString());
                body.put("hasToken", current.token() != null);
                json.send(exchange, 200, body);
                return;
            }
            if (!json.requireMethod(exchange, "POST")) return;
            json.readBody(exchange, this::updateConfig);
        };
    }

    private void updateConfig(HttpServerExchange exchange, JsonNode body) {
        GatewayEndpoint updated;
        try {
            updated = GatewayConfigRequest.merge(gatemux.connection().endpoint(), body);
        } catch (IllegalArgumentException e) {
            json.fail(exchange, e);
            return;
        }

        CompletableFuture<Void> opened = gatemux.connection().updateEndpoint(updated)
                .orTimeout(reconnectTimeout.toMillis(), TimeUnit.MILLISECONDS);

        exchange.dispatch(SameThreadExecutor.INSTANCE, () -> opened.whenComplete((v, err) -> {
            ObjectNode res = json.ok();
            res.put("connected", err == null);
            if (err != null) {
                log.warn("Gateway config saved but connection failed: {}", Errors.message(err));
                res.put("error", GatewayConfigRequest.SAVED_BUT_FAILED + Errors.message(err));
            }
            json.send(exchange, 200, res);
        }));
    }
}
