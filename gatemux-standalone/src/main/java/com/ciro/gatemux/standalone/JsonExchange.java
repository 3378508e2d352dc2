package com.ciro.gatemux.standalone;

import com.ciro.gatemux.error.Errors;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.SameThreadExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Helpers de JSON sobre {@link HttpServerExchange}: leer el body completo, responder,
 * y esperar un {@link CompletableFuture} sin bloquear el hilo de IO.
 */
final class JsonExchange {

    private static final Logger log = LoggerFactory.getLogger(JsonExchange.class);

    static final String JSON = "application/json; charset=utf-8";

    private final ObjectMapper mapper;

    JsonExchange(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    ObjectMapper mapper() {
        return mapper;
    }

    /** Lee el body como objeto JSON. Body vacío = {@code {}}; JSON inválido = 400. */
    void readBody(HttpServerExchange exchange, BiConsumer<HttpServerExchange, JsonNode> then) {
        exchange.getRequestReceiver().receiveFullBytes((ex, bytes) -> {
            JsonNode body;
            try {
                body = parse(bytes);
            } catch (JsonProcessingException e) {
                fail(ex, 400, "BAD_REQUEST", "Invalid JSON body");
                return;
            }
            if (!body.isObject()) {
                fail(ex, 400, "BAD_REQUEST", "JSON body must be an object");
                return;
            }
            then.accept(ex, body);
        }, (ex, err) -> fail(ex, 400, "BAD_REQUEST", Errors.message(err)));
    }

    private JsonNode parse(byte[] bytes) throws JsonProcessingException {
        if (bytes == null || bytes.length == 0) return mapper.createObjectNode();
        String raw = new String(bytes, StandardCharsets.UTF_8).trim();
        if (raw.isEmpty()) return mapper.createObjectNode();
        return mapper.readTree(raw);
    }

    /**
     * Responde cuando termine {@code future}: 200 con {@code onSuccess}, o el status que
     * corresponda al error.
     */
    <T> void complete(HttpServerExchange exchange, CompletableFuture<T> future, Function<T, JsonNode> onSuccess) {
        exchange.dispatch(SameThreadExecutor.INSTANCE, () -> future.whenComplete((value, err) -> {
            if (err != null) {
                fail(exchange, err);
            } else {
                send(exchange, 200, onSuccess.apply(value));
            }
        }));
    }

    void send(HttpServerExchange exchange, int status, JsonNode body) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON);
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-store");
        exchange.getResponseSender().send(json);
    }

    void fail(HttpServerExchange exchange, Throwable err) {
        int status = Errors.httpStatus(err);
        if (status >= 500 && status != 502 && status != 503 && status != 504) {
            log.error("Request {} failed", exchange.getRequestPath(), Errors.unwrap(err));
        } else {
            log.debug("Request {} failed with {}: {}", exchange.getRequestPath(), status, Errors.message(err));
        }
        fail(exchange, status, Errors.code(err), Errors.message(err));
    }

    void fail(HttpServerExchange exchange, int status, String code, String message) {
        ObjectNode n = mapper.createObjectNode();
        n.put("ok", false);
        n.put("error", message);
        if (code != null) n.put("code", code);
        send(exchange, status, n);
    }

    ObjectNode ok() {
        return mapper.createObjectNode().put("ok", true);
    }

    boolean requireMethod(HttpServerExchange exchange, String method) {
        if (exchange.getRequestMethod().equalToString(method)) return true;
        fail(exchange, 405, "METHOD_NOT_ALLOWED", "Only " + method + " is allowed");
        return false;
    }
}
