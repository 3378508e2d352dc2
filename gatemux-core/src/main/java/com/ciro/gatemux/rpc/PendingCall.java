package com.ciro.gatemux.rpc;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Request en vuelo. Vive en la tabla del {@link RpcCorrelator} hasta que llega su respuesta,
 * vence, el llamador la cancela o se pierde la conexión.
 */
public final class PendingCall {

    private final String id;
    private final String method;
    private final Instant createdAt;
    private final CompletableFuture<JsonNode> future = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timer;

    PendingCall(String id, String method, Instant createdAt) {
        this.id = id;
        this.method = method;
        this.createdAt = createdAt;
    }

    public String id() { return id; }
    public String method() { return method; }
    public Instant createdAt() { return createdAt; }

    CompletableFuture<JsonNode> future() {
        return future;
    }

    void armTimeout(ScheduledFuture<?> t) {
        this.timer = t;
        if (future.isDone()) t.cancel(false);
    }

    void disarm() {
        ScheduledFuture<?> t = timer;
        if (t != null) t.cancel(false);
    }
}
