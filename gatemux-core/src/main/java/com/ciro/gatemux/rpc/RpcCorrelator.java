package com.ciro.gatemux.rpc;

import com.ciro.gatemux.error.ConnectionLostException;
import com.ciro.gatemux.error.GatewayErrorException;
import com.ciro.gatemux.error.RpcTimeoutException;
import com.ciro.gatemux.protocol.RequestFrame;
import com.ciro.gatemux.protocol.ResponseFrame;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Empareja requests con sus respuestas por id. No asume orden FIFO.
 *
 * <p>Cada {@link #call} devuelve un future que termina exactamente una vez: con el resultado,
 * con {@link GatewayErrorException}, con {@link RpcTimeoutException} o con
 * {@link ConnectionLostException} vía {@link #rejectAll}. Cancelar el future abandona la llamada
 * localmente; si la respuesta llega después se descarta.
 */
public class RpcCorrelator {

    private static final Logger log = LoggerFactory.getLogger(RpcCorrelator.class);

    private final Map<String, PendingCall> pending = new ConcurrentHashMap<>();
    private final RequestIdGenerator ids = new RequestIdGenerator();

    private final ScheduledExecutorService scheduler;
    private final Duration defaultTimeout;
    private final Clock clock;

    private volatile FrameSender sender;

    public RpcCorrelator(ScheduledExecutorService scheduler, Duration defaultTimeout) {
        this(scheduler, defaultTimeout, Clock.systemUTC());
    }

    public RpcCorrelator(ScheduledExecutorService scheduler, Duration defaultTimeout, Clock clock) {
        this.scheduler = scheduler;
        this.defaultTimeout = defaultTimeout;
        this.clock = clock;
    }

    /** Lo llama el dueño del transporte al construirse. */
    public void bind(FrameSender sender) {
        this.sender = sender;
    }

    public RequestIdGenerator ids() {
        return ids;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public CompletableFuture<JsonNode> call(String method, JsonNode params) {
        return call(method, params, defaultTimeout);
    }

    public CompletableFuture<JsonNode> call(String method, JsonNode params, Duration timeout) {
        return call(method, params, timeout, sender);
    }

    /**
     * Variante con remitente explícito. La usa la conexión para el handshake y el heartbeat,
     * que viajan antes de que el enlace esté abierto para el resto.
     */
    public CompletableFuture<JsonNode> call(String method, JsonNode params, Duration timeout, FrameSender via) {
        if (via == null) {
            return CompletableFuture.failedFuture(new ConnectionLostException("no gateway connection bound"));
        }

        PendingCall call;
        do {
            call = new PendingCall(ids.next(), method, clock.instant());
        } while (pending.putIfAbsent(call.id(), call) != null);

        final PendingCall pc = call;
        pc.future().whenComplete((_r, _e) -> {
            pending.remove(pc.id(), pc);
            pc.disarm();
        });

        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            pc.armTimeout(scheduler.schedule(
                    () -> pc.future().completeExceptionally(new RpcTimeoutException(method, pc.id(), timeout)),
                    timeout.toMillis(), TimeUnit.MILLISECONDS));
        }

        try {
            via.send(new RequestFrame(pc.id(), method, params));
        } catch (RuntimeException e) {
            pc.future().completeExceptionally(e);
        }
        return pc.future();
    }

    /**
     * Entrega una respuesta a su llamada. Ids desconocidos (tardíos, duplicados, cancelados)
     * se ignoran.
     *
     * @return true si había una llamada esperando ese id
     */
    public boolean resolve(ResponseFrame frame) {
        PendingCall call = pending.remove(frame.id());
        if (call == null) {
            log.debug("Dropping response for unknown request id {}", frame.id());
            return false;
        }

        if (frame.ok()) {
            call.future().complete(frame.result());
        } else {
            call.future().completeExceptionally(new GatewayErrorException(call.method(), frame.error()));
        }
        return true;
    }

    /** Rechaza todo lo pendiente. Cada llamada se rechaza una sola vez. */
    public int rejectAll(Throwable cause) {
        int rejected = 0;
        for (String id : pending.keySet()) {
            PendingCall call = pending.remove(id);
            if (call != null && call.future().completeExceptionally(cause)) {
                rejected++;
            }
        }
        if (rejected > 0) log.info("Rejected {} pending call(s): {}", rejected, cause.getMessage());
        return rejected;
    }

    public int pendingCount() {
        return pending.size();
    }
}
