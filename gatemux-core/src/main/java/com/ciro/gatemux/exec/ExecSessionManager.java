package com.ciro.gatemux.exec;

import com.ciro.gatemux.connection.ConnectionListener;
import com.ciro.gatemux.error.ConnectionLostException;
import com.ciro.gatemux.error.Errors;
import com.ciro.gatemux.error.GatewayErrorException;
import com.ciro.gatemux.error.SessionNotReadyException;
import com.ciro.gatemux.events.EventFanout;
import com.ciro.gatemux.events.GatewayEvent;
import com.ciro.gatemux.events.Subscriber;
import com.ciro.gatemux.events.Subscription;
import com.ciro.gatemux.events.Topics;
import com.ciro.gatemux.protocol.ErrorShape;
import com.ciro.gatemux.rpc.RpcCorrelator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Terminales remotas sobre el correlador: {@code exec}, {@code exec.write},
 * {@code exec.resize}, {@code exec.close}.
 *
 * <p>Ciclo de cada sesión: {@code CREATING -> READY -> CLOSING -> CLOSED}. Si se pierde la
 * conexión todas pasan a CLOSED y no se recrean. Las sesiones sin actividad se expulsan.
 */
public class ExecSessionManager implements ConnectionListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecSessionManager.class);

    public static final String METHOD_CREATE = "exec";
    public static final String METHOD_WRITE = "exec.write";
    public static final String METHOD_RESIZE = "exec.resize";
    public static final String METHOD_CLOSE = "exec.close";

    private final RpcCorrelator rpc;
    private final EventFanout fanout;
    private final ObjectMapper mapper;
    private final Duration createTimeout;

    private final Cache<String, ExecSession> sessions;
    private final Map<String, ExecSession> byExecId = new ConcurrentHashMap<>();
    private final Subscription routing;

    public ExecSessionManager(RpcCorrelator rpc, EventFanout fanout, ObjectMapper mapper) {
        this(rpc, fanout, mapper, rpc.defaultTimeout(), Duration.ofMinutes(30), 256, Ticker.systemTicker());
    }

    public ExecSessionManager(RpcCorrelator rpc,
                              EventFanout fanout,
                              ObjectMapper mapper,
                              Duration createTimeout,
                              Duration idleTimeout,
                              long maxSessions,
                              Ticker ticker) {
        this.rpc = rpc;
        this.fanout = fanout;
        this.mapper = mapper;
        this.createTimeout = createTimeout;

        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(idleTimeout)
                .maximumSize(maxSessions)
                .ticker(ticker)
                .scheduler(Scheduler.systemScheduler())
                .executor(Runnable::run)
                .removalListener((String id, ExecSession s, RemovalCause cause) -> onRemoval(id, s, cause))
                .build();

        this.routing = fanout.subscribe(Topics.ALL, this::route);
    }

    // ---------------------------------------------------------------- create

    /** Crea y arranca una sesión. */
    public CompletableFuture<ExecSession> create(ExecRequest request) {
        return create(request, createTimeout);
    }

    public CompletableFuture<ExecSession> create(ExecRequest request, Duration timeout) {
        return start(open(request), timeout);
    }

    /**
     * Registra la sesión en CREATING sin tocar la red. Permite suscribirse a
     * {@link ExecSession#topic()} antes de {@link #start}.
     */
    public ExecSession open(ExecRequest request) {
        ExecSession s = new ExecSession(UUID.randomUUID().toString(), request, Instant.now());
        sessions.put(s.id(), s);
        return s;
    }

    public CompletableFuture<ExecSession> start(ExecSession s) {
        return start(s, createTimeout);
    }

    public CompletableFuture<ExecSession> start(ExecSession s, Duration timeout) {
        if (!s.markStarted()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("exec session " + s.id() + " was already started"));
        }
        if (s.state() != ExecState.CREATING) {
            return CompletableFuture.failedFuture(new SessionNotReadyException(s.id(), describe(s)));
        }

        return rpc.call(METHOD_CREATE, s.request().toParams(mapper), timeout)
                .handle((reply, err) -> {
                    if (err != null) {
                        Throwable cause = Errors.unwrap(err);
                        log.warn("exec create failed for session {}: {}", s.id(), cause.getMessage());
                        abandon(s, ExecEvents.REASON_CREATE_FAILED);
                        throw new CompletionException(cause);
                    }
                    return ready(s, reply);
                });
    }

    private ExecSession ready(ExecSession s, JsonNode reply) {
        Optional<String> execId = ExecIdFields.pick(reply);
        if (execId.isEmpty()) {
            abandon(s, ExecEvents.REASON_CREATE_FAILED);
            throw new CompletionException(new GatewayErrorException(METHOD_CREATE,
                    new ErrorShape("NO_EXEC_ID", "exec reply carried no exec id", reply)));
        }

        s.assignExecId(execId.get());
        if (!s.transition(ExecState.CREATING, ExecState.READY)) {
            // cerrada mientras se creaba: el proceso remoto sobra
            closeRemote(execId.get());
            throw new CompletionException(new SessionNotReadyException(s.id(), describe(s)));
        }

        fanout.publish(new GatewayEvent(s.topic(), ExecEvents.READY, lifecyclePayload(s, null)));
        byExecId.put(execId.get(), s);
        log.info("Exec session {} ready (execId={}, command={})", s.id(), execId.get(), s.request().command());
        return s;
    }

    // ---------------------------------------------------------------- write / resize / close

    /** Envía entrada al proceso. Completa cuando el gateway confirma que la encoló. */
    public CompletableFuture<Void> write(ExecSession s, String data) {
        String execId = s.execIdOrNull();
        if (s.state() != ExecState.READY || execId == null) {
            return CompletableFuture.failedFuture(new SessionNotReadyException(s.id(), describe(s)));
        }
        touch(s);

        ObjectNode p = mapper.createObjectNode();
        p.put("id", execId);
        p.put("data", data);

        s.writerStarted();
        return rpc.call(METHOD_WRITE, p)
                .whenComplete((_r, _e) -> s.writerDone())
                .thenApply(_r -> null);
    }

    /** Sin esperar respuesta: los errores solo se registran. */
    public CompletableFuture<Void> resize(ExecSession s, int cols, int rows) {
        String execId = s.execIdOrNull();
        if (s.state() != ExecState.READY || execId == null) {
            return CompletableFuture.failedFuture(new SessionNotReadyException(s.id(), describe(s)));
        }
        touch(s);

        ObjectNode p = mapper.createObjectNode();
        p.put("id", execId);
        p.put("cols", cols);
        p.put("rows", rows);

        rpc.call(METHOD_RESIZE, p).whenComplete((_r, e) -> {
            if (e != null) log.debug("exec.resize for {} failed: {}", s.id(), Errors.message(e));
        });
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Cierra la sesión. Idempotente. El {@code exec.close} remoto es best-effort:
     * si falla, la sesión se libera igual.
     */
    public CompletableFuture<Void> close(ExecSession s) {
        return close(s, ExecEvents.REASON_CLOSED);
    }

    public CompletableFuture<Void> close(String sessionId) {
        ExecSession s = sessions.asMap().get(sessionId);
        return (s == null) ? CompletableFuture.completedFuture(null) : close(s);
    }

    private CompletableFuture<Void> close(ExecSession s, String reason) {
        ExecState prev = s.beginClose();
        if (prev == ExecState.CLOSING || prev == ExecState.CLOSED) {
            return CompletableFuture.completedFuture(null);
        }

        String execId = s.execIdOrNull();
        CompletableFuture<Void> remote = (prev == ExecState.READY && execId != null)
                ? closeRemote(execId)
                : CompletableFuture.completedFuture(null);
        return remote.thenRun(() -> release(s, reason));
    }

    private CompletableFuture<Void> closeRemote(String execId) {
        ObjectNode p = mapper.createObjectNode();
        p.put("id", execId);
        return rpc.call(METHOD_CLOSE, p).handle((_r, e) -> {
            if (e != null) log.debug("exec.close for {} failed (ignored): {}", execId, Errors.message(e));
            return null;
        });
    }

    // ---------------------------------------------------------------- consulta / suscripción

    /** Busca una sesión viva. Cuenta como actividad. */
    public Optional<ExecSession> get(String sessionId) {
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    public List<ExecSession> list() {
        return List.copyOf(sessions.asMap().values());
    }

    public int size() {
        return sessions.asMap().size();
    }

    public Subscription subscribe(ExecSession s, Subscriber subscriber) {
        return fanout.subscribe(s.topic(), subscriber);
    }

    /** Eventos de la sesión desde ahora. */
    public ExecFeed feed(ExecSession s) {
        return new ExecFeed(fanout, s.topic());
    }

    /** Fuerza la expiración pendiente (la caché la hace de forma perezosa). */
    public void evictIdle() {
        sessions.cleanUp();
    }

    // ---------------------------------------------------------------- conexión

    @Override
    public void onConnectionLost(ConnectionLostException cause) {
        List<ExecSession> all = new ArrayList<>(sessions.asMap().values());
        if (all.isEmpty()) return;

        log.warn("Gateway connection lost, closing {} exec session(s)", all.size());
        for (ExecSession s : all) {
            if (s.markClosed() != ExecState.CLOSED) {
                publishClosed(s, ExecEvents.REASON_CONNECTION_LOST);
            }
        }
        sessions.invalidateAll(all.stream().map(ExecSession::id).toList());
        byExecId.clear();
    }

    @Override
    public void close() {
        routing.close();
        for (ExecSession s : list()) {
            close(s);
        }
    }

    // ---------------------------------------------------------------- interno

    private void route(GatewayEvent event) {
        if (byExecId.isEmpty()) return;
        ExecIdFields.pick(event.payload())
                .map(byExecId::get)
                .ifPresent(s -> fanout.publish(event.retarget(s.topic())));
    }

    private void touch(ExecSession s) {
        sessions.getIfPresent(s.id());
    }

    private void abandon(ExecSession s, String reason) {
        if (s.markClosed() == ExecState.CLOSED) return;
        sessions.invalidate(s.id());
        publishClosed(s, reason);
    }

    private void release(ExecSession s, String reason) {
        s.markClosed();
        sessions.invalidate(s.id());
        String execId = s.execIdOrNull();
        if (execId != null) byExecId.remove(execId, s);
        publishClosed(s, reason);
        log.info("Exec session {} closed ({})", s.id(), reason);
    }

    private void onRemoval(String id, ExecSession s, RemovalCause cause) {
        if (s == null || !cause.wasEvicted()) return;
        log.info("Evicting exec session {} ({})", id, cause.name().toLowerCase(Locale.ROOT));
        close(s, ExecEvents.REASON_IDLE);
    }

    private void publishClosed(ExecSession s, String reason) {
        fanout.publish(new GatewayEvent(s.topic(), ExecEvents.CLOSED, lifecyclePayload(s, reason)));
    }

    private ObjectNode lifecyclePayload(ExecSession s, String reason) {
        ObjectNode p = mapper.createObjectNode();
        p.put("sessionId", s.id());
        String execId = s.execIdOrNull();
        if (execId != null) p.put("execId", execId); else p.putNull("execId");
        if (reason != null) p.put("reason", reason);
        return p;
    }

    private static String describe(ExecSession s) {
        if (s.state() == ExecState.CREATING) return "not ready yet (creating)";
        return s.state().name().toLowerCase(Locale.ROOT);
    }
}
