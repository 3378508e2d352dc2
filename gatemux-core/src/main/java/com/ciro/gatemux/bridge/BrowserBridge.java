package com.ciro.gatemux.bridge;

import com.ciro.gatemux.connection.ConnectionStatus;
import com.ciro.gatemux.error.Errors;
import com.ciro.gatemux.error.SessionNotFoundException;
import com.ciro.gatemux.events.EventFanout;
import com.ciro.gatemux.events.GatewayEvent;
import com.ciro.gatemux.events.Topics;
import com.ciro.gatemux.exec.ExecEvents;
import com.ciro.gatemux.exec.ExecRequest;
import com.ciro.gatemux.exec.ExecSession;
import com.ciro.gatemux.exec.ExecSessionManager;
import com.ciro.gatemux.exec.ExecState;
import com.ciro.gatemux.spi.BridgeSink;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Convierte el flujo multiplexado en un flujo por pestaña.
 *
 * <p>Vocabulario hacia el navegador:
 * <ul>
 *   <li>terminal: {@code session}, {@code event}, {@code error}, {@code close}, {@code ping}</li>
 *   <li>actividad: {@code status}, {@code activity}, {@code ping}</li>
 * </ul>
 */
public class BrowserBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrowserBridge.class);

    public static final String SESSION = "session";
    public static final String EVENT = "event";
    public static final String ERROR = "error";
    public static final String CLOSE = "close";
    public static final String PING = "ping";
    public static final String STATUS = "status";
    public static final String ACTIVITY = "activity";

    private final ExecSessionManager exec;
    private final EventFanout fanout;
    private final ObjectMapper mapper;
    private final Supplier<ConnectionStatus> status;
    private final ScheduledExecutorService scheduler;
    private final Executor sendExecutor;
    private final BridgeSettings settings;

    private final Set<BridgeChannel> channels = ConcurrentHashMap.newKeySet();
    private final AtomicLong ids = new AtomicLong();

    public BrowserBridge(ExecSessionManager exec,
                         EventFanout fanout,
                         ObjectMapper mapper,
                         Supplier<ConnectionStatus> status,
                         ScheduledExecutorService scheduler,
                         Executor sendExecutor,
                         BridgeSettings settings) {
        this.exec = exec;
        this.fanout = fanout;
        this.mapper = mapper;
        this.status = status;
        this.scheduler = scheduler;
        this.sendExecutor = sendExecutor;
        this.settings = settings;
    }

    public BridgeSettings settings() {
        return settings;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /** Canal nuevo para una pestaña, con keep-alive. */
    public BridgeChannel open(BridgeSink sink) {
        BridgeChannel ch = new BridgeChannel("tab-" + ids.incrementAndGet(), sink, sendExecutor, settings.maxPending());
        channels.add(ch);

        long every = settings.keepAlive().toMillis();
        ScheduledFuture<?> keepAlive = scheduler.scheduleAtFixedRate(() -> ping(ch), every, every, TimeUnit.MILLISECONDS);
        ch.onClose(() -> {
            keepAlive.cancel(false);
            channels.remove(ch);
        });
        log.debug("Bridge channel {} opened ({} live)", ch.id(), channels.size());
        return ch;
    }

    // ---------------------------------------------------------------- terminal

    /** Crea una terminal y la transmite por {@code ch}. */
    public CompletableFuture<ExecSession> openTerminal(BridgeChannel ch, ExecRequest request) {
        ExecSession s = exec.open(request);
        relayTerminal(ch, s);

        return exec.start(s, settings.createTimeout()).whenComplete((_ok, err) -> {
            if (err == null) return;
            ch.offer(error(err));
            ch.offer(BridgeMessage.of(CLOSE, closePayload(s.id(), ExecEvents.REASON_CREATE_FAILED)));
            ch.finish();
        });
    }

    /**
     * Adjunta otra pestaña a una terminal existente.
     *
     * @return false si la sesión no existe o ya se está cerrando
     */
    public boolean attachTerminal(BridgeChannel ch, String sessionId) {
        Optional<ExecSession> found = exec.get(sessionId);
        if (found.isEmpty()) return false;

        ExecSession s = found.get();
        if (s.state() == ExecState.CLOSING || s.state() == ExecState.CLOSED) return false;

        relayTerminal(ch, s);
        ExecState after = s.state();
        if (after == ExecState.CLOSING || after == ExecState.CLOSED) {
            // se cerró antes de suscribirnos: el evento de cierre ya pasó
            ch.offer(BridgeMessage.of(CLOSE, closePayload(s.id(), ExecEvents.REASON_CLOSED)));
            ch.finish();
            return true;
        }
        if (s.isReady()) {
            ObjectNode p = mapper.createObjectNode();
            p.put("sessionId", s.id());
            p.put("execId", s.execId().orElse(null));
            ch.offer(BridgeMessage.of(SESSION, p));
        }
        return true;
    }

    public CompletableFuture<Void> input(String sessionId, String data) {
        return exec.get(sessionId)
                .map(s -> exec.write(s, data))
                .orElseGet(() -> CompletableFuture.failedFuture(new SessionNotFoundException(sessionId)));
    }

    public CompletableFuture<Void> resize(String sessionId, int cols, int rows) {
        return exec.get(sessionId)
                .map(s -> exec.resize(s, cols, rows))
                .orElseGet(() -> CompletableFuture.failedFuture(new SessionNotFoundException(sessionId)));
    }

    public CompletableFuture<Void> closeTerminal(String sessionId) {
        return exec.get(sessionId)
                .map(exec::close)
                .orElseGet(() -> CompletableFuture.failedFuture(new SessionNotFoundException(sessionId)));
    }

    /**
     * Mensaje entrante de un socket de terminal: {@code {type:"input", data}},
     * {@code {type:"resize", cols, rows}} o {@code {type:"close"}}.
     */
    public CompletableFuture<Void> command(String sessionId, JsonNode msg) {
        String type = msg.path("type").asText("");
        return switch (type) {
            case "input" -> input(sessionId, msg.path("data").asText(""));
            case "resize" -> resize(sessionId, msg.path("cols").asInt(80), msg.path("rows").asInt(24));
            case "close" -> closeTerminal(sessionId);
            default -> CompletableFuture.failedFuture(new IllegalArgumentException("Unknown message type: " + type));
        };
    }

    /** {@code error} con mensaje y código, como lo ve la pestaña. */
    public BridgeMessage error(Throwable t) {
        ObjectNode e = mapper.createObjectNode();
        e.put("message", Errors.message(t));
        e.put("code", Errors.code(t));
        return BridgeMessage.of(ERROR, e);
    }

    private void relayTerminal(BridgeChannel ch, ExecSession s) {
        ch.track(exec.subscribe(s, event -> {
            switch (event.name()) {
                case ExecEvents.READY -> ch.offer(BridgeMessage.of(SESSION, event.payload()));
                case ExecEvents.CLOSED -> {
                    String reason = event.payload().path("reason").asText(ExecEvents.REASON_CLOSED);
                    // el fallo de creación lo reporta openTerminal, con el error
                    if (ExecEvents.REASON_CREATE_FAILED.equals(reason)) return;
                    ch.offer(BridgeMessage.of(CLOSE, closePayload(s.id(), reason)));
                    ch.finish();
                }
                default -> ch.offer(BridgeMessage.of(EVENT, eventPayload(event)));
            }
        }));
        ch.onClose(() -> unwatched(s));
    }

    private void unwatched(ExecSession s) {
        if (settings.terminalPolicy() != TerminalPolicy.CLOSE_WHEN_UNWATCHED) return;
        if (fanout.subscriberCount(s.topic()) > 0) return;
        ExecState state = s.state();
        // en CREATING el cierre gana a la respuesta del gateway y el exec.close sale al llegar el execId
        if (state == ExecState.CREATING || state == ExecState.READY) {
            log.info("Last viewer of exec session {} left ({}), closing it", s.id(), state);
            exec.close(s);
        }
    }

    // ---------------------------------------------------------------- actividad

    /**
     * Feed de actividad: estado de la conexión más los eventos de {@code topics}
     * (todos los del gateway si viene vacío).
     */
    public void openActivityFeed(BridgeChannel ch, Collection<String> topics) {
        ch.offer(BridgeMessage.of(STATUS, status.get().toJson(mapper)));
        ch.track(fanout.subscribe(Topics.CONNECTION, e -> ch.offer(BridgeMessage.of(STATUS, e.payload()))));

        Collection<String> wanted = (topics == null || topics.isEmpty()) ? List.of(Topics.ALL) : topics;
        for (String topic : wanted) {
            ch.track(fanout.subscribe(topic, e -> ch.offer(BridgeMessage.of(ACTIVITY, eventPayload(e)))));
        }
    }

    // ----------------------------------------------------------------

    public int activeChannels() {
        return channels.size();
    }

    @Override
    public void close() {
        for (BridgeChannel ch : List.copyOf(channels)) {
            ch.close();
        }
    }

    private void ping(BridgeChannel ch) {
        if (!ch.isLive()) {
            ch.close();
            return;
        }
        ObjectNode t = mapper.createObjectNode();
        t.put("t", System.currentTimeMillis());
        ch.offer(BridgeMessage.of(PING, t));
    }

    private JsonNode eventPayload(GatewayEvent e) {
        ObjectNode n = mapper.createObjectNode();
        n.put("event", e.name());
        n.set("payload", e.payload());
        if (e.seq() != null) n.put("seq", e.seq());
        return n;
    }

    private ObjectNode closePayload(String sessionId, String reason) {
        ObjectNode n = mapper.createObjectNode();
        n.put("sessionId", sessionId);
        n.put("reason", reason);
        return n;
    }
}
