package com.ciro.gatemux.connection;

import com.ciro.gatemux.error.ConnectionLostException;
import com.ciro.gatemux.error.Errors;
import com.ciro.gatemux.error.GatewayErrorException;
import com.ciro.gatemux.error.MissingCredentialsException;
import com.ciro.gatemux.events.EventFanout;
import com.ciro.gatemux.events.GatewayEvent;
import com.ciro.gatemux.events.Topics;
import com.ciro.gatemux.protocol.EventFrame;
import com.ciro.gatemux.protocol.Frame;
import com.ciro.gatemux.protocol.FrameCodec;
import com.ciro.gatemux.protocol.FrameDecodeException;
import com.ciro.gatemux.protocol.RequestFrame;
import com.ciro.gatemux.protocol.ResponseFrame;
import com.ciro.gatemux.rpc.FrameSender;
import com.ciro.gatemux.rpc.RpcCorrelator;
import com.ciro.gatemux.spi.GatewayTransport;
import com.ciro.gatemux.spi.TransportHandle;
import com.ciro.gatemux.spi.TransportListener;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dueño único del enlace con el gateway.
 *
 * <p>Estados: {@code CONNECTING -> OPEN -> (CLOSING) -> CLOSED}, y {@code CLOSED -> CONNECTING}
 * al reconectar. Cada intento usa un enlace nuevo; al caerse se rechazan todas las llamadas
 * pendientes con {@link ConnectionLostException}, se avisa a los listeners y se programa la
 * reconexión con backoff exponencial.
 *
 * <p>Nadie más toca el transporte: las llamadas entran por {@link #rpc()}.
 */
public class GatewayConnection implements FrameSender, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayConnection.class);

    public static final String HANDSHAKE_METHOD = "connect";
    private static final int NORMAL_CLOSURE = 1000;

    private final GatewayTransport transport;
    private final FrameCodec codec;
    private final ObjectMapper mapper;
    private final EventFanout fanout;
    private final ScheduledExecutorService scheduler;
    private final ConnectionSettings settings;
    private final RpcCorrelator correlator;
    private final ReconnectBackoff backoff;

    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final Object writeLock = new Object();
    private final AtomicLong epochs = new AtomicLong();

    private volatile GatewayEndpoint endpoint;
    private volatile ConnectionState state = ConnectionState.CLOSED;
    private volatile Link link;
    private volatile String lastError;
    private volatile Instant openedAt;

    // guarded by this
    private ScheduledFuture<?> reconnectTask;
    private boolean stopped = true;

    public GatewayConnection(GatewayEndpoint endpoint,
                             ConnectionSettings settings,
                             GatewayTransport transport,
                             FrameCodec codec,
                             EventFanout fanout,
                             ScheduledExecutorService scheduler) {
        this(endpoint, settings, transport, codec, fanout, scheduler,
                new ReconnectBackoff(settings.backoffBase(), settings.backoffMax(), settings.backoffJitter()));
    }

    public GatewayConnection(GatewayEndpoint endpoint,
                             ConnectionSettings settings,
                             GatewayTransport transport,
                             FrameCodec codec,
                             EventFanout fanout,
                             ScheduledExecutorService scheduler,
                             ReconnectBackoff backoff) {
        this.endpoint = endpoint;
        this.settings = settings;
        this.transport = transport;
        this.codec = codec;
        this.mapper = codec.mapper();
        this.fanout = fanout;
        this.scheduler = scheduler;
        this.backoff = backoff;
        this.correlator = new RpcCorrelator(scheduler, settings.callTimeout());
        this.correlator.bind(this);
    }

    // ---------------------------------------------------------------- API

    /**
     * Arranca la conexión.
     *
     * @return future que completa cuando el primer enlace queda abierto
     * @throws MissingCredentialsException sin token ni password; no se reintenta
     */
    public synchronized CompletableFuture<Void> start() {
        requireCredentials();
        stopped = false;
        Link current = link;
        if (current != null && !current.dead) return current.opened;
        cancelReconnectTask();
        return openLink().opened;
    }

    /** Corta el enlace actual (si hay) y abre uno nuevo ya, con el backoff a cero. */
    public synchronized CompletableFuture<Void> reconnectNow() {
        try {
            requireCredentials();
        } catch (MissingCredentialsException e) {
            return CompletableFuture.failedFuture(e);
        }
        stopped = false;
        backoff.reset();
        cancelReconnectTask();

        Link current = link;
        if (current != null && !current.dead) {
            teardown(current, "manual reconnect", null, false);
        }
        log.info("Manual reconnect to {}", endpoint.url());
        return openLink().opened;
    }

    /** Cambia URL/credenciales en caliente y reconecta. */
    public synchronized CompletableFuture<Void> updateEndpoint(GatewayEndpoint newEndpoint) {
        this.endpoint = newEndpoint;
        log.info("Gateway endpoint updated: {}", newEndpoint);
        return reconnectNow();
    }

    @Override
    public synchronized void close() {
        stopped = true;
        cancelReconnectTask();
        Link current = link;
        if (current != null && !current.dead) {
            transition(ConnectionState.CLOSING);
            teardown(current, "connection closed", null, false);
        } else {
            transition(ConnectionState.CLOSED);
        }
    }

    public RpcCorrelator rpc() {
        return correlator;
    }

    public ConnectionState state() {
        return state;
    }

    public GatewayEndpoint endpoint() {
        return endpoint;
    }

    public ConnectionStatus status() {
        return new ConnectionStatus(state, endpoint.url().toString(), backoff.attempt(),
                backoff.lastDelayMs(), lastError, openedAt, correlator.pendingCount());
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    /**
     * Camino normal de salida de {@link RpcCorrelator#call}. Solo con el enlace abierto;
     * no se encola nada a la espera de reconexión.
     */
    @Override
    public void send(RequestFrame frame) {
        Link current = link;
        if (state != ConnectionState.OPEN || current == null) {
            throw new ConnectionLostException("gateway connection is " + state.name().toLowerCase(Locale.ROOT));
        }
        current.write(frame);
    }

    // ---------------------------------------------------------------- ciclo de vida del enlace

    private void requireCredentials() {
        if (!endpoint.hasCredentials()) {
            stopped = true;
            lastError = "missing credentials";
            log.error("Gateway token or password is required; not connecting to {}", endpoint.url());
            throw new MissingCredentialsException("Gateway token or password is required");
        }
    }

    private Link openLink() {
        correlator.ids().rotate();
        Link next = new Link(epochs.incrementAndGet());
        link = next;
        transition(ConnectionState.CONNECTING);
        log.info("Connecting to gateway {} (link #{})", endpoint.url(), next.epoch);
        try {
            next.handle = transport.open(endpoint.url(), next);
        } catch (RuntimeException e) {
            teardown(next, "transport open failed: " + e.getMessage(), e, !stopped);
        }
        return next;
    }

    private void sendHandshake(Link l) {
        correlator.call(HANDSHAKE_METHOD, handshakeParams(), settings.handshakeTimeout(), l.raw)
                .whenComplete((hello, err) -> {
                    if (err != null) {
                        Throwable cause = Errors.unwrap(err);
                        linkLost(l, "handshake failed: " + Errors.message(cause), cause);
                    } else {
                        linkOpened(l, hello);
                    }
                });
    }

    private synchronized void linkOpened(Link l, JsonNode hello) {
        if (link != l || l.dead) return;
        backoff.reset();
        openedAt = Instant.now();
        lastError = null;
        transition(ConnectionState.OPEN);

        long every = settings.heartbeatInterval().toMillis();
        l.heartbeat = scheduler.scheduleWithFixedDelay(() -> heartbeat(l), every, every, TimeUnit.MILLISECONDS);

        log.info("Gateway connection open ({}){}", endpoint.url(),
                hello.hasNonNull("server") ? " server=" + hello.get("server") : "");
        l.opened.complete(null);
    }

    private void heartbeat(Link l) {
        if (link != l || l.dead) return;
        correlator.call(settings.heartbeatMethod(), mapper.createObjectNode(), settings.heartbeatTimeout(), l.raw)
                .whenComplete((_r, err) -> {
                    if (err == null) return;
                    Throwable cause = Errors.unwrap(err);
                    if (cause instanceof GatewayErrorException) {
                        // respondió: el enlace está vivo aunque el método falle
                        log.debug("Heartbeat answered with error: {}", cause.getMessage());
                        return;
                    }
                    linkLost(l, "heartbeat failed: " + Errors.message(cause), cause);
                });
    }

    private synchronized void linkLost(Link l, String reason, Throwable cause) {
        teardown(l, reason, cause, !stopped);
    }

    /** Mata el enlace {@code l}. Idempotente por enlace. */
    private void teardown(Link l, String reason, Throwable cause, boolean reconnect) {
        if (l.dead) return;
        l.dead = true;
        if (l.heartbeat != null) l.heartbeat.cancel(false);
        TransportHandle h = l.handle;
        if (h != null) {
            try {
                h.close(NORMAL_CLOSURE, "bye");
            } catch (RuntimeException e) {
                log.debug("Closing transport failed", e);
            }
        }
        if (link != l) return;

        lastError = reason;
        openedAt = null;
        transition(ConnectionState.CLOSED);

        ConnectionLostException lost = new ConnectionLostException(reason, cause);
        l.opened.completeExceptionally(lost);
        if (reconnect) log.warn("Gateway connection lost: {}", reason);
        else log.info("Gateway link released: {}", reason);

        correlator.rejectAll(lost);
        for (ConnectionListener x : listeners) {
            try {
                x.onConnectionLost(lost);
            } catch (RuntimeException e) {
                log.warn("Connection listener failed on loss", e);
            }
        }

        if (reconnect) scheduleReconnect();
    }

    private void scheduleReconnect() {
        Duration delay = backoff.nextDelay();
        log.info("Reconnecting to gateway in {}ms (attempt {})", delay.toMillis(), backoff.attempt());
        reconnectTask = scheduler.schedule(this::reconnectScheduled, delay.toMillis(), TimeUnit.MILLISECONDS);
        publishStatus();
    }

    private synchronized void reconnectScheduled() {
        reconnectTask = null;
        if (stopped || state != ConnectionState.CLOSED) return;
        openLink();
    }

    private void cancelReconnectTask() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private void transition(ConnectionState next) {
        ConnectionState prev = state;
        if (prev == next) return;
        state = next;
        log.debug("Gateway connection {} -> {}", prev, next);
        for (ConnectionListener x : listeners) {
            try {
                x.onStateChanged(prev, next);
            } catch (RuntimeException e) {
                log.warn("Connection listener failed on {} -> {}", prev, next, e);
            }
        }
        publishStatus();
    }

    private void publishStatus() {
        fanout.publish(new GatewayEvent(Topics.CONNECTION, "status", status().toJson(mapper)));
    }

    // ---------------------------------------------------------------- entrada

    private void handleInbound(String text) {
        Frame frame;
        try {
            frame = codec.decode(text);
        } catch (FrameDecodeException e) {
            log.warn("Dropping malformed gateway frame: {} [{}]", e.getMessage(), e.raw());
            return;
        }

        if (frame instanceof ResponseFrame res) {
            correlator.resolve(res);
        } else if (frame instanceof EventFrame ev) {
            GatewayEvent event = new GatewayEvent(ev.topic(), ev.topic(), ev.payload(), ev.seq());
            if (Topics.isReserved(ev.topic())) {
                // esos tópicos son locales: el evento solo llega por el comodín
                log.debug("Gateway event on reserved topic '{}' delivered to '{}' only", ev.topic(), Topics.ALL);
            } else {
                fanout.publish(event);
            }
            fanout.publish(event.retarget(Topics.ALL));
        } else if (frame instanceof RequestFrame req) {
            log.debug("Ignoring gateway-initiated request '{}'", req.method());
        }
    }

    private ObjectNode handshakeParams() {
        ObjectNode p = mapper.createObjectNode();
        p.put("minProtocol", ConnectionSettings.PROTOCOL_VERSION);
        p.put("maxProtocol", ConnectionSettings.PROTOCOL_VERSION);

        ObjectNode client = p.putObject("client");
        client.put("id", settings.clientId());
        client.put("displayName", settings.clientDisplayName());
        client.put("version", settings.clientVersion());
        client.put("platform", System.getProperty("os.name", "unknown").toLowerCase(Locale.ROOT));
        client.put("mode", settings.clientMode());

        p.put("role", settings.role());
        ArrayNode scopes = p.putArray("scopes");
        settings.scopes().forEach(scopes::add);

        GatewayEndpoint ep = endpoint;
        ObjectNode auth = p.putObject("auth");
        if (ep.token() != null) auth.put("token", ep.token());
        if (ep.password() != null) auth.put("password", ep.password());
        return p;
    }

    /** Un intento de conexión. Los callbacks de enlaces viejos se ignoran. */
    private final class Link implements TransportListener {
        final long epoch;
        final CompletableFuture<Void> opened = new CompletableFuture<>();
        final FrameSender raw = this::write;
        volatile TransportHandle handle;
        volatile boolean dead;
        ScheduledFuture<?> heartbeat;

        Link(long epoch) {
            this.epoch = epoch;
        }

        void write(RequestFrame frame) {
            TransportHandle h = handle;
            if (dead || h == null) throw new ConnectionLostException("gateway link is gone");
            String text = codec.encode(frame);
            boolean accepted;
            synchronized (writeLock) {
                accepted = h.send(text);
            }
            if (!accepted) {
                scheduler.execute(() -> linkLost(this, "transport refused frame", null));
                throw new ConnectionLostException("gateway link refused frame");
            }
        }

        @Override
        public void onOpen() {
            synchronized (GatewayConnection.this) {
                if (link != this || dead) return;
            }
            log.debug("Link #{} open, sending handshake", epoch);
            sendHandshake(this);
        }

        @Override
        public void onText(String text) {
            if (dead) return;
            handleInbound(text);
        }

        @Override
        public void onClosed(int code, String reason) {
            String why = (reason == null || reason.isBlank()) ? "" : ": " + reason;
            linkLost(this, "closed by gateway (" + code + why + ")", null);
        }

        @Override
        public void onFailure(Throwable error) {
            linkLost(this, "transport failure: " + Errors.message(error), error);
        }
    }
}
