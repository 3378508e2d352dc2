package com.ciro.gatemux;

import com.ciro.gatemux.bridge.BridgeSettings;
import com.ciro.gatemux.bridge.BrowserBridge;
import com.ciro.gatemux.connection.ConnectionSettings;
import com.ciro.gatemux.connection.GatewayConnection;
import com.ciro.gatemux.connection.GatewayEndpoint;
import com.ciro.gatemux.events.EventFanout;
import com.ciro.gatemux.exec.ExecSessionManager;
import com.ciro.gatemux.protocol.FrameCodec;
import com.ciro.gatemux.rpc.RpcCorrelator;
import com.ciro.gatemux.spi.GatewayTransport;
import com.ciro.gatemux.transport.OkHttpGatewayTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Arma el multiplexor completo: codec, fan-out, conexión, sesiones exec y puente.
 * Un solo {@code Gatemux} por proceso.
 */
public final class Gatemux implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Gatemux.class);

    private final ObjectMapper mapper;
    private final EventFanout fanout;
    private final GatewayTransport transport;
    private final GatewayConnection connection;
    private final ExecSessionManager exec;
    private final BrowserBridge bridge;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService sendExecutor;

    private Gatemux(Builder b) {
        this.mapper = (b.mapper != null) ? b.mapper : ObjectMapperFactory.create();
        this.scheduler = Executors.newScheduledThreadPool(2, named("gatemux-scheduler"));
        this.sendExecutor = Executors.newCachedThreadPool(named("gatemux-bridge"));
        this.fanout = new EventFanout();
        this.transport = (b.transport != null)
                ? b.transport
                : new OkHttpGatewayTransport(b.connectionSettings.connectTimeout());

        this.connection = new GatewayConnection(b.endpoint, b.connectionSettings, transport,
                new FrameCodec(mapper), fanout, scheduler);

        RpcCorrelator rpc = connection.rpc();
        this.exec = new ExecSessionManager(rpc, fanout, mapper, b.bridgeSettings.createTimeout(),
                b.idleTimeout, b.maxSessions, Ticker.systemTicker());
        connection.addListener(exec);

        this.bridge = new BrowserBridge(exec, fanout, mapper, connection::status, scheduler, sendExecutor,
                b.bridgeSettings);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @see GatewayConnection#start() */
    public CompletableFuture<Void> start() {
        return connection.start();
    }

    public ObjectMapper mapper() { return mapper; }
    public EventFanout fanout() { return fanout; }
    public GatewayConnection connection() { return connection; }
    public RpcCorrelator rpc() { return connection.rpc(); }
    public ExecSessionManager exec() { return exec; }
    public BrowserBridge bridge() { return bridge; }

    @Override
    public void close() {
        log.info("Shutting down gatemux");
        bridge.close();
        exec.close();
        connection.close();
        transport.shutdown();
        scheduler.shutdownNow();
        sendExecutor.shutdownNow();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static final class Builder {
        private GatewayEndpoint endpoint;
        private ConnectionSettings connectionSettings = ConnectionSettings.defaults();
        private BridgeSettings bridgeSettings = BridgeSettings.defaults();
        private Duration idleTimeout = Duration.ofMinutes(30);
        private long maxSessions = 256;
        private GatewayTransport transport;
        private ObjectMapper mapper;

        private Builder() {}

        public Builder endpoint(GatewayEndpoint v) { this.endpoint = v; return this; }
        public Builder connectionSettings(ConnectionSettings v) { this.connectionSettings = Objects.requireNonNull(v); return this; }
        public Builder bridgeSettings(BridgeSettings v) { this.bridgeSettings = Objects.requireNonNull(v); return this; }
        public Builder idleTimeout(Duration v) { this.idleTimeout = Objects.requireNonNull(v); return this; }
        public Builder maxSessions(long v) { this.maxSessions = v; return this; }
        public Builder transport(GatewayTransport v) { this.transport = v; return this; }
        public Builder mapper(ObjectMapper v) { this.mapper = v; return this; }

        public Gatemux build() {
            Objects.requireNonNull(endpoint, "endpoint");
            return new Gatemux(this);
        }
    }
}
