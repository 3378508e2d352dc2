package com.ciro.gatemux.standalone;

import com.ciro.gatemux.Gatemux;
import com.ciro.gatemux.spi.AccessPolicy;
import com.ciro.gatemux.web.RateLimiter;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.PathHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;

import static io.undertow.Handlers.websocket;

/**
 * Servidor HTTP standalone (Undertow) delante de un {@link Gatemux}.
 */
public class GatemuxServer {

    private static final Logger log = LoggerFactory.getLogger(GatemuxServer.class);

    static final int TERMINAL_INPUT_LIMIT = 60;
    static final Duration TERMINAL_INPUT_WINDOW = Duration.ofSeconds(60);
    static final Duration SSE_WRITE_TIMEOUT = Duration.ofSeconds(10);
    static final Duration RECONNECT_TIMEOUT = Duration.ofSeconds(15);

    private final GatemuxConfig config;
    private final Gatemux gatemux;
    private final AccessPolicy access;
    private final RateLimiter inputLimiter;

    private Undertow server;

    public GatemuxServer(GatemuxConfig config, Gatemux gatemux) {
        this(config, gatemux, AccessPolicy.sharedToken(config.accessToken()),
                new RateLimiter(TERMINAL_INPUT_LIMIT, TERMINAL_INPUT_WINDOW));
    }

    GatemuxServer(GatemuxConfig config, Gatemux gatemux, AccessPolicy access, RateLimiter inputLimiter) {
        this.config = config;
        this.gatemux = gatemux;
        this.access = access;
        this.inputLimiter = inputLimiter;
    }

    HttpHandler routes() {
        JsonExchange json = new JsonExchange(gatemux.mapper());

        TerminalStreamEndpoint terminalStream =
                new TerminalStreamEndpoint(gatemux.bridge(), gatemux.exec(), json, SSE_WRITE_TIMEOUT);
        ActivityStreamEndpoint activityStream = new ActivityStreamEndpoint(gatemux.bridge(), json, SSE_WRITE_TIMEOUT);
        TerminalControlEndpoint control = new TerminalControlEndpoint(gatemux.bridge(), json);
        GatewayAdminEndpoint admin = new GatewayAdminEndpoint(gatemux, json, RECONNECT_TIMEOUT);
        WsTerminalEndpoint wsTerminal = new WsTerminalEndpoint(gatemux.bridge(), gatemux.mapper());

        // lo que no matchea: 404 JSON
        HttpHandler fallback = exchange -> json.fail(exchange, 404, "NOT_FOUND", "Not found: " + exchange.getRequestPath());

        PathHandler api = new PathHandler(fallback);
        api.addExactPath("/api/terminal-stream", terminalStream);
        api.addExactPath("/api/terminal-input",
                new RateLimitHandler("terminal", inputLimiter, json, control.input()));
        api.addExactPath("/api/terminal-resize", control.resize());
        api.addExactPath("/api/terminal-close", control.close());
        api.addExactPath("/api/activity-stream", activityStream);
        api.addExactPath("/api/gateway-status", admin.status());
        api.addExactPath("/api/gateway-config", admin.config());
        api.addExactPath("/api/debug/reconnect", admin.reconnect());
        api.addExactPath("/ws/terminal", websocket(wsTerminal::onConnect));

        AccessGuard guarded = new AccessGuard(access, json, api);

        PathHandler routes = new PathHandler(fallback);
        routes.addPrefixPath("/api", guarded);
        routes.addPrefixPath("/ws", guarded);
        return routes;
    }

    public synchronized void start() {
        if (server != null) return;
        server = Undertow.builder()
                .addHttpListener(config.port(), config.host())
                .setHandler(routes())
                .build();
        server.start();
        log.info("gatemux listening on http://{}:{} (gateway {})", config.host(), port(), gatemux.connection().endpoint().url());
    }

    /** Puerto real; útil con {@code server.port=0}. */
    public synchronized int port() {
        if (server == null) throw new IllegalStateException("server not started");
        InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        return address.getPort();
    }

    public synchronized void stop() {
        if (server == null) return;
        server.stop();
        server = null;
        log.info("gatemux server stopped");
    }
}
