package com.ciro.gatemux.spring;

import com.ciro.gatemux.Gatemux;
import com.ciro.gatemux.bridge.BridgeChannel;
import com.ciro.gatemux.bridge.BrowserBridge;
import com.ciro.gatemux.connection.GatewayConnection;
import com.ciro.gatemux.connection.GatewayEndpoint;
import com.ciro.gatemux.error.Errors;
import com.ciro.gatemux.error.GatemuxException;
import com.ciro.gatemux.error.SessionNotFoundException;
import com.ciro.gatemux.web.ClientIp;
import com.ciro.gatemux.web.GatewayConfigRequest;
import com.ciro.gatemux.web.RateLimiter;
import com.ciro.gatemux.web.TerminalParams;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Las mismas rutas que el servidor standalone, sobre Spring MVC. Los streams son
 * {@link SseEmitter} sin timeout; el keep-alive lo manda el bridge.
 */
@RestController
@RequestMapping("/api")
public class GatemuxBridgeController {

    private static final Logger log = LoggerFactory.getLogger(GatemuxBridgeController.class);

    static final Duration RECONNECT_TIMEOUT = Duration.ofSeconds(15);

    private final Gatemux gatemux;
    private final BrowserBridge bridge;
    private final ObjectMapper mapper;
    private final RateLimiter inputLimiter;

    public GatemuxBridgeController(Gatemux gatemux, RateLimiter inputLimiter) {
        this.gatemux = gatemux;
        this.bridge = gatemux.bridge();
        this.mapper = gatemux.mapper();
        this.inputLimiter = inputLimiter;
    }

    // ---------------------------------------------------------------- terminal

    @GetMapping("/terminal-stream")
    public SseEmitter terminalStream(@RequestParam MultiValueMap<String, String> query) {
        return stream(TerminalParams.fromQuery(query, bridge.settings().defaultCommand()));
    }

    @PostMapping("/terminal-stream")
    public SseEmitter terminalStreamPost(@RequestBody JsonNode body) {
        return stream(TerminalParams.fromJson(requireObject(body), bridge.settings().defaultCommand()));
    }

    private SseEmitter stream(TerminalParams params) {
        if (params.attach() && gatemux.exec().get(params.sessionId()).isEmpty()) {
            throw new SessionNotFoundException(params.sessionId());
        }

        SseEmitter em = new SseEmitter(0L);
        BridgeChannel ch = open(em);

        if (params.attach()) {
            if (!bridge.attachTerminal(ch, params.sessionId())) {
                ch.offer(bridge.error(new SessionNotFoundException(params.sessionId())));
                ch.finish();
            }
            return em;
        }

        bridge.openTerminal(ch, params.request()).whenComplete((s, err) -> {
            if (err != null) log.warn("Terminal for channel {} failed to start: {}", ch.id(), Errors.message(err));
        });
        return em;
    }

    @PostMapping("/terminal-input")
    public CompletableFuture<ResponseEntity<JsonNode>> terminalInput(@RequestBody JsonNode body, HttpServletRequest request) {
        String key = "terminal:" + ClientIp.resolve(request::getHeader, request.getRemoteAddr());
        if (!inputLimiter.tryAcquire(key)) {
            log.warn("Rate limit hit for {}", key);
            return CompletableFuture.completedFuture(ResponseEntity.status(429)
                    .header(HttpHeaders.RETRY_AFTER, Long.toString(inputLimiter.retryAfterSeconds(key)))
                    .body(error("RATE_LIMITED", "Too many requests")));
        }

        String sessionId = TerminalParams.requireSessionId(requireObject(body));
        JsonNode data = body.path("data");
        if (!data.isTextual()) throw new IllegalArgumentException("data must be a string");
        return reply(bridge.input(sessionId, data.asText()));
    }

    @PostMapping("/terminal-resize")
    public CompletableFuture<ResponseEntity<JsonNode>> terminalResize(@RequestBody JsonNode body) {
        String sessionId = TerminalParams.requireSessionId(requireObject(body));
        Integer cols = TerminalParams.size(body, "cols");
        Integer rows = TerminalParams.size(body, "rows");
        if (cols == null || rows == null) throw new IllegalArgumentException("cols and rows are required");
        return reply(bridge.resize(sessionId, cols, rows));
    }

    @PostMapping("/terminal-close")
    public CompletableFuture<ResponseEntity<JsonNode>> terminalClose(@RequestBody JsonNode body) {
        return reply(bridge.closeTerminal(TerminalParams.requireSessionId(requireObject(body))));
    }

    // ---------------------------------------------------------------- actividad

    @GetMapping("/activity-stream")
    public SseEmitter activityStream(@RequestParam(name = "topic", required = false) List<String> topic) {
        List<String> topics = new ArrayList<>();
        if (topic != null) {
            for (String v : topic) {
                for (String t : v.split(",")) {
                    if (!t.isBlank() && !topics.contains(t.trim())) topics.add(t.trim());
                }
            }
        }
        SseEmitter em = new SseEmitter(0L);
        bridge.openActivityFeed(open(em), topics);
        return em;
    }

    // ---------------------------------------------------------------- gateway

    @GetMapping("/gateway-status")
    public ObjectNode gatewayStatus() {
        ObjectNode body = ok();
        body.setAll(gatemux.connection().status().toJson(mapper));
        body.put("execSessions", gatemux.exec().size());
        body.put("bridgeChannels", bridge.activeChannels());
        return body;
    }

    @PostMapping("/debug/reconnect")
    public CompletableFuture<ResponseEntity<JsonNode>> reconnect() {
        GatewayConnection connection = gatemux.connection();
        return connection.reconnectNow()
                .orTimeout(RECONNECT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
                .handle((v, err) -> {
                    ObjectNode body = mapper.createObjectNode();
                    body.put("ok", err == null);
                    body.put("state", connection.state().label());
                    if (err == null) return ResponseEntity.ok(body);
                    log.warn("Manual reconnect failed: {}", Errors.message(err));
                    body.put("error", Errors.message(err));
                    return ResponseEntity.status(503).body(body);
                });
    }

    @GetMapping("/gateway-config")
    public ObjectNode gatewayConfig() {
        GatewayEndpoint current = gatemux.connection().endpoint();
        ObjectNode body = ok();
        body.put("url", current.url().toString());
        body.put("hasToken", current.token() != null);
        return body;
    }

    @PostMapping("/gateway-config")
    public CompletableFuture<ResponseEntity<JsonNode>> updateGatewayConfig(@RequestBody(required = false) JsonNode body) {
        JsonNode req = (body == null) ? mapper.createObjectNode() : requireObject(body);
        GatewayEndpoint updated = GatewayConfigRequest.merge(gatemux.connection().endpoint(), req);

        return gatemux.connection().updateEndpoint(updated)
                .orTimeout(RECONNECT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
                .handle((v, err) -> {
                    ObjectNode res = ok();
                    res.put("connected", err == null);
                    if (err != null) {
                        log.warn("Gateway config saved but connection failed: {}", Errors.message(err));
                        res.put("error", GatewayConfigRequest.SAVED_BUT_FAILED + Errors.message(err));
                    }
                    return ResponseEntity.ok(res);
                });
    }

    // ---------------------------------------------------------------- errores

    @ExceptionHandler({GatemuxException.class, IllegalArgumentException.class})
    public ResponseEntity<JsonNode> onFailure(RuntimeException e) {
        return failure(e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<JsonNode> onUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(error("BAD_REQUEST", "Invalid JSON body"));
    }

    // ----------------------------------------------------------------

    private BridgeChannel open(SseEmitter em) {
        SseEmitterSink sink = new SseEmitterSink(em, mapper);
        BridgeChannel ch = bridge.open(sink);
        Runnable gone = () -> {
            sink.markClosed();
            ch.close();
        };
        em.onCompletion(gone);
        em.onTimeout(gone);
        em.onError(e -> gone.run());
        return ch;
    }

    private CompletableFuture<ResponseEntity<JsonNode>> reply(CompletableFuture<Void> op) {
        return op.handle((v, err) -> (err == null) ? ResponseEntity.ok((JsonNode) ok()) : failure(err));
    }

    private ResponseEntity<JsonNode> failure(Throwable err) {
        int status = Errors.httpStatus(err);
        if (status == 500) log.error("Request failed", Errors.unwrap(err));
        return ResponseEntity.status(status).body(error(Errors.code(err), Errors.message(err)));
    }

    private JsonNode requireObject(JsonNode body) {
        if (body == null || !body.isObject()) throw new IllegalArgumentException("JSON body must be an object");
        return body;
    }

    private ObjectNode ok() {
        return mapper.createObjectNode().put("ok", true);
    }

    private ObjectNode error(String code, String message) {
        ObjectNode n = mapper.createObjectNode();
        n.put("ok", false);
        n.put("error", message);
        if (code != null) n.put("code", code);
        return n;
    }
}
