package com.ciro.gatemux.standalone;

import com.ciro.gatemux.web.ClientIp;
import com.ciro.gatemux.web.RateLimiter;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/** 429 cuando el cliente (por IP) se pasa del límite. */
final class RateLimitHandler implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(RateLimitHandler.class);

    private final String bucket;
    private final RateLimiter limiter;
    private final JsonExchange json;
    private final HttpHandler next;

    RateLimitHandler(String bucket, RateLimiter limiter, JsonExchange json, HttpHandler next) {
        this.bucket = bucket;
        this.limiter = limiter;
        this.json = json;
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String key = bucket + ":" + clientIp(exchange);
        if (limiter.tryAcquire(key)) {
            next.handleRequest(exchange);
            return;
        }
        log.warn("Rate limit hit for {}", key);
        exchange.getResponseHeaders().put(Headers.RETRY_AFTER, Long.toString(limiter.retryAfterSeconds(key)));
        json.fail(exchange, 429, "RATE_LIMITED", "Too many requests");
    }

    static String clientIp(HttpServerExchange exchange) {
        InetSocketAddress peer = exchange.getSourceAddress();
        String address = (peer == null || peer.getAddress() == null) ? null : peer.getAddress().getHostAddress();
        return ClientIp.resolve(exchange.getRequestHeaders()::getFirst, address);
    }
}
