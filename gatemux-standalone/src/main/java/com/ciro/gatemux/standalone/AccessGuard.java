package com.ciro.gatemux.standalone;

import com.ciro.gatemux.spi.AccessPolicy;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Corta con 401 lo que {@link AccessPolicy} no permite. El token llega como
 * {@code Authorization: Bearer} o en la cookie {@link AccessPolicy#COOKIE_NAME}.
 */
final class AccessGuard implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final AccessPolicy policy;
    private final JsonExchange json;
    private final HttpHandler next;

    AccessGuard(AccessPolicy policy, JsonExchange json, HttpHandler next) {
        this.policy = policy;
        this.json = json;
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (policy.permits(presentedToken(exchange))) {
            next.handleRequest(exchange);
            return;
        }
        log.debug("Unauthorized request to {} from {}", exchange.getRequestPath(), exchange.getSourceAddress());
        json.fail(exchange, 401, null, "Unauthorized");
    }

    static String presentedToken(HttpServerExchange exchange) {
        String bearer = AccessPolicy.bearer(exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION));
        return (bearer != null) ? bearer : CookieUtil.getCookie(exchange, AccessPolicy.COOKIE_NAME);
    }
}
