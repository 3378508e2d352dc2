package com.ciro.gatemux.standalone;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

public final class CookieUtil {

    private CookieUtil() {}

    public static String getCookie(HttpServerExchange exchange, String name) {
        return fromHeader(exchange.getRequestHeaders().getFirst(Headers.COOKIE), name);
    }

    /** Parsing simple de "a=b; c=d". También sirve para el handshake del WebSocket. */
    public static String fromHeader(String cookieHeader, String name) {
        if (cookieHeader == null) return null;
        for (String part : cookieHeader.split(";")) {
            String s = part.trim();
            int idx = s.indexOf('=');
            if (idx <= 0) continue;
            if (name.equals(s.substring(0, idx).trim())) {
                String v = s.substring(idx + 1).trim();
                if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) v = v.substring(1, v.length() - 1);
                return v;
            }
        }
        return null;
    }
}
