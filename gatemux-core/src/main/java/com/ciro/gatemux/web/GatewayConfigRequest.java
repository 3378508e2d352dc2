package com.ciro.gatemux.web;

import com.ciro.gatemux.connection.GatewayEndpoint;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body de {@code POST /api/gateway-config}: {@code {url?, token?}}. Lo que no viene
 * (o viene vacío) conserva el valor actual; el password no se toca desde aquí.
 */
public final class GatewayConfigRequest {

    public static final String SAVED_BUT_FAILED = "Config saved but connection failed: ";

    private GatewayConfigRequest() {}

    /** @throws IllegalArgumentException campo no string, URL que no es ws/wss o demasiado larga */
    public static GatewayEndpoint merge(GatewayEndpoint current, JsonNode body) {
        String url = optionalString(body, "url");
        String token = optionalString(body, "token");
        return GatewayEndpoint.of(
                (url != null) ? url : current.url().toString(),
                (token != null) ? token : current.token(),
                current.password());
    }

    private static String optionalString(JsonNode body, String field) {
        JsonNode n = body.path(field);
        if (n.isMissingNode() || n.isNull()) return null;
        if (!n.isTextual()) throw new IllegalArgumentException(field + " must be a string");
        return n.asText().isBlank() ? null : n.asText();
    }
}
