package com.ciro.gatemux.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Error tal como lo reporta el gateway. Se conserva sin traducir.
 */
public record ErrorShape(String code, String message, JsonNode details) {

    public static final String UNKNOWN = "UNKNOWN";

    public ErrorShape {
        if (code == null || code.isBlank()) code = UNKNOWN;
        if (message == null) message = "";
        if (details == null) details = NullNode.getInstance();
    }

    public ErrorShape(String code, String message) {
        this(code, message, null);
    }

    public static ErrorShape unknown() {
        return new ErrorShape(UNKNOWN, "gateway returned ok:false without error");
    }

    /** Acepta {@code {code, message, details}} o un string plano. */
    public static ErrorShape from(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return unknown();
        if (node.isTextual()) return new ErrorShape(UNKNOWN, node.asText());
        if (!node.isObject()) return new ErrorShape(UNKNOWN, node.toString());

        String code = node.path("code").isValueNode() ? node.path("code").asText() : null;
        String message = node.path("message").isValueNode() ? node.path("message").asText() : null;
        return new ErrorShape(code, message, node.get("details"));
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
