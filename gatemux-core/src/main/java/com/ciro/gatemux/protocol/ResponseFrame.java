package com.ciro.gatemux.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/**
 * Respuesta a un {@link RequestFrame}. Con {@code ok=true} trae {@code result};
 * con {@code ok=false} trae {@code error}.
 */
public record ResponseFrame(String id, boolean ok, JsonNode result, ErrorShape error) implements Frame {

    public ResponseFrame {
        Objects.requireNonNull(id, "id");
        if (result == null) result = NullNode.getInstance();
        if (!ok && error == null) error = ErrorShape.unknown();
    }

    public static ResponseFrame success(String id, JsonNode result) {
        return new ResponseFrame(id, true, result, null);
    }

    public static ResponseFrame failure(String id, ErrorShape error) {
        return new ResponseFrame(id, false, null, error);
    }

    @Override
    public String type() {
        return TYPE_RESPONSE;
    }
}
