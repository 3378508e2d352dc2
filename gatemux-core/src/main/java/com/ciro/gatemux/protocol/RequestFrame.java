package com.ciro.gatemux.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

public record RequestFrame(String id, String method, JsonNode params) implements Frame {

    public RequestFrame {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(method, "method");
        if (params == null) params = NullNode.getInstance();
    }

    @Override
    public String type() {
        return TYPE_REQUEST;
    }
}
