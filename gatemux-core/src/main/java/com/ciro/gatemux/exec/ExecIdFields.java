package com.ciro.gatemux.exec;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Dónde buscar el id del proceso en las respuestas y eventos del gateway. Cada versión del
 * peer lo llama distinto; gana el primer campo presente en este orden.
 */
public final class ExecIdFields {

    public static final List<String> CANDIDATES =
            List.of("execId", "execID", "id", "streamId", "streamID", "processId", "pid");

    private ExecIdFields() {}

    public static Optional<String> pick(JsonNode payload) {
        if (payload == null || !payload.isObject()) return Optional.empty();

        for (String field : CANDIDATES) {
            JsonNode v = payload.get(field);
            if (v == null || v.isNull()) continue;
            if (v.isTextual() && !v.asText().isBlank()) return Optional.of(v.asText());
            if (v.isIntegralNumber()) return Optional.of(v.asText());
            return Optional.empty();
        }
        return Optional.empty();
    }
}
