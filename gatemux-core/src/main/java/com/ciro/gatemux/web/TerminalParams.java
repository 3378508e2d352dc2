package com.ciro.gatemux.web;

import com.ciro.gatemux.exec.ExecRequest;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Qué terminal quiere una pestaña: adjuntarse a {@code sessionId} o crear una con
 * {@link #request()}. Llega por query string (SSE GET, WebSocket) o por body JSON (POST).
 */
public final class TerminalParams {

    private final String sessionId;
    private final ExecRequest request;

    private TerminalParams(String sessionId, ExecRequest request) {
        this.sessionId = sessionId;
        this.request = request;
    }

    public String sessionId() {
        return sessionId;
    }

    /** null cuando {@link #attach()} */
    public ExecRequest request() {
        return request;
    }

    public boolean attach() {
        return sessionId != null;
    }

    /**
     * {@code ?command=} se puede repetir (un argumento por valor) o venir como un solo
     * string separado por espacios.
     *
     * @throws IllegalArgumentException con cols/rows no numéricos o no positivos
     */
    public static TerminalParams fromQuery(Map<String, ? extends Collection<String>> query, List<String> defaultCommand) {
        String sessionId = first(query, "sessionId");
        if (sessionId != null) return new TerminalParams(sessionId, null);

        List<String> command = new ArrayList<>();
        Collection<String> values = query.get("command");
        if (values != null) {
            if (values.size() == 1) {
                command.addAll(split(values.iterator().next()));
            } else {
                values.stream().filter(v -> v != null && !v.isBlank()).forEach(command::add);
            }
        }
        if (command.isEmpty()) command.addAll(defaultCommand);

        ExecRequest req = ExecRequest.of(command)
                .withCwd(first(query, "cwd"))
                .withSize(integer(first(query, "cols"), "cols"), integer(first(query, "rows"), "rows"));
        return new TerminalParams(null, req);
    }

    /** Body {@code {sessionId}} o {@code {command[], cwd, cols, rows}}. */
    public static TerminalParams fromJson(JsonNode body, List<String> defaultCommand) {
        String sessionId = text(body, "sessionId");
        if (sessionId != null) return new TerminalParams(sessionId, null);

        List<String> command = new ArrayList<>();
        JsonNode cmd = body.path("command");
        if (cmd.isArray()) {
            for (JsonNode part : cmd) {
                if (!part.isTextual()) throw new IllegalArgumentException("command must be an array of strings");
                command.add(part.asText());
            }
        } else if (cmd.isTextual()) {
            command.addAll(split(cmd.asText()));
        } else if (!cmd.isMissingNode() && !cmd.isNull()) {
            throw new IllegalArgumentException("command must be an array of strings");
        }
        if (command.isEmpty()) command.addAll(defaultCommand);

        ExecRequest req = ExecRequest.of(command)
                .withCwd(text(body, "cwd"))
                .withSize(size(body, "cols"), size(body, "rows"));
        return new TerminalParams(null, req);
    }

    /** Entero positivo opcional de un body JSON. */
    public static Integer size(JsonNode body, String field) {
        JsonNode n = body.path(field);
        if (n.isMissingNode() || n.isNull()) return null;
        if (!n.canConvertToInt()) throw new IllegalArgumentException(field + " must be an integer");
        int v = n.asInt();
        if (v < 1) throw new IllegalArgumentException(field + " must be positive");
        return v;
    }

    /** String no vacío de un body JSON, o null. */
    public static String text(JsonNode body, String field) {
        JsonNode n = body.path(field);
        if (!n.isTextual() || n.asText().isBlank()) return null;
        return n.asText();
    }

    public static String requireSessionId(JsonNode body) {
        String id = text(body, "sessionId");
        if (id == null) throw new IllegalArgumentException("sessionId is required");
        return id;
    }

    private static Integer integer(String raw, String field) {
        if (raw == null) return null;
        int v;
        try {
            v = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " must be an integer", e);
        }
        if (v < 1) throw new IllegalArgumentException(field + " must be positive");
        return v;
    }

    private static String first(Map<String, ? extends Collection<String>> query, String name) {
        Collection<String> v = query.get(name);
        if (v == null || v.isEmpty()) return null;
        Iterator<String> it = v.iterator();
        String s = it.next();
        return (s == null || s.isBlank()) ? null : s;
    }

    private static List<String> split(String raw) {
        if (raw == null) return List.of();
        return Arrays.stream(raw.trim().split("\\s+")).filter(s -> !s.isEmpty()).toList();
    }
}
