package com.ciro.gatemux.exec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Qué proceso lanzar en el gateway.
 */
public record ExecRequest(List<String> command,
                          String cwd,
                          Map<String, String> env,
                          Integer cols,
                          Integer rows,
                          boolean pty) {

    public ExecRequest {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command = List.copyOf(command);
        env = (env == null) ? Map.of() : Map.copyOf(env);
    }

    public static ExecRequest of(String... command) {
        return new ExecRequest(List.of(command), null, Map.of(), null, null, true);
    }

    public static ExecRequest of(List<String> command) {
        return new ExecRequest(command, null, Map.of(), null, null, true);
    }

    public ExecRequest withCwd(String newCwd) {
        return new ExecRequest(command, newCwd, env, cols, rows, pty);
    }

    public ExecRequest withEnv(Map<String, String> newEnv) {
        return new ExecRequest(command, cwd, newEnv, cols, rows, pty);
    }

    public ExecRequest withSize(Integer newCols, Integer newRows) {
        return new ExecRequest(command, cwd, env, newCols, newRows, pty);
    }

    /** Params del método {@code exec}. {@code timeoutMs:0}: el proceso vive hasta que se cierre. */
    public ObjectNode toParams(ObjectMapper mapper) {
        ObjectNode p = mapper.createObjectNode();
        ArrayNode cmd = p.putArray("command");
        command.forEach(cmd::add);
        if (cwd != null) p.put("cwd", cwd);
        if (!env.isEmpty()) {
            ObjectNode e = p.putObject("env");
            env.forEach(e::put);
        }
        p.put("pty", pty);
        if (cols != null) p.put("cols", cols);
        if (rows != null) p.put("rows", rows);
        p.put("timeoutMs", 0);
        return p;
    }
}
