package com.ciro.gatemux.exec;

/** Eventos locales que se publican en el tópico de una sesión. */
public final class ExecEvents {

    /** La sesión pasó a READY: payload {@code {sessionId, execId}}. */
    public static final String READY = "exec.ready";

    /** La sesión terminó: payload {@code {sessionId, execId, reason}}. */
    public static final String CLOSED = "exec.closed";

    public static final String REASON_CLOSED = "closed";
    public static final String REASON_CONNECTION_LOST = "connection-lost";
    public static final String REASON_IDLE = "idle";
    public static final String REASON_CREATE_FAILED = "create-failed";

    private ExecEvents() {}
}
