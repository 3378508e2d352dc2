package com.ciro.gatemux.exec;

import com.ciro.gatemux.events.Topics;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Terminal interactiva remota. La maneja {@link ExecSessionManager}; desde fuera es de solo lectura.
 */
public final class ExecSession {

    private final String id;
    private final ExecRequest request;
    private final Instant createdAt;
    private final String topic;

    private final AtomicReference<ExecState> state = new AtomicReference<>(ExecState.CREATING);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicInteger pendingWriters = new AtomicInteger();
    private volatile String execId;

    ExecSession(String id, ExecRequest request, Instant createdAt) {
        this.id = id;
        this.request = request;
        this.createdAt = createdAt;
        this.topic = Topics.exec(id);
    }

    public String id() { return id; }
    public ExecRequest request() { return request; }
    public Instant createdAt() { return createdAt; }
    public ExecState state() { return state.get(); }
    public int pendingWriters() { return pendingWriters.get(); }

    /** Tópico del fan-out donde se publican los eventos de esta sesión. */
    public String topic() { return topic; }

    public Optional<String> execId() {
        return Optional.ofNullable(execId);
    }

    public boolean isReady() {
        return state.get() == ExecState.READY && execId != null;
    }

    // --- transiciones (solo el manager) ---

    String execIdOrNull() {
        return execId;
    }

    void assignExecId(String value) {
        this.execId = value;
    }

    boolean markStarted() {
        return started.compareAndSet(false, true);
    }

    boolean transition(ExecState from, ExecState to) {
        return state.compareAndSet(from, to);
    }

    /** CREATING/READY -> CLOSING. Devuelve el estado previo. */
    ExecState beginClose() {
        while (true) {
            ExecState cur = state.get();
            if (cur == ExecState.CLOSING || cur == ExecState.CLOSED) return cur;
            if (state.compareAndSet(cur, ExecState.CLOSING)) return cur;
        }
    }

    /** Cierre forzado. Devuelve el estado previo. */
    ExecState markClosed() {
        return state.getAndSet(ExecState.CLOSED);
    }

    void writerStarted() {
        pendingWriters.incrementAndGet();
    }

    void writerDone() {
        pendingWriters.decrementAndGet();
    }

    @Override
    public String toString() {
        return "ExecSession[" + id + ", execId=" + execId + ", " + state.get() + "]";
    }
}
