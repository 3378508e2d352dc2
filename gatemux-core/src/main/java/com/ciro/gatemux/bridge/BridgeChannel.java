package com.ciro.gatemux.bridge;

import com.ciro.gatemux.events.Subscription;
import com.ciro.gatemux.spi.BridgeSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Canal de salida de una pestaña.
 *
 * <p>{@link #offer} nunca bloquea: encola y un solo drenador a la vez escribe en el sink,
 * en orden. Si la cola se llena o el sink falla, el canal se da por desconectado: se cancelan
 * sus suscripciones y se ejecutan sus tareas de limpieza.
 */
public final class BridgeChannel {

    private static final Logger log = LoggerFactory.getLogger(BridgeChannel.class);

    private final String id;
    private final BridgeSink sink;
    private final Executor executor;
    private final int maxPending;

    private final Queue<BridgeMessage> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicInteger queued = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean live = new AtomicBoolean(true);
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final List<Runnable> closeTasks = new CopyOnWriteArrayList<>();
    private volatile boolean finishing;

    BridgeChannel(String id, BridgeSink sink, Executor executor, int maxPending) {
        this.id = id;
        this.sink = sink;
        this.executor = executor;
        this.maxPending = maxPending;
    }

    public String id() {
        return id;
    }

    public boolean isLive() {
        return live.get() && sink.isOpen();
    }

    /** @return false si el canal ya está cerrado o se acaba de cerrar por lento */
    public boolean offer(BridgeMessage message) {
        if (!live.get() || finishing) return false;

        if (queued.incrementAndGet() > maxPending) {
            queued.decrementAndGet();
            log.warn("Bridge channel {} is not keeping up ({} messages queued), disconnecting", id, maxPending);
            close();
            return false;
        }
        outbound.add(message);
        scheduleDrain();
        return true;
    }

    /** Cierra el canal cuando termine de enviar lo que ya está en cola. */
    public void finish() {
        finishing = true;
        scheduleDrain();
    }

    /** La suscripción se cancela al cerrar el canal. */
    public void track(Subscription subscription) {
        subscriptions.add(subscription);
        if (!live.get()) subscription.close();
    }

    public void onClose(Runnable task) {
        closeTasks.add(task);
        if (!live.get() && closeTasks.remove(task)) runQuietly(task);
    }

    public void close() {
        if (!live.compareAndSet(true, false)) return;

        subscriptions.forEach(Subscription::close);
        subscriptions.clear();

        for (Runnable task : closeTasks) runQuietly(task);
        closeTasks.clear();

        outbound.clear();
        queued.set(0);
        try {
            sink.close();
        } catch (RuntimeException e) {
            log.debug("Closing sink of bridge channel {} failed", id, e);
        }
        log.debug("Bridge channel {} closed", id);
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) return;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            close();
        }
    }

    private void drain() {
        try {
            BridgeMessage m;
            while (live.get() && (m = outbound.poll()) != null) {
                queued.decrementAndGet();
                if (!sink.isOpen()) {
                    close();
                    return;
                }
                sink.send(m);
            }
            if (finishing && outbound.isEmpty()) close();
        } catch (IOException | RuntimeException e) {
            log.debug("Bridge channel {} write failed: {}", id, e.toString());
            close();
        } finally {
            draining.set(false);
        }

        if (live.get() && (!outbound.isEmpty() || finishing)) scheduleDrain();
    }

    private void runQuietly(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.warn("Cleanup task of bridge channel {} failed", id, e);
        }
    }
}
