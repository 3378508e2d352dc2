package com.ciro.gatemux.exec;

import com.ciro.gatemux.events.EventFanout;
import com.ciro.gatemux.events.GatewayEvent;
import com.ciro.gatemux.events.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Lectura tipo "pull" de los eventos de una sesión, desde el momento en que se crea.
 *
 * <p>La cola es acotada. Un lector que no drena a tiempo pierde la suscripción: lo ya encolado
 * se puede seguir leyendo, {@link #overflowed()} pasa a true y el feed queda agotado.
 */
public final class ExecFeed implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecFeed.class);

    static final int DEFAULT_CAPACITY = 1024;

    private final String topic;
    private final BlockingQueue<GatewayEvent> queue;
    private final Subscription subscription;
    private volatile boolean ended;
    private volatile boolean overflowed;

    ExecFeed(EventFanout fanout, String topic) {
        this(fanout, topic, DEFAULT_CAPACITY);
    }

    ExecFeed(EventFanout fanout, String topic, int capacity) {
        this.topic = topic;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.subscription = fanout.subscribe(topic, this::accept);
    }

    private void accept(GatewayEvent event) {
        if (ended) return;
        if (!queue.offer(event)) {
            log.warn("Exec feed on {} is not being drained ({} queued), dropping it", topic, queue.size());
            overflowed = true;
            ended = true;
            Subscription sub = subscription;
            if (sub != null) sub.close();
            return;
        }
        if (ExecEvents.CLOSED.equals(event.name())) ended = true;
    }

    /** Siguiente evento, o vacío si no llega ninguno en {@code timeout}. */
    public Optional<GatewayEvent> next(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /** La sesión terminó (o el feed se desbordó) y ya se leyó todo. */
    public boolean isExhausted() {
        return ended && queue.isEmpty();
    }

    /** Se perdieron eventos porque nadie leía. */
    public boolean overflowed() {
        return overflowed;
    }

    @Override
    public void close() {
        subscription.close();
        queue.clear();
    }
}
