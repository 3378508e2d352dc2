package com.ciro.gatemux.connection;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Backoff exponencial con jitter: base, base*2, base*4... hasta el tope.
 *
 * <p>El jitter resta hasta {@code jitter} del retardo ya recortado, así que el tope nunca se pasa.
 * Al llegar al tope cada cliente se queda en su propio valor, sorteado una vez por racha.
 * Dentro de una racha de fallos el retardo nunca baja. {@link #reset()} empieza de nuevo.
 */
public final class ReconnectBackoff {

    private final long baseMs;
    private final long maxMs;
    private final double jitter;
    private final DoubleSupplier random;

    private int attempt;
    private long lastDelayMs;
    private boolean atCap;

    public ReconnectBackoff(Duration base, Duration max, double jitter) {
        this(base, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /** @param random fuente en [0,1); inyectable para tests */
    public ReconnectBackoff(Duration base, Duration max, double jitter, DoubleSupplier random) {
        this.baseMs = base.toMillis();
        this.maxMs = max.toMillis();
        this.jitter = jitter;
        this.random = random;
    }

    public synchronized Duration nextDelay() {
        attempt++;
        int shift = Math.min(attempt - 1, 30);
        long raw = Math.min(maxMs, baseMs << shift);
        long delay;
        if (atCap) {
            delay = lastDelayMs;
        } else {
            long jittered = raw - (long) (raw * jitter * random.getAsDouble());
            delay = Math.max(lastDelayMs, jittered);
            atCap = raw >= maxMs;
        }
        lastDelayMs = delay;
        return Duration.ofMillis(delay);
    }

    public synchronized void reset() {
        attempt = 0;
        lastDelayMs = 0;
        atCap = false;
    }

    public synchronized int attempt() {
        return attempt;
    }

    public synchronized long lastDelayMs() {
        return lastDelayMs;
    }
}
