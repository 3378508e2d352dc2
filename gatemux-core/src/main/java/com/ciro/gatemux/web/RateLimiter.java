package com.ciro.gatemux.web;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.TimeMeter;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Un bucket por clave: como mucho {@code limit} permisos cada {@code window}, recargados de golpe
 * al cerrar la ventana. Los buckets sin uso se olvidan solos.
 */
public final class RateLimiter {

    private final int limit;
    private final Duration window;
    private final TimeMeter clock;
    private final Cache<String, Bucket> buckets;

    public RateLimiter(int limit, Duration window) {
        this(limit, window, Ticker.systemTicker());
    }

    public RateLimiter(int limit, Duration window, Ticker ticker) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1");
        this.limit = limit;
        this.window = window;
        this.clock = new TimeMeter() {
            @Override
            public long currentTimeNanos() {
                return ticker.read();
            }

            @Override
            public boolean isWallClockBased() {
                return false;
            }
        };
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(window.multipliedBy(2))
                .maximumSize(100_000)
                .ticker(ticker)
                .build();
    }

    public boolean tryAcquire(String key) {
        return buckets.get(key, k -> newBucket()).tryConsume(1);
    }

    /** Segundos hasta que la clave vuelva a tener permisos (al menos 1). */
    public long retryAfterSeconds(String key) {
        Bucket b = buckets.getIfPresent(key);
        if (b == null) return 1;
        long nanos = b.estimateAbilityToConsume(1).getNanosToWaitForRefill();
        long secs = (nanos + TimeUnit.SECONDS.toNanos(1) - 1) / TimeUnit.SECONDS.toNanos(1);
        return Math.max(1, secs);
    }

    private Bucket newBucket() {
        return Bucket.builder()
                .addLimit(Bandwidth.builder()
                        .capacity(limit)
                        .refillIntervally(limit, window)
                        .build())
                .withCustomTimePrecision(clock)
                .build();
    }
}
