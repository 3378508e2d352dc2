package com.ciro.gatemux.web;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private final AtomicLong now = new AtomicLong();
    private final RateLimiter limiter = new RateLimiter(3, Duration.ofSeconds(60), now::get);

    @Test
    void allowsUpToLimitPerWindow() {
        assertTrue(limiter.tryAcquire("terminal:1.2.3.4"));
        assertTrue(limiter.tryAcquire("terminal:1.2.3.4"));
        assertTrue(limiter.tryAcquire("terminal:1.2.3.4"));
        assertFalse(limiter.tryAcquire("terminal:1.2.3.4"));

        // otra clave, otro cupo
        assertTrue(limiter.tryAcquire("terminal:5.6.7.8"));
    }

    @Test
    void windowResets() {
        for (int i = 0; i < 3; i++) limiter.tryAcquire("k");
        assertFalse(limiter.tryAcquire("k"));

        now.addAndGet(Duration.ofSeconds(60).toNanos());
        assertTrue(limiter.tryAcquire("k"));
    }

    @Test
    void retryAfterCountsDownTheWindow() {
        for (int i = 0; i < 4; i++) limiter.tryAcquire("k");
        assertEquals(60, limiter.retryAfterSeconds("k"));

        now.addAndGet(Duration.ofSeconds(45).toNanos());
        assertEquals(15, limiter.retryAfterSeconds("k"));

        assertEquals(1, limiter.retryAfterSeconds("unknown"));
    }

    @Test
    void rejectsZeroLimit() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, Duration.ofSeconds(1)));
    }
}
