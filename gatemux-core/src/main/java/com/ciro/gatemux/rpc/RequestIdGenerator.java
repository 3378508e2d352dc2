package com.ciro.gatemux.rpc;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ids {@code <scope>-<seq>}. El scope cambia con cada enlace nuevo y la secuencia nunca
 * retrocede, así que un id no se repite ni siquiera entre reconexiones.
 */
public final class RequestIdGenerator {

    private static final SecureRandom RNG = new SecureRandom();

    private final AtomicLong seq = new AtomicLong();
    private volatile String scope = newScope();

    public String next() {
        return scope + "-" + seq.incrementAndGet();
    }

    public void rotate() {
        scope = newScope();
    }

    private static String newScope() {
        byte[] b = new byte[4];
        RNG.nextBytes(b);
        return HexFormat.of().formatHex(b);
    }
}
