package com.ciro.gatemux.spi;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Decide si una petición del navegador puede usar el puente. Los adaptadores extraen el token
 * presentado ({@code Authorization: Bearer} o la cookie {@link #COOKIE_NAME}) y preguntan aquí.
 */
@FunctionalInterface
public interface AccessPolicy {

    String COOKIE_NAME = "gatemux_auth";

    boolean permits(String presentedToken);

    static AccessPolicy allowAll() {
        return token -> true;
    }

    /** Token compartido. Sin token configurado no se exige nada. */
    static AccessPolicy sharedToken(String expected) {
        if (expected == null || expected.isBlank()) return allowAll();
        byte[] want = expected.getBytes(StandardCharsets.UTF_8);
        return token -> token != null && MessageDigest.isEqual(want, token.getBytes(StandardCharsets.UTF_8));
    }

    /** Extrae el token de un header {@code Authorization}; null si no es Bearer. */
    static String bearer(String authorizationHeader) {
        if (authorizationHeader == null) return null;
        String h = authorizationHeader.trim();
        if (h.length() <= 7 || !h.regionMatches(true, 0, "Bearer ", 0, 7)) return null;
        String token = h.substring(7).trim();
        return token.isEmpty() ? null : token;
    }
}
