package com.ciro.gatemux.web;

import java.util.function.Function;

/** IP del cliente para el rate limit, detrás de proxy o no. */
public final class ClientIp {

    private ClientIp() {}

    /**
     * Primer salto de {@code X-Forwarded-For}, luego {@code X-Real-IP}, luego la dirección
     * del peer.
     *
     * @param header lectura de headers del request (null si no está)
     */
    public static String resolve(Function<String, String> header, String peerAddress) {
        String forwarded = header.apply("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) return first;
        }
        String real = header.apply("X-Real-IP");
        if (real != null && !real.isBlank()) return real.trim();
        return (peerAddress == null || peerAddress.isBlank()) ? "unknown" : peerAddress;
    }
}
