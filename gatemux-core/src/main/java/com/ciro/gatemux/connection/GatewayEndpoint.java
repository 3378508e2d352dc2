package com.ciro.gatemux.connection;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Dónde está el gateway y con qué credenciales entrar.
 */
public record GatewayEndpoint(URI url, String token, String password) {

    public static final String DEFAULT_URL = "ws://127.0.0.1:18789";
    public static final int MAX_URL_LENGTH = 500;

    public GatewayEndpoint {
        Objects.requireNonNull(url, "url");
        String scheme = url.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Gateway URL must use ws:// or wss://, got " + url);
        }
        token = blankToNull(token);
        password = blankToNull(password);
    }

    /**
     * Construye desde texto de configuración: quita caracteres de control, usa la URL
     * por defecto si viene vacía.
     */
    public static GatewayEndpoint of(String url, String token, String password) {
        String clean = sanitize(url);
        if (clean.isEmpty()) clean = DEFAULT_URL;
        if (clean.length() > MAX_URL_LENGTH) {
            throw new IllegalArgumentException("Gateway URL longer than " + MAX_URL_LENGTH + " chars");
        }
        try {
            return new GatewayEndpoint(new URI(clean), sanitize(token), sanitize(password));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid gateway URL: " + e.getMessage(), e);
        }
    }

    public boolean hasCredentials() {
        return token != null || password != null;
    }

    private static String sanitize(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isISOControl(c)) sb.append(c);
        }
        return sb.toString().trim();
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    @Override
    public String toString() {
        return "GatewayEndpoint[url=" + url + ", token=" + (token != null ? "***" : "none")
                + ", password=" + (password != null ? "***" : "none") + "]";
    }
}
