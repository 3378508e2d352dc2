package com.ciro.gatemux.connection;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Tiempos y parámetros de la conexión con el gateway. Inmutable; usar {@link #builder()}.
 */
public final class ConnectionSettings {

    public static final int PROTOCOL_VERSION = 3;

    private final Duration connectTimeout;
    private final Duration handshakeTimeout;
    private final Duration callTimeout;
    private final Duration heartbeatInterval;
    private final Duration heartbeatTimeout;
    private final String heartbeatMethod;
    private final Duration backoffBase;
    private final Duration backoffMax;
    private final double backoffJitter;
    private final String clientId;
    private final String clientDisplayName;
    private final String clientVersion;
    private final String clientMode;
    private final String role;
    private final List<String> scopes;

    private ConnectionSettings(Builder b) {
        this.connectTimeout = b.connectTimeout;
        this.handshakeTimeout = b.handshakeTimeout;
        this.callTimeout = b.callTimeout;
        this.heartbeatInterval = b.heartbeatInterval;
        this.heartbeatTimeout = b.heartbeatTimeout;
        this.heartbeatMethod = b.heartbeatMethod;
        this.backoffBase = b.backoffBase;
        this.backoffMax = b.backoffMax;
        this.backoffJitter = b.backoffJitter;
        this.clientId = b.clientId;
        this.clientDisplayName = b.clientDisplayName;
        this.clientVersion = b.clientVersion;
        this.clientMode = b.clientMode;
        this.role = b.role;
        this.scopes = List.copyOf(b.scopes);
    }

    public static ConnectionSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration connectTimeout() { return connectTimeout; }
    public Duration handshakeTimeout() { return handshakeTimeout; }
    public Duration callTimeout() { return callTimeout; }
    public Duration heartbeatInterval() { return heartbeatInterval; }
    public Duration heartbeatTimeout() { return heartbeatTimeout; }
    public String heartbeatMethod() { return heartbeatMethod; }
    public Duration backoffBase() { return backoffBase; }
    public Duration backoffMax() { return backoffMax; }
    public double backoffJitter() { return backoffJitter; }
    public String clientId() { return clientId; }
    public String clientDisplayName() { return clientDisplayName; }
    public String clientVersion() { return clientVersion; }
    public String clientMode() { return clientMode; }
    public String role() { return role; }
    public List<String> scopes() { return scopes; }

    public static final class Builder {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration handshakeTimeout = Duration.ofSeconds(10);
        private Duration callTimeout = Duration.ofSeconds(30);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration heartbeatTimeout = Duration.ofSeconds(10);
        private String heartbeatMethod = "health";
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration backoffMax = Duration.ofSeconds(30);
        private double backoffJitter = 0.2;
        private String clientId = "gatemux";
        private String clientDisplayName = "gatemux";
        private String clientVersion = "0.1.0";
        private String clientMode = "ui";
        private String role = "operator";
        private List<String> scopes = List.of("operator.admin");

        private Builder() {}

        public Builder connectTimeout(Duration v) { this.connectTimeout = positive(v, "connectTimeout"); return this; }
        public Builder handshakeTimeout(Duration v) { this.handshakeTimeout = positive(v, "handshakeTimeout"); return this; }
        public Builder callTimeout(Duration v) { this.callTimeout = positive(v, "callTimeout"); return this; }
        public Builder heartbeatInterval(Duration v) { this.heartbeatInterval = positive(v, "heartbeatInterval"); return this; }
        public Builder heartbeatTimeout(Duration v) { this.heartbeatTimeout = positive(v, "heartbeatTimeout"); return this; }
        public Builder heartbeatMethod(String v) { this.heartbeatMethod = Objects.requireNonNull(v); return this; }
        public Builder backoffBase(Duration v) { this.backoffBase = positive(v, "backoffBase"); return this; }
        public Builder backoffMax(Duration v) { this.backoffMax = positive(v, "backoffMax"); return this; }
        public Builder clientId(String v) { this.clientId = Objects.requireNonNull(v); return this; }
        public Builder clientDisplayName(String v) { this.clientDisplayName = Objects.requireNonNull(v); return this; }
        public Builder clientVersion(String v) { this.clientVersion = Objects.requireNonNull(v); return this; }
        public Builder clientMode(String v) { this.clientMode = Objects.requireNonNull(v); return this; }
        public Builder role(String v) { this.role = Objects.requireNonNull(v); return this; }
        public Builder scopes(List<String> v) { this.scopes = List.copyOf(v); return this; }

        public Builder backoffJitter(double v) {
            if (v < 0 || v >= 1) throw new IllegalArgumentException("backoffJitter must be in [0, 1)");
            this.backoffJitter = v;
            return this;
        }

        public ConnectionSettings build() {
            if (backoffMax.compareTo(backoffBase) < 0) {
                throw new IllegalArgumentException("backoffMax < backoffBase");
            }
            return new ConnectionSettings(this);
        }

        private static Duration positive(Duration d, String name) {
            Objects.requireNonNull(d, name);
            if (d.isNegative() || d.isZero()) throw new IllegalArgumentException(name + " must be > 0");
            return d;
        }
    }
}
