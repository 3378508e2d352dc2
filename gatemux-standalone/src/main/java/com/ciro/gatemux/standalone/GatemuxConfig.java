package com.ciro.gatemux.standalone;

import com.ciro.gatemux.bridge.BridgeSettings;
import com.ciro.gatemux.connection.GatewayEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Configuración del servidor standalone.
 *
 * <p>Orden de precedencia (gana el último): {@code gatemux.properties} del classpath,
 * {@code ./gatemux.properties}, variables de entorno.
 */
public final class GatemuxConfig {

    private static final Logger log = LoggerFactory.getLogger(GatemuxConfig.class);

    public static final String RESOURCE = "gatemux.properties";

    /** Variable de entorno -> clave de properties. */
    static final Map<String, String> ENV_KEYS = new LinkedHashMap<>();
    static {
        ENV_KEYS.put("CLAWDBOT_GATEWAY_URL", "gateway.url");
        ENV_KEYS.put("CLAWDBOT_GATEWAY_TOKEN", "gateway.token");
        ENV_KEYS.put("CLAWDBOT_GATEWAY_PASSWORD", "gateway.password");
        ENV_KEYS.put("GATEMUX_HOST", "server.host");
        ENV_KEYS.put("GATEMUX_PORT", "server.port");
        ENV_KEYS.put("GATEMUX_ACCESS_TOKEN", "access.token");
        ENV_KEYS.put("GATEMUX_TERMINAL_SHELL", "terminal.shell");
    }

    private final Properties props;

    private GatemuxConfig(Properties props) {
        this.props = props;
    }

    public static GatemuxConfig load() {
        return load(System.getenv(), Path.of(RESOURCE));
    }

    public static GatemuxConfig load(Map<String, String> env, Path overrides) {
        Properties p = new Properties();

        try (InputStream in = GatemuxConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) p.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read classpath " + RESOURCE, e);
        }

        if (overrides != null && Files.isRegularFile(overrides)) {
            try (Reader r = Files.newBufferedReader(overrides, StandardCharsets.UTF_8)) {
                p.load(r);
                log.info("Loaded overrides from {}", overrides.toAbsolutePath());
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + overrides, e);
            }
        }

        ENV_KEYS.forEach((var, key) -> {
            String v = env.get(var);
            if (v != null && !v.isBlank()) p.setProperty(key, v.trim());
        });

        GatemuxConfig config = new GatemuxConfig(p);
        config.validate();
        return config;
    }

    private void validate() {
        int port = port();
        if (port < 0 || port > 65535) throw new IllegalArgumentException("server.port out of range: " + port);
        if (terminalShell().isEmpty()) throw new IllegalArgumentException("terminal.shell is empty");
    }

    // ----------------------------------------------------------------

    public String gatewayUrl() {
        return get("gateway.url", GatewayEndpoint.DEFAULT_URL);
    }

    public String gatewayToken() {
        return get("gateway.token", "");
    }

    public String gatewayPassword() {
        return get("gateway.password", "");
    }

    public GatewayEndpoint endpoint() {
        return GatewayEndpoint.of(gatewayUrl(), gatewayToken(), gatewayPassword());
    }

    public String host() {
        return get("server.host", "0.0.0.0");
    }

    public int port() {
        return integer("server.port", 3000);
    }

    public String accessToken() {
        return get("access.token", "");
    }

    /** Comando de la terminal por defecto, separado por espacios. */
    public List<String> terminalShell() {
        String raw = get("terminal.shell", "/bin/zsh");
        return Arrays.stream(raw.trim().split("\\s+")).filter(s -> !s.isEmpty()).toList();
    }

    public Duration sessionIdleTimeout() {
        return Duration.ofMinutes(integer("session.idle-minutes", 30));
    }

    public int maxSessions() {
        return integer("session.max", 256);
    }

    public BridgeSettings bridgeSettings() {
        return BridgeSettings.defaults()
                .withKeepAlive(Duration.ofSeconds(integer("bridge.keepalive-seconds", 15)))
                .withMaxPending(integer("bridge.max-pending", 256))
                .withDefaultCommand(terminalShell());
    }

    private String get(String key, String def) {
        String v = props.getProperty(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private int integer(String key, int def) {
        String v = get(key, null);
        if (v == null) return def;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + v + "'", e);
        }
    }
}
