package com.ciro.gatemux.standalone;

import com.ciro.gatemux.bridge.BridgeSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GatemuxConfigTest {

    @Test
    void defaultsComeFromClasspathProperties() {
        GatemuxConfig config = GatemuxConfig.load(Map.of(), null);

        assertEquals("ws://127.0.0.1:18789", config.gatewayUrl());
        assertEquals("0.0.0.0", config.host());
        assertEquals(3000, config.port());
        assertEquals("", config.accessToken());
        assertEquals(List.of("/bin/zsh"), config.terminalShell());
        assertEquals(Duration.ofMinutes(30), config.sessionIdleTimeout());
        assertEquals(256, config.maxSessions());
        assertFalse(config.endpoint().hasCredentials());
    }

    @Test
    void environmentWinsOverFiles(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("gatemux.properties");
        Files.writeString(file, "server.port=4000\ngateway.token=from-file\nbridge.max-pending=32\n", StandardCharsets.UTF_8);

        GatemuxConfig config = GatemuxConfig.load(Map.of(
                "GATEMUX_PORT", "5000",
                "CLAWDBOT_GATEWAY_URL", "wss://gw.example.com/socket",
                "GATEMUX_TERMINAL_SHELL", "/bin/bash --login"), file);

        assertEquals(5000, config.port());
        assertEquals("from-file", config.gatewayToken());
        assertEquals("wss://gw.example.com/socket", config.endpoint().url().toString());
        assertTrue(config.endpoint().hasCredentials());
        assertEquals(List.of("/bin/bash", "--login"), config.terminalShell());

        BridgeSettings bridge = config.bridgeSettings();
        assertEquals(32, bridge.maxPending());
        assertEquals(List.of("/bin/bash", "--login"), bridge.defaultCommand());
        assertEquals(Duration.ofSeconds(15), bridge.keepAlive());
    }

    @Test
    void blankEnvironmentValuesAreIgnored() {
        GatemuxConfig config = GatemuxConfig.load(Map.of("GATEMUX_HOST", "  "), null);
        assertEquals("0.0.0.0", config.host());
    }

    @Test
    void missingOverrideFileIsFine(@TempDir Path dir) {
        GatemuxConfig config = GatemuxConfig.load(Map.of(), dir.resolve("nope.properties"));
        assertEquals(3000, config.port());
    }

    @Test
    void rejectsBadPort() {
        IllegalArgumentException nan = assertThrows(IllegalArgumentException.class,
                () -> GatemuxConfig.load(Map.of("GATEMUX_PORT", "http"), null));
        assertTrue(nan.getMessage().contains("server.port"));

        assertThrows(IllegalArgumentException.class,
                () -> GatemuxConfig.load(Map.of("GATEMUX_PORT", "70000"), null));
    }

    @Test
    void badGatewayUrlSurfacesWhenBuildingEndpoint() {
        GatemuxConfig config = GatemuxConfig.load(Map.of("CLAWDBOT_GATEWAY_URL", "http://gw.example.com"), null);
        assertThrows(IllegalArgumentException.class, config::endpoint);
    }
}
