package com.ciro.gatemux.standalone;

import com.ciro.gatemux.Gatemux;
import com.ciro.gatemux.error.Errors;
import com.ciro.gatemux.error.MissingCredentialsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        GatemuxConfig config = GatemuxConfig.load();

        Gatemux gatemux = Gatemux.builder()
                .endpoint(config.endpoint())
                .bridgeSettings(config.bridgeSettings())
                .idleTimeout(config.sessionIdleTimeout())
                .maxSessions(config.maxSessions())
                .build();

        GatemuxServer server = new GatemuxServer(config, gatemux);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            gatemux.close();
        }, "gatemux-shutdown"));

        // sin credenciales el server sigue arriba: se pueden cargar por /api/gateway-config
        try {
            gatemux.start().whenComplete((v, err) -> {
                if (err != null) log.warn("Gateway not reachable yet ({}), retrying in background", Errors.message(err));
            });
        } catch (MissingCredentialsException e) {
            log.error("No gateway token or password configured; set CLAWDBOT_GATEWAY_TOKEN or POST /api/gateway-config");
        }
    }
}
