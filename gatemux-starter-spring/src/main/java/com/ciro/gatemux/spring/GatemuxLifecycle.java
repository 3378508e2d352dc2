package com.ciro.gatemux.spring;

import com.ciro.gatemux.Gatemux;
import com.ciro.gatemux.error.Errors;
import com.ciro.gatemux.error.MissingCredentialsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Conecta al gateway cuando arranca el contexto. Sin credenciales la app sigue arriba:
 * se pueden cargar después por {@code POST /api/gateway-config}.
 */
public class GatemuxLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GatemuxLifecycle.class);

    private final Gatemux gatemux;
    private final boolean autoStart;
    private volatile boolean running;

    public GatemuxLifecycle(Gatemux gatemux, boolean autoStart) {
        this.gatemux = gatemux;
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        running = true;
        if (!autoStart) return;
        try {
            gatemux.start().whenComplete((v, err) -> {
                if (err != null) log.warn("Gateway not reachable yet ({}), retrying in background", Errors.message(err));
            });
        } catch (MissingCredentialsException e) {
            log.error("No gateway token or password configured (gatemux.gateway.token / gatemux.gateway.password)");
        }
    }

    @Override
    public void stop() {
        running = false;
        gatemux.connection().close();
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
