package com.ciro.gatemux.events;

@FunctionalInterface
public interface Subscriber {

    /** Se llama en el hilo que publica. No debe bloquear. */
    void deliver(GatewayEvent event);
}
