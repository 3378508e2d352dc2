package com.ciro.gatemux.events;

/** Handle de una suscripción. {@link #close()} es idempotente. */
public interface Subscription extends AutoCloseable {

    String topic();

    boolean isActive();

    @Override
    void close();
}
