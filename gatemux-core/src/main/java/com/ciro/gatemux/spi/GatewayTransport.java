package com.ciro.gatemux.spi;

import java.net.URI;

/**
 * Abre enlaces de mensajes de texto hacia el gateway. Cada llamada a {@link #open} es un
 * enlace nuevo e independiente; no se reutiliza estado entre enlaces.
 */
public interface GatewayTransport {

    /**
     * Inicia la conexión. El resultado llega por {@code listener}: {@code onOpen} y luego
     * mensajes, o {@code onFailure}/{@code onClosed}.
     */
    TransportHandle open(URI url, TransportListener listener);

    /** Libera hilos y pools. */
    default void shutdown() {}
}
