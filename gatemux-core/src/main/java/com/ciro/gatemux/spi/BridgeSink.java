package com.ciro.gatemux.spi;

import com.ciro.gatemux.bridge.BridgeMessage;

import java.io.IOException;

/**
 * Salida hacia una pestaña del navegador (SSE, WebSocket...). La implementa cada adaptador.
 */
public interface BridgeSink {

    boolean isOpen();

    void send(BridgeMessage message) throws IOException;

    void close();
}
