package com.ciro.gatemux.rpc;

import com.ciro.gatemux.error.ConnectionLostException;
import com.ciro.gatemux.protocol.RequestFrame;

/**
 * Camino de salida de los requests. Lo implementa el dueño del transporte.
 */
@FunctionalInterface
public interface FrameSender {

    /**
     * Escribe el frame en el enlace actual.
     *
     * @throws ConnectionLostException si no hay enlace que acepte frames
     */
    void send(RequestFrame frame);
}
