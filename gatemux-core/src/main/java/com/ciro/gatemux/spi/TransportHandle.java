package com.ciro.gatemux.spi;

public interface TransportHandle {

    /** @return false si el enlace ya no acepta mensajes */
    boolean send(String text);

    void close(int code, String reason);
}
