package com.ciro.gatemux.error;

/** El enlace con el gateway se cayó (o no está abierto). El llamador puede reintentar. */
public class ConnectionLostException extends GatemuxException {

    public ConnectionLostException(String message) {
        super("CONNECTION_LOST", message);
    }

    public ConnectionLostException(String message, Throwable cause) {
        super("CONNECTION_LOST", message, cause);
    }
}
