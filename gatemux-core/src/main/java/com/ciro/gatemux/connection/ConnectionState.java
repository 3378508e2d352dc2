package com.ciro.gatemux.connection;

import java.util.Locale;

public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED;

    /** Nombre en minúsculas, tal como sale en el JSON de estado. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
