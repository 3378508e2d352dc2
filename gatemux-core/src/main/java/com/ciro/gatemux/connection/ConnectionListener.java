package com.ciro.gatemux.connection;

import com.ciro.gatemux.error.ConnectionLostException;

public interface ConnectionListener {

    default void onStateChanged(ConnectionState previous, ConnectionState current) {}

    /** El enlace actual murió. Todo lo que dependía de él ya no es válido. */
    default void onConnectionLost(ConnectionLostException cause) {}
}
