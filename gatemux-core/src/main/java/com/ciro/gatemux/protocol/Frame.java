package com.ciro.gatemux.protocol;

/**
 * Unidad del protocolo del gateway. Un frame viaja como un mensaje de texto JSON
 * con discriminador {@code type}: {@code req}, {@code res} o {@code event}.
 */
public interface Frame {

    String TYPE_REQUEST = "req";
    String TYPE_RESPONSE = "res";
    String TYPE_EVENT = "event";

    String type();
}
