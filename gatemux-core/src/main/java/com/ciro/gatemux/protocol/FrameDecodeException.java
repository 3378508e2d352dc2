package com.ciro.gatemux.protocol;

/**
 * Frame entrante ilegible o con forma inválida. Quien recibe lo registra y lo descarta;
 * nunca tumba la conexión.
 */
public class FrameDecodeException extends Exception {

    private final String raw;

    public FrameDecodeException(String message, String raw) {
        super(message);
        this.raw = raw;
    }

    public FrameDecodeException(String message, String raw, Throwable cause) {
        super(message, cause);
        this.raw = raw;
    }

    /** Texto recibido, recortado para logs. */
    public String raw() {
        if (raw == null) return "";
        return raw.length() > 200 ? raw.substring(0, 200) + "..." : raw;
    }
}
