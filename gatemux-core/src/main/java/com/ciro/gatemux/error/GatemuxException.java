package com.ciro.gatemux.error;

/**
 * Raíz de los errores del multiplexor. {@link #code()} es estable y viaja a los clientes HTTP.
 */
public class GatemuxException extends RuntimeException {

    private final String code;

    public GatemuxException(String code, String message) {
        super(message);
        this.code = code;
    }

    public GatemuxException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
