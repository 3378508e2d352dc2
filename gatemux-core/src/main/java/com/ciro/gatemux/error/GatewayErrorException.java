package com.ciro.gatemux.error;

import com.ciro.gatemux.protocol.ErrorShape;

/**
 * El gateway respondió {@code ok:false}. El error del peer se conserva tal cual.
 */
public class GatewayErrorException extends GatemuxException {

    private final String method;
    private final ErrorShape error;

    public GatewayErrorException(String method, ErrorShape error) {
        super("GATEWAY_ERROR", "'" + method + "' failed: " + error);
        this.method = method;
        this.error = error;
    }

    public String method() {
        return method;
    }

    public ErrorShape error() {
        return error;
    }
}
