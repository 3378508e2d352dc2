package com.ciro.gatemux.error;

import java.time.Duration;

public class RpcTimeoutException extends GatemuxException {

    private final String method;
    private final Duration timeout;

    public RpcTimeoutException(String method, String requestId, Duration timeout) {
        super("TIMEOUT", "'" + method + "' (" + requestId + ") got no response within " + timeout.toMillis() + "ms");
        this.method = method;
        this.timeout = timeout;
    }

    public String method() {
        return method;
    }

    public Duration timeout() {
        return timeout;
    }
}
