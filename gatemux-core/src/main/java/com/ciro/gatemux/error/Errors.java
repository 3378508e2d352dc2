package com.ciro.gatemux.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class Errors {

    private Errors() {}

    /** Quita los envoltorios de CompletableFuture para ver la causa real. */
    public static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    public static String code(Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof GatemuxException ge) return ge.code();
        if (cause instanceof IllegalArgumentException) return "BAD_REQUEST";
        return "INTERNAL";
    }

    /** Status HTTP con el que los adaptadores reportan el fallo. */
    public static int httpStatus(Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof SessionNotFoundException) return 404;
        if (cause instanceof SessionNotReadyException) return 409;
        if (cause instanceof ConnectionLostException || cause instanceof MissingCredentialsException) return 503;
        if (cause instanceof RpcTimeoutException) return 504;
        if (cause instanceof GatewayErrorException) return 502;
        if (cause instanceof IllegalArgumentException) return 400;
        return 500;
    }

    public static String message(Throwable t) {
        Throwable cause = unwrap(t);
        String msg = cause.getMessage();
        return (msg == null || msg.isBlank()) ? cause.getClass().getSimpleName() : msg;
    }
}
