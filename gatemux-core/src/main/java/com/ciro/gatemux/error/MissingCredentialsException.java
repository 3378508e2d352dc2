package com.ciro.gatemux.error;

/** Sin token ni password no se intenta conectar. Fatal: no hay reintento. */
public class MissingCredentialsException extends GatemuxException {

    public MissingCredentialsException(String message) {
        super("MISSING_CREDENTIALS", message);
    }
}
