package com.ciro.gatemux.bridge;

/** Qué hacer con una terminal cuando la última pestaña que la miraba se va. */
public enum TerminalPolicy {
    /** Dejarla viva; se puede volver a adjuntar hasta que expire por inactividad. */
    KEEP,
    CLOSE_WHEN_UNWATCHED
}
