package com.ciro.gatemux.events;

public final class Topics {

    /** Recibe todo evento que llega del gateway. */
    public static final String ALL = "*";

    /** Cambios de estado de la conexión con el gateway. */
    public static final String CONNECTION = "gateway.connection";

    private static final String EXEC_PREFIX = "exec:";

    private Topics() {}

    public static String exec(String sessionId) {
        return EXEC_PREFIX + sessionId;
    }

    public static boolean isExec(String topic) {
        return topic != null && topic.startsWith(EXEC_PREFIX);
    }

    /** Tópicos que solo publica este proceso; el gateway no puede usarlos. */
    public static boolean isReserved(String topic) {
        return ALL.equals(topic) || CONNECTION.equals(topic) || isExec(topic);
    }
}
