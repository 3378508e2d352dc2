package com.ciro.gatemux.exec;

public enum ExecState {
    CREATING,
    READY,
    CLOSING,
    CLOSED
}
