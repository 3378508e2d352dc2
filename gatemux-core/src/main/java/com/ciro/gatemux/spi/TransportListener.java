package com.ciro.gatemux.spi;

public interface TransportListener {

    void onOpen();

    void onText(String text);

    void onClosed(int code, String reason);

    void onFailure(Throwable error);
}
