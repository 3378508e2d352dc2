package com.ciro.gatemux.spring;

import com.ciro.gatemux.bridge.BridgeMessage;
import com.ciro.gatemux.spi.BridgeSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/** {@link BridgeSink} sobre un {@link SseEmitter}: un mensaje = un evento SSE con nombre. */
class SseEmitterSink implements BridgeSink {

    private final SseEmitter emitter;
    private final ObjectMapper mapper;
    private final AtomicBoolean open = new AtomicBoolean(true);

    SseEmitterSink(SseEmitter emitter, ObjectMapper mapper) {
        this.emitter = emitter;
        this.mapper = mapper;
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void send(BridgeMessage message) throws IOException {
        SseEmitter.SseEventBuilder event = SseEmitter.event()
                .name(message.event())
                .data(message.dataJson(mapper));
        if (message.id() != null) event.id(message.id());
        try {
            emitter.send(event);
        } catch (IOException | IllegalStateException e) {
            open.set(false);
            throw (e instanceof IOException io) ? io : new IOException(e);
        }
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) emitter.complete();
    }

    /** El emitter ya terminó (cliente se fue, timeout, error). */
    void markClosed() {
        open.set(false);
    }
}
