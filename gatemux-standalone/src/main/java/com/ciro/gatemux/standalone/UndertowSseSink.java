package com.ciro.gatemux.standalone;

import com.ciro.gatemux.bridge.BridgeMessage;
import com.ciro.gatemux.spi.BridgeSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.handlers.sse.ServerSentEventConnection;
import org.xnio.IoUtils;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link BridgeSink} sobre una conexión SSE de Undertow. {@link #send} espera a que el
 * evento salga (o falle): el canal del bridge ya lo llama fuera del hilo de IO.
 */
final class UndertowSseSink implements BridgeSink {

    private final ServerSentEventConnection connection;
    private final ObjectMapper mapper;
    private final Duration writeTimeout;

    UndertowSseSink(ServerSentEventConnection connection, ObjectMapper mapper, Duration writeTimeout) {
        this.connection = connection;
        this.mapper = mapper;
        this.writeTimeout = writeTimeout;
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public void send(BridgeMessage message) throws IOException {
        CompletableFuture<Void> written = new CompletableFuture<>();
        connection.send(message.dataJson(mapper), message.event(), message.id(), new ServerSentEventConnection.EventCallback() {
            @Override
            public void done(ServerSentEventConnection c, String data, String event, String id) {
                written.complete(null);
            }

            @Override
            public void failed(ServerSentEventConnection c, String data, String event, String id, IOException e) {
                written.completeExceptionally(e);
            }
        });

        try {
            written.get(writeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while writing SSE event", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) throw io;
            throw new IOException(cause);
        } catch (TimeoutException e) {
            throw new IOException("SSE write timed out after " + writeTimeout.toMillis() + "ms", e);
        }
    }

    @Override
    public void close() {
        IoUtils.safeClose(connection);
    }
}
