package com.ciro.gatemux.transport;

import com.ciro.gatemux.spi.GatewayTransport;
import com.ciro.gatemux.spi.TransportHandle;
import com.ciro.gatemux.spi.TransportListener;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * WebSocket de OkHttp hacia el gateway. Un {@link WebSocket} por enlace.
 */
public class OkHttpGatewayTransport implements GatewayTransport {

    private static final Logger log = LoggerFactory.getLogger(OkHttpGatewayTransport.class);

    private final OkHttpClient httpClient;
    private final Map<String, String> headers;

    public OkHttpGatewayTransport(Duration connectTimeout) {
        this(new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                // sin readTimeout: el enlace es de larga vida y el heartbeat detecta silencios
                .readTimeout(Duration.ZERO)
                .build(), Map.of());
    }

    public OkHttpGatewayTransport(OkHttpClient httpClient, Map<String, String> headers) {
        this.httpClient = httpClient;
        this.headers = Map.copyOf(headers);
    }

    @Override
    public TransportHandle open(URI url, TransportListener listener) {
        Request.Builder rb = new Request.Builder().url(url.toString());
        headers.forEach(rb::header);

        WebSocket ws = httpClient.newWebSocket(rb.build(), new Adapter(url, listener));
        return new Handle(ws);
    }

    @Override
    public void shutdown() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    private static final class Handle implements TransportHandle {
        private final WebSocket ws;

        Handle(WebSocket ws) {
            this.ws = ws;
        }

        @Override
        public boolean send(String text) {
            return ws.send(text);
        }

        @Override
        public void close(int code, String reason) {
            if (!ws.close(code, reason)) {
                // ya cerrado o cerrando: cortar en seco
                ws.cancel();
            }
        }
    }

    private static final class Adapter extends WebSocketListener {
        private final URI url;
        private final TransportListener listener;

        Adapter(URI url, TransportListener listener) {
            this.url = url;
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            log.debug("WebSocket open to {}", url);
            listener.onOpen();
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            listener.onText(text);
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            // 1005/1006 son reservados: se contesta siempre con cierre normal
            webSocket.close(1000, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            listener.onClosed(code, reason);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            if (response != null) {
                log.debug("WebSocket to {} failed with HTTP {}", url, response.code());
            }
            listener.onFailure(t);
        }
    }
}
