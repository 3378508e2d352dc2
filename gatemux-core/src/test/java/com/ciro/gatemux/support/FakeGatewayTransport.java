package com.ciro.gatemux.support;

import com.ciro.gatemux.spi.GatewayTransport;
import com.ciro.gatemux.spi.TransportHandle;
import com.ciro.gatemux.spi.TransportListener;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Gateway de mentira: cada {@code open} crea un {@link FakeLink} que el test maneja a mano
 * (abrir, contestar, empujar eventos, cortar).
 */
public final class FakeGatewayTransport implements GatewayTransport {

    private final ObjectMapper mapper;
    private final List<FakeLink> links = new CopyOnWriteArrayList<>();

    public FakeGatewayTransport(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public TransportHandle open(URI url, TransportListener listener) {
        FakeLink link = new FakeLink(url, listener);
        links.add(link);
        return link;
    }

    public List<FakeLink> links() {
        return links;
    }

    public FakeLink awaitLink(int index, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (links.size() <= index) {
            if (System.nanoTime() > deadline) fail("link #" + index + " was never opened");
            sleep(5);
        }
        return links.get(index);
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    public final class FakeLink implements TransportHandle {
        private final URI url;
        private final TransportListener listener;
        private final BlockingQueue<String> sent = new LinkedBlockingQueue<>();
        private volatile boolean closed;

        FakeLink(URI url, TransportListener listener) {
            this.url = url;
            this.listener = listener;
        }

        public URI url() {
            return url;
        }

        @Override
        public boolean send(String text) {
            if (closed) return false;
            sent.add(text);
            return true;
        }

        @Override
        public void close(int code, String reason) {
            closed = true;
        }

        public boolean isClosed() {
            return closed;
        }

        // --- lado gateway ---

        public void open() {
            listener.onOpen();
        }

        public JsonNode nextRequest() {
            return nextRequest(Duration.ofSeconds(2));
        }

        public JsonNode nextRequest(Duration timeout) {
            try {
                String text = sent.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
                assertNotNull(text, "no request was sent");
                return mapper.readTree(text);
            } catch (InterruptedException | IOException e) {
                throw new IllegalStateException(e);
            }
        }

        public boolean hasPendingRequests() {
            return !sent.isEmpty();
        }

        public void reply(JsonNode request, JsonNode result) {
            ObjectNode res = mapper.createObjectNode();
            res.put("type", "res");
            res.put("id", request.get("id").asText());
            res.put("ok", true);
            res.set("result", result);
            push(res.toString());
        }

        public void replyError(JsonNode request, String code, String message) {
            ObjectNode res = mapper.createObjectNode();
            res.put("type", "res");
            res.put("id", request.get("id").asText());
            res.put("ok", false);
            ObjectNode err = res.putObject("error");
            err.put("code", code);
            err.put("message", message);
            push(res.toString());
        }

        public void event(String topic, JsonNode payload) {
            ObjectNode ev = mapper.createObjectNode();
            ev.put("type", "event");
            ev.put("topic", topic);
            ev.set("payload", payload);
            push(ev.toString());
        }

        public void push(String raw) {
            listener.onText(raw);
        }

        /** Abre y completa el handshake. */
        public JsonNode handshake() {
            open();
            JsonNode req = nextRequest();
            reply(req, mapper.createObjectNode().put("type", "hello-ok"));
            return req;
        }

        public void drop() {
            closed = true;
            listener.onFailure(new IOException("connection reset"));
        }

        public void closeFromGateway(int code, String reason) {
            closed = true;
            listener.onClosed(code, reason);
        }
    }
}
