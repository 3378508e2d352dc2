package com.ciro.gatemux.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * JSON &lt;-&gt; {@link Frame}. Un frame por mensaje de transporte.
 *
 * <p>Acepta las variantes que mandan versiones distintas del gateway:
 * {@code payload} en lugar de {@code result}, {@code event} en lugar de {@code topic},
 * y {@code payloadJSON} como string con JSON dentro.
 */
public final class FrameCodec {

    private static final Set<String> RESPONSE_ENVELOPE = Set.of("type", "id", "ok", "error");

    private final ObjectMapper mapper;

    public FrameCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String encode(Frame frame) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", frame.type());

        if (frame instanceof RequestFrame req) {
            root.put("id", req.id());
            root.put("method", req.method());
            if (!req.params().isNull()) root.set("params", req.params());
        } else if (frame instanceof ResponseFrame res) {
            root.put("id", res.id());
            root.put("ok", res.ok());
            if (res.ok()) {
                root.set("result", res.result());
            } else {
                ObjectNode err = root.putObject("error");
                err.put("code", res.error().code());
                err.put("message", res.error().message());
                if (!res.error().details().isNull()) err.set("details", res.error().details());
            }
        } else if (frame instanceof EventFrame ev) {
            root.put("topic", ev.topic());
            root.set("payload", ev.payload());
            if (ev.seq() != null) root.put("seq", ev.seq());
        } else {
            throw new IllegalArgumentException("Unsupported frame: " + frame.getClass().getName());
        }

        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            // un ObjectNode siempre serializa
            throw new IllegalStateException(e);
        }
    }

    public Frame decode(String text) throws FrameDecodeException {
        if (text == null || text.isBlank()) throw new FrameDecodeException("empty frame", text);

        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new FrameDecodeException("malformed JSON: " + e.getOriginalMessage(), text, e);
        }
        if (root == null || !root.isObject()) {
            throw new FrameDecodeException("frame is not a JSON object", text);
        }

        String type = textField(root, "type");
        if (type == null) throw new FrameDecodeException("missing 'type'", text);

        return switch (type) {
            case Frame.TYPE_REQUEST -> decodeRequest(root, text);
            case Frame.TYPE_RESPONSE -> decodeResponse(root, text);
            case Frame.TYPE_EVENT -> decodeEvent(root, text);
            default -> throw new FrameDecodeException("unknown frame type '" + type + "'", text);
        };
    }

    private RequestFrame decodeRequest(JsonNode root, String text) throws FrameDecodeException {
        String id = requireId(root, text);
        String method = textField(root, "method");
        if (method == null) throw new FrameDecodeException("request without 'method'", text);
        return new RequestFrame(id, method, root.get("params"));
    }

    private ResponseFrame decodeResponse(JsonNode root, String text) throws FrameDecodeException {
        String id = requireId(root, text);
        JsonNode ok = root.get("ok");
        if (ok == null || !ok.isBoolean()) throw new FrameDecodeException("response without boolean 'ok'", text);

        if (!ok.booleanValue()) {
            return ResponseFrame.failure(id, ErrorShape.from(root.get("error")));
        }

        JsonNode result = root.has("result") ? root.get("result") : root.get("payload");
        if (result == null) result = leftovers(root);
        return ResponseFrame.success(id, result);
    }

    private EventFrame decodeEvent(JsonNode root, String text) throws FrameDecodeException {
        String topic = textField(root, "topic");
        if (topic == null) topic = textField(root, "event");
        if (topic == null) throw new FrameDecodeException("event without 'topic'", text);

        JsonNode payload = root.get("payload");
        if (payload == null && root.path("payloadJSON").isTextual()) {
            payload = parseEmbedded(root.get("payloadJSON").asText());
        }

        JsonNode seq = root.get("seq");
        Long s = (seq != null && seq.canConvertToLong()) ? seq.asLong() : null;
        return new EventFrame(topic, payload, s);
    }

    private JsonNode parseEmbedded(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            // payload ilegible: el evento igual se entrega, sin payload
            return NullNode.getInstance();
        }
    }

    /** Respuestas "planas": los campos que sobran del sobre forman el resultado. */
    private JsonNode leftovers(JsonNode root) {
        ObjectNode out = mapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!RESPONSE_ENVELOPE.contains(e.getKey())) out.set(e.getKey(), e.getValue());
        }
        return out.isEmpty() ? NullNode.getInstance() : out;
    }

    private static String requireId(JsonNode root, String text) throws FrameDecodeException {
        JsonNode id = root.get("id");
        if (id == null || !(id.isTextual() || id.isIntegralNumber())) {
            throw new FrameDecodeException("missing or invalid 'id'", text);
        }
        String s = id.asText();
        if (s.isBlank()) throw new FrameDecodeException("blank 'id'", text);
        return s;
    }

    private static String textField(JsonNode root, String name) {
        JsonNode n = root.get(name);
        if (n == null || !n.isTextual()) return null;
        String s = n.asText();
        return s.isBlank() ? null : s;
    }
}
