package com.demo.instrument.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.grpc.Metadata;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders request and response messages for access logs as JSON.
 * Messages Jackson cannot serialize fall back to their {@code toString()}.
 */
public class PayloadFormatter {
    private final ObjectMapper objectMapper;

    public PayloadFormatter() {
        this(new ObjectMapper());
    }

    public PayloadFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String format(Object payload) {
        JsonNode node = toNode(payload);
        return node.isTextual() ? node.asText() : node.toString();
    }

    /**
     * Server request rendering: the message under {@code payload} and the incoming headers under
     * {@code metadata}.
     */
    public String format(Object payload, Metadata metadata) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.set("payload", toNode(payload));
        envelope.set("metadata", objectMapper.valueToTree(toMap(metadata)));
        return envelope.toString();
    }

    private JsonNode toNode(Object payload) {
        if (payload == null) {
            return objectMapper.nullNode();
        }
        if (payload instanceof CharSequence) {
            return TextNode.valueOf(payload.toString());
        }
        try {
            return objectMapper.readTree(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(describe(payload));
        }
    }

    private static String describe(Object payload) {
        try {
            return String.valueOf(payload);
        } catch (RuntimeException e) {
            return payload.getClass().getName() + " (unprintable: " + e + ")";
        }
    }

    static Map<String, String> toMap(Metadata metadata) {
        Map<String, String> values = new LinkedHashMap<>();
        if (metadata == null) {
            return values;
        }
        for (String key : metadata.keys()) {
            if (key.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
                continue;
            }
            Iterable<String> all = metadata.getAll(Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER));
            if (all != null) {
                values.put(key, String.join(",", all));
            }
        }
        return values;
    }
}
