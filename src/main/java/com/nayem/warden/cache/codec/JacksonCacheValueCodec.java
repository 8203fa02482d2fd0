package com.nayem.warden.cache.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nayem.warden.cache.CacheSerializationException;
import com.nayem.warden.cache.CacheValue;

import java.io.IOException;
import java.util.Map;

/**
 * JSON codec backed by Jackson.
 * <p>
 * Payload shape: {@code {"kind":"scalar"|"structured","value":...}}. Scalars
 * come back as JSON-native Java types (String, Number, Boolean, List, Map), so
 * arbitrary beans do not keep their class across a round trip.
 * </p>
 */
public class JacksonCacheValueCodec implements CacheValueCodec {

    static final String NAME = "json";
    private static final String KIND = "kind";
    private static final String VALUE = "value";
    private static final String SCALAR = "scalar";
    private static final String STRUCTURED = "structured";

    private final ObjectMapper objectMapper;

    public JacksonCacheValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] encode(CacheValue value) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put(KIND, value instanceof CacheValue.Structured ? STRUCTURED : SCALAR);
        try {
            envelope.set(VALUE, objectMapper.valueToTree(value.unwrap()));
            return objectMapper.writeValueAsBytes(envelope);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new CacheSerializationException(
                    "Failed to encode " + value.unwrap().getClass().getName() + " as JSON", e);
        }
    }

    @Override
    public CacheValue decode(byte[] payload) {
        try {
            JsonNode envelope = objectMapper.readTree(payload);
            JsonNode kind = envelope == null ? null : envelope.get(KIND);
            if (kind == null || !envelope.has(VALUE)) {
                throw new CacheSerializationException("Malformed cache payload: missing kind or value", null);
            }
            JsonNode value = envelope.get(VALUE);
            if (STRUCTURED.equals(kind.asText())) {
                Map<String, Object> fields = objectMapper.convertValue(value, new TypeReference<Map<String, Object>>() {
                });
                return new CacheValue.Structured(fields);
            }
            return new CacheValue.Scalar(objectMapper.treeToValue(value, Object.class));
        } catch (IOException | IllegalArgumentException e) {
            throw new CacheSerializationException("Failed to decode JSON cache payload", e);
        }
    }

    @Override
    public String name() {
        return NAME;
    }
}
