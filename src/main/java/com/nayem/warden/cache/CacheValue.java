package com.nayem.warden.cache;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A cached value, tagged as either a plain {@link Scalar} or a map-like
 * {@link Structured} record.
 * <p>
 * The tag decides how {@link #mergeWith(CacheValue)} behaves: two structured
 * records merge field by field, every other combination is a replacement.
 * </p>
 */
public sealed interface CacheValue extends Serializable permits CacheValue.Scalar, CacheValue.Structured {

    /**
     * Combines this (existing) value with an incoming one.
     *
     * @param incoming the value being written
     * @return the value that should be stored
     */
    CacheValue mergeWith(CacheValue incoming);

    /**
     * The raw payload: the scalar object, or the field map.
     */
    Object unwrap();

    /**
     * Wraps a plain object. Maps become {@link Structured} records (keys are
     * converted with {@link String#valueOf}); anything else becomes a
     * {@link Scalar}. An existing {@code CacheValue} is returned as is.
     */
    static CacheValue of(Object value) {
        if (value instanceof CacheValue cacheValue) {
            return cacheValue;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> fields = new LinkedHashMap<>();
            map.forEach((k, v) -> fields.put(String.valueOf(k), v));
            return new Structured(fields);
        }
        return new Scalar(value);
    }

    record Scalar(Object value) implements CacheValue {

        public Scalar {
            Objects.requireNonNull(value, "Scalar cache value must not be null");
        }

        @Override
        public CacheValue mergeWith(CacheValue incoming) {
            return incoming;
        }

        @Override
        public Object unwrap() {
            return value;
        }
    }

    record Structured(Map<String, Object> fields) implements CacheValue {

        public Structured {
            Objects.requireNonNull(fields, "Structured cache value must not be null");
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public CacheValue mergeWith(CacheValue incoming) {
            if (incoming instanceof Structured other) {
                Map<String, Object> merged = new LinkedHashMap<>(fields);
                merged.putAll(other.fields);
                return new Structured(merged);
            }
            return incoming;
        }

        @Override
        public Object unwrap() {
            return fields;
        }
    }
}
