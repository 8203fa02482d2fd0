package com.nayem.warden.cache.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.warden.cache.CacheSerializationException;
import com.nayem.warden.cache.CacheValue;

/**
 * Converts cache values to the opaque byte payload stored remotely, and back.
 */
public interface CacheValueCodec {

    /**
     * @throws CacheSerializationException if the value cannot be encoded
     */
    byte[] encode(CacheValue value);

    /**
     * @throws CacheSerializationException if the payload cannot be decoded
     */
    CacheValue decode(byte[] payload);

    /**
     * Configuration name of this codec, e.g. {@code json}.
     */
    String name();

    /**
     * Resolves a codec by configuration name.
     * <p>
     * {@code json} stores scalars as plain JSON, so their Java type is not kept:
     * a {@code Long} may come back as an {@code Integer} and a {@code byte[]}
     * as a base64 {@code String}. {@code jdk} keeps exact types but needs
     * {@link java.io.Serializable} values.
     * </p>
     */
    static CacheValueCodec forName(String name, ObjectMapper objectMapper) {
        return switch (name.toLowerCase()) {
            case JacksonCacheValueCodec.NAME -> new JacksonCacheValueCodec(objectMapper);
            case JdkSerializationCacheValueCodec.NAME -> new JdkSerializationCacheValueCodec();
            default -> throw new IllegalArgumentException("Unknown cache codec '" + name + "'");
        };
    }
}
