package com.nayem.warden.cache.codec;

import com.nayem.warden.cache.CacheSerializationException;
import com.nayem.warden.cache.CacheValue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

/**
 * Java serialization codec. Keeps the exact runtime type of scalar values, but
 * every value in the graph must be {@link java.io.Serializable}.
 * <p>
 * Only use against a store whose contents are written by trusted processes.
 * </p>
 */
public class JdkSerializationCacheValueCodec implements CacheValueCodec {

    static final String NAME = "jdk";

    @Override
    public byte[] encode(CacheValue value) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        } catch (IOException e) {
            throw new CacheSerializationException(
                    "Failed to serialize " + value.unwrap().getClass().getName(), e);
        }
        return bytes.toByteArray();
    }

    @Override
    public CacheValue decode(byte[] payload) {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(payload))) {
            Object decoded = in.readObject();
            if (decoded instanceof CacheValue value) {
                return value;
            }
            throw new CacheSerializationException(
                    "Payload holds " + decoded.getClass().getName() + ", not a cache value", null);
        } catch (IOException | ClassNotFoundException e) {
            throw new CacheSerializationException("Failed to deserialize cache payload", e);
        }
    }

    @Override
    public String name() {
        return NAME;
    }
}
