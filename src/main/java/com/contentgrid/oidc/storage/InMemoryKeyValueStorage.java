package com.contentgrid.oidc.storage;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.NonNull;

/**
 * Process-local {@link KeyValueStorage}. Values are copied on the way in and out, so callers can never
 * mutate stored bytes.
 */
public class InMemoryKeyValueStorage implements KeyValueStorage {

    private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(@NonNull String key) {
        return Optional.ofNullable(entries.get(key))
                .map(value -> Arrays.copyOf(value, value.length));
    }

    @Override
    public void put(@NonNull String key, @NonNull byte[] value) {
        entries.put(key, Arrays.copyOf(value, value.length));
    }

    @Override
    public void delete(@NonNull String key) {
        entries.remove(key);
    }
}
