package com.contentgrid.oidc.security.jwt.issuer.jwk.source;

import com.contentgrid.oidc.storage.JsonRecords;
import com.contentgrid.oidc.storage.KeyStorageException;
import com.contentgrid.oidc.storage.KeyValueStorage;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSelector;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import java.io.IOException;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the set of public keys relying parties use to verify issued tokens, shared by all named keys.
 * <p>
 * Writers serialize on a lock, persist the new set and only then swap it in. Readers work on an immutable snapshot and
 * never block. Expired keys are filtered out when reading; {@link #removeExpired(Instant)} drops them for good.
 */
@Slf4j
public class PublicKeyPublisher implements JWKSource<SecurityContext> {

    public static final String STORAGE_KEY = "oidc-config/publicKeys/";

    private static final TypeReference<List<StoredPublicKey>> STORED_KEYS = new TypeReference<>() {
    };

    private final KeyValueStorage storage;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Lock writeLock = new ReentrantLock();
    private volatile Map<String, ExpireableKey> keys = Map.of();

    public PublicKeyPublisher(KeyValueStorage storage, Clock clock) {
        this(storage, JsonRecords.createObjectMapper(), clock);
    }

    public PublicKeyPublisher(@NonNull KeyValueStorage storage, @NonNull ObjectMapper objectMapper,
            @NonNull Clock clock) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Replaces the in-memory key set with the one in storage.
     */
    public void load() {
        try {
            writeLock.lock();
            var loaded = new LinkedHashMap<String, ExpireableKey>();
            storage.get(STORAGE_KEY)
                    .map(this::decode)
                    .orElse(List.of())
                    .forEach(key -> loaded.put(key.getKeyId(), key));
            keys = Collections.unmodifiableMap(loaded);
            log.info("Loaded {} published keys from storage", loaded.size());
        } finally {
            writeLock.unlock();
        }
    }

    public void publish(ExpireableKey key) {
        publish(List.of(key));
    }

    /**
     * Adds keys to the published set, replacing entries with the same key id.
     *
     * @throws KeyStorageException when the updated set can not be persisted; the published set is then unchanged
     */
    public void publish(@NonNull Collection<ExpireableKey> published) {
        if (published.isEmpty()) {
            return;
        }
        try {
            writeLock.lock();
            var updated = new LinkedHashMap<>(keys);
            for (ExpireableKey key : published) {
                updated.put(key.getKeyId(), key);
            }
            persist(updated.values());
            keys = Collections.unmodifiableMap(updated);
            published.forEach(key -> log.debug("Published key {} (expirable={}, expireAt={})", key.getKeyId(),
                    key.isExpirable(), key.getExpireAt()));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return keys that can still be used for verification at {@code now}
     */
    public List<ExpireableKey> currentSet(@NonNull Instant now) {
        return keys.values()
                .stream()
                .filter(key -> key.isValidAt(now))
                .toList();
    }

    public List<ExpireableKey> currentSet() {
        return currentSet(clock.instant());
    }

    /**
     * Looks up a key regardless of its expiry.
     */
    public Optional<ExpireableKey> findByKeyId(String keyId) {
        return Optional.ofNullable(keys.get(keyId));
    }

    public JWKSet getJWKSet() {
        return new JWKSet(currentSet().stream().map(ExpireableKey::toJWK).toList());
    }

    /**
     * Permanently drops keys that expired at or before {@code now}.
     *
     * @return the number of removed keys
     */
    public int removeExpired(@NonNull Instant now) {
        try {
            writeLock.lock();
            var updated = new LinkedHashMap<>(keys);
            updated.values().removeIf(key -> !key.isValidAt(now));
            int removed = keys.size() - updated.size();
            if (removed > 0) {
                persist(updated.values());
                keys = Collections.unmodifiableMap(updated);
                log.info("Removed {} expired keys from the published key set", removed);
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<JWK> get(JWKSelector jwkSelector, SecurityContext context) {
        return jwkSelector.select(getJWKSet());
    }

    private void persist(Collection<ExpireableKey> values) {
        var stored = values.stream()
                .map(key -> new StoredPublicKey(key.getKey().toJSONObject(), key.isExpirable(), key.getExpireAt()))
                .toList();
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(stored);
        } catch (IOException e) {
            throw new KeyStorageException("Can not serialize published keys", e);
        }
        storage.put(STORAGE_KEY, bytes);
    }

    private List<ExpireableKey> decode(byte[] bytes) {
        try {
            var result = new ArrayList<ExpireableKey>();
            for (StoredPublicKey stored : objectMapper.readValue(bytes, STORED_KEYS)) {
                result.add(new ExpireableKey(JWK.parse(stored.getKey()), stored.isExpirable(), stored.getExpireAt()));
            }
            return result;
        } catch (IOException | ParseException | IllegalArgumentException e) {
            throw new KeyStorageException("Stored published keys are corrupt", e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class StoredPublicKey {

        private Map<String, Object> key;

        private boolean expirable;

        @JsonProperty("expire_at")
        private Instant expireAt;
    }
}
