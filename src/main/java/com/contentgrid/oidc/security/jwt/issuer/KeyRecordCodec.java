package com.contentgrid.oidc.security.jwt.issuer;

import com.contentgrid.oidc.storage.KeyStorageException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.jwk.JWK;
import java.io.IOException;
import java.text.ParseException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;

/**
 * Reads and writes the stored record of a named key: its configuration plus the private keys of its ring.
 */
@RequiredArgsConstructor
class KeyRecordCodec {

    @NonNull
    private final ObjectMapper objectMapper;

    byte[] encode(NamedKeyConfig config, List<KeyEntry> keys) {
        var stored = new StoredNamedKey(
                config.getName(),
                config.getAlgorithm().name(),
                config.getRotationPeriod().getText(),
                config.getVerificationTtl().getText(),
                config.getCapacity(),
                keys.stream()
                        .map(entry -> new StoredKey(entry.getKeyId(), entry.getCreatedAt(),
                                entry.getPrivateKey().toJSONObject()))
                        .toList(),
                keys.isEmpty() ? null : keys.get(keys.size() - 1).getKeyId()
        );
        try {
            return objectMapper.writeValueAsBytes(stored);
        } catch (IOException e) {
            throw new KeyStorageException("Can not serialize named key %s".formatted(config.getName()), e);
        }
    }

    NamedKeyRecord decode(String name, byte[] bytes) {
        try {
            var stored = objectMapper.readValue(bytes, StoredNamedKey.class);
            if (!name.equals(stored.getName())) {
                throw new IllegalArgumentException("record holds named key %s".formatted(stored.getName()));
            }
            var rotationPeriod = KeyDuration.parse("rotation_period", stored.getRotationPeriod());
            var config = new NamedKeyConfig(
                    stored.getName(),
                    SigningAlgorithm.fromName(stored.getSigningAlgorithm()),
                    rotationPeriod,
                    stored.getVerificationTtl() == null ? rotationPeriod
                            : KeyDuration.parse("verification_ttl", stored.getVerificationTtl()),
                    stored.getCapacity()
            );

            var keys = new ArrayList<KeyEntry>();
            for (StoredKey storedKey : Objects.requireNonNullElse(stored.getKeyRing(), List.<StoredKey>of())) {
                if (storedKey.getKey() == null || storedKey.getCreatedAt() == null) {
                    throw new IllegalArgumentException("key %s is incomplete".formatted(storedKey.getId()));
                }
                var entry = new KeyEntry(JWK.parse(storedKey.getKey()), storedKey.getCreatedAt());
                if (!entry.getKeyId().equals(storedKey.getId())) {
                    throw new IllegalArgumentException("key id %s does not match its JWK".formatted(storedKey.getId()));
                }
                keys.add(entry);
            }
            var currentKeyId = keys.isEmpty() ? null : keys.get(keys.size() - 1).getKeyId();
            if (!Objects.equals(currentKeyId, stored.getSigningKeyId())) {
                throw new IllegalArgumentException(
                        "signing key %s is not the newest key".formatted(stored.getSigningKeyId()));
            }
            return new NamedKeyRecord(config, List.copyOf(keys));
        } catch (IOException | ParseException | IllegalArgumentException | InvalidKeyConfigurationException
                  | UnsupportedSigningAlgorithmException e) {
            throw new KeyStorageException("Stored record of named key %s is corrupt".formatted(name), e);
        }
    }

    @Value
    static class NamedKeyRecord {

        NamedKeyConfig config;

        /**
         * Keys ordered oldest first.
         */
        List<KeyEntry> keys;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class StoredNamedKey {

        private String name;

        @JsonProperty("signing_algorithm")
        private String signingAlgorithm;

        @JsonProperty("rotation_period")
        private String rotationPeriod;

        @JsonProperty("verification_ttl")
        private String verificationTtl;

        private int capacity;

        @JsonProperty("key_ring")
        private List<StoredKey> keyRing;

        @JsonProperty("signing_key_id")
        private String signingKeyId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class StoredKey {

        private String id;

        @JsonProperty("created_at")
        private Instant createdAt;

        private Map<String, Object> key;
    }
}
