package com.contentgrid.oidc.security.jwt.issuer;

import com.contentgrid.oidc.security.jwt.issuer.KeyRecordCodec.NamedKeyRecord;
import com.contentgrid.oidc.security.jwt.issuer.jwk.source.ExpireableKey;
import com.contentgrid.oidc.security.jwt.issuer.jwk.source.PublicKeyPublisher;
import com.contentgrid.oidc.storage.JsonRecords;
import com.contentgrid.oidc.storage.KeyStorageException;
import com.contentgrid.oidc.storage.KeyValueStorage;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * {@link NamedKeyRegistry} that persists every named key, including the private keys of its ring, in a
 * {@link KeyValueStorage}.
 * <p>
 * Named keys created by another instance, or before a restart, are loaded from storage on first access.
 * <p>
 * Each rotation is written in this order: the named key record, then the published key set, then the in-memory ring.
 * When publishing fails, the previous record is put back, so storage never references keys that were not published.
 */
@Slf4j
public class StorageBackedNamedKeyRegistry implements NamedKeyRegistry {

    public static final String NAMED_KEY_PREFIX = "oidc-config/namedKey/";
    public static final int DEFAULT_RING_CAPACITY = 4;
    public static final int MAX_RING_CAPACITY = 1024;

    private static final Pattern NAME_PATTERN = Pattern.compile("\\w(([\\w.-]+)?\\w)?");

    private final KeyValueStorage storage;
    private final PublicKeyPublisher publisher;
    private final KeyMaterialGenerator generator;
    private final KeyRecordCodec codec;
    private final int ringCapacity;
    private final Clock clock;

    private final Map<String, NamedKey> namedKeys = new ConcurrentHashMap<>();
    private final Map<String, Lock> locks = new ConcurrentHashMap<>();

    public StorageBackedNamedKeyRegistry(KeyValueStorage storage, PublicKeyPublisher publisher,
            KeyMaterialGenerator generator, Clock clock) {
        this(storage, publisher, generator, DEFAULT_RING_CAPACITY, clock);
    }

    public StorageBackedNamedKeyRegistry(@NonNull KeyValueStorage storage, @NonNull PublicKeyPublisher publisher,
            @NonNull KeyMaterialGenerator generator, int ringCapacity, @NonNull Clock clock) {
        if (ringCapacity < 1 || ringCapacity > MAX_RING_CAPACITY) {
            throw new IllegalArgumentException("Ring capacity must be between 1 and %d, got %d".formatted(
                    MAX_RING_CAPACITY, ringCapacity));
        }
        this.storage = storage;
        this.publisher = publisher;
        this.generator = generator;
        this.codec = new KeyRecordCodec(JsonRecords.createObjectMapper());
        this.ringCapacity = ringCapacity;
        this.clock = clock;
    }

    @Override
    public NamedKeyConfig create(String name, String rotationPeriod, String verificationTtl, String algorithm) {
        if (!StringUtils.hasText(name)) {
            throw new InvalidKeyConfigurationException("name must not be empty");
        }
        if (!isValidName(name)) {
            throw new InvalidKeyConfigurationException(
                    "name %s is invalid; it may only contain letters, digits, '_', '-' and '.'".formatted(name));
        }
        var parsedRotationPeriod = KeyDuration.parse("rotation_period", rotationPeriod);
        var parsedVerificationTtl = StringUtils.hasText(verificationTtl)
                ? KeyDuration.parse("verification_ttl", verificationTtl)
                : parsedRotationPeriod;
        var signingAlgorithm = SigningAlgorithm.fromName(algorithm);

        var config = new NamedKeyConfig(name, signingAlgorithm, parsedRotationPeriod, parsedVerificationTtl,
                capacityFor(parsedRotationPeriod, parsedVerificationTtl));

        var lock = lockFor(name);
        try {
            lock.lock();
            if (namedKeys.containsKey(name) || storage.get(recordKey(name)).isPresent()) {
                throw new NamedKeyAlreadyExistsException("Named key %s already exists".formatted(name));
            }

            var ring = createRing(config);
            ring.rotate();
            namedKeys.put(name, new NamedKey(config, ring));
            log.info("Created named key {} (algorithm={}, rotation_period={}, verification_ttl={}, capacity={})",
                    name, signingAlgorithm, parsedRotationPeriod, parsedVerificationTtl, config.getCapacity());
            return config;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public NamedKeyConfig get(String name) {
        return find(name)
                .map(NamedKey::getConfig)
                .orElseThrow(() -> new NamedKeyNotFoundException("Named key %s does not exist.".formatted(name)));
    }

    @Override
    public Optional<JwtClaimsSigner> getSigner(String name) {
        return find(name).map(NamedKey::getRing);
    }

    private Optional<NamedKey> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        var cached = namedKeys.get(name);
        if (cached != null) {
            return Optional.of(cached);
        }
        // Unknown names never get a lock, so lookups of random names do not grow the lock map
        if (!isValidName(name) || storage.get(recordKey(name)).isEmpty()) {
            return Optional.empty();
        }

        var lock = lockFor(name);
        try {
            lock.lock();
            cached = namedKeys.get(name);
            if (cached != null) {
                return Optional.of(cached);
            }
            var loaded = storage.get(recordKey(name))
                    .map(bytes -> load(codec.decode(name, bytes)));
            loaded.ifPresent(namedKey -> namedKeys.put(name, namedKey));
            return loaded;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int rotateDueKeys() {
        int rotated = 0;
        for (NamedKey namedKey : namedKeys.values()) {
            try {
                if (namedKey.getRing().rotateIfDue()) {
                    rotated++;
                }
            } catch (OidcKeyException e) {
                log.warn("Named key {}: rotation before reading public keys failed", namedKey.getConfig().getName(),
                        e);
            }
        }
        return rotated;
    }

    int lockedNameCount() {
        return locks.size();
    }

    private NamedKey load(NamedKeyRecord record) {
        var config = record.getConfig();
        KeyRing ring;
        try {
            ring = createRing(config);
            ring.restore(record.getKeys());
        } catch (IllegalArgumentException e) {
            throw new KeyStorageException("Stored record of named key %s is corrupt".formatted(config.getName()), e);
        }

        // A crash between writing the record and publishing leaves keys that verifiers can not see yet
        var unpublished = record.getKeys()
                .stream()
                .filter(entry -> publisher.findByKeyId(entry.getKeyId()).isEmpty())
                .map(entry -> ExpireableKey.active(entry.getPublicKey()))
                .toList();
        if (!unpublished.isEmpty()) {
            log.warn("Named key {}: republishing {} keys missing from the published key set", config.getName(),
                    unpublished.size());
            publisher.publish(unpublished);
        }

        log.info("Loaded named key {} with {} keys from storage", config.getName(), record.getKeys().size());
        return new NamedKey(config, ring);
    }

    private KeyRing createRing(NamedKeyConfig config) {
        return new KeyRing(
                config.getName(),
                config.getAlgorithm(),
                config.getCapacity(),
                config.getRotationPeriod().getDuration(),
                config.getVerificationTtl().getDuration(),
                generator,
                rotation -> commit(config, rotation),
                clock
        );
    }

    private void commit(NamedKeyConfig config, KeyRotation rotation) {
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationCancelledException(
                    "Rotation of named key %s was cancelled before it was stored".formatted(config.getName()));
        }

        var recordKey = recordKey(config.getName());
        var previous = storage.get(recordKey);
        storage.put(recordKey, codec.encode(config, rotation.getRetained()));

        var published = new ArrayList<ExpireableKey>(2);
        published.add(ExpireableKey.active(rotation.getCreated().getPublicKey()));
        rotation.findEvicted().ifPresent(evicted -> published.add(ExpireableKey.retired(evicted.getPublicKey(),
                rotation.getRotatedAt().plus(config.getVerificationTtl().getDuration()))));

        try {
            publisher.publish(published);
        } catch (RuntimeException e) {
            log.warn("Named key {}: publishing key {} failed, restoring the previous record", config.getName(),
                    rotation.getCreated().getKeyId());
            try {
                if (previous.isPresent()) {
                    storage.put(recordKey, previous.get());
                } else {
                    storage.delete(recordKey);
                }
            } catch (RuntimeException compensationFailure) {
                log.error("Named key {}: restoring the previous record failed", config.getName(),
                        compensationFailure);
                e.addSuppressed(compensationFailure);
            }
            throw e;
        }
    }

    private int capacityFor(KeyDuration rotationPeriod, KeyDuration verificationTtl) {
        var period = rotationPeriod.getDuration();
        var ttl = verificationTtl.getDuration();
        long needed = ttl.dividedBy(period);
        if (period.multipliedBy(needed).compareTo(ttl) < 0) {
            needed++;
        }
        if (needed > MAX_RING_CAPACITY) {
            throw new InvalidKeyConfigurationException(
                    "verification_ttl of %s needs more than %d keys with a rotation_period of %s".formatted(
                            verificationTtl, MAX_RING_CAPACITY, rotationPeriod));
        }
        return (int) Math.max(ringCapacity, needed);
    }

    private Lock lockFor(String name) {
        return locks.computeIfAbsent(name, n -> new ReentrantLock());
    }

    private static boolean isValidName(String name) {
        return NAME_PATTERN.matcher(name).matches();
    }

    static String recordKey(String name) {
        return NAMED_KEY_PREFIX + name;
    }

    @Value
    private static class NamedKey {

        NamedKeyConfig config;
        KeyRing ring;
    }
}
