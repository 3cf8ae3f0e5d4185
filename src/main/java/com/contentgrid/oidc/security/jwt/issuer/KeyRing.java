package com.contentgrid.oidc.security.jwt.issuer;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.factories.DefaultJWSSignerFactory;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.produce.JWSSignerFactory;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.ConcurrentLruCache;

/**
 * Fixed-size circular buffer of signing keys belonging to one named key.
 * <p>
 * The newest key signs; older keys are retained so tokens they signed can still be verified. A rotation generates a
 * new key and overwrites the oldest slot once the ring is full. Rotations happen lazily: {@link #sign(JWTClaimsSet)}
 * and {@link #currentPublicKey()} first rotate when the current key is older than the rotation period.
 * <p>
 * Rotations take the write lock; signing and reads take the read lock.
 */
@Slf4j
public class KeyRing implements JwtClaimsSigner {

    @Getter
    private final String name;

    @Getter
    private final SigningAlgorithm algorithm;

    @Getter
    private final Duration rotationPeriod;

    @Getter
    private final Duration verificationTtl;

    private final KeyMaterialGenerator generator;
    private final RotationListener listener;
    private final Clock clock;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final KeyEntry[] slots;
    private int current = -1;

    private final ConcurrentLruCache<JWK, JWSSigner> signerCache;

    public KeyRing(String name, SigningAlgorithm algorithm, int capacity, Duration rotationPeriod,
            Duration verificationTtl, KeyMaterialGenerator generator, RotationListener listener, Clock clock) {
        this(name, algorithm, capacity, rotationPeriod, verificationTtl, generator, listener, clock,
                new DefaultJWSSignerFactory());
    }

    public KeyRing(@NonNull String name, @NonNull SigningAlgorithm algorithm, int capacity,
            @NonNull Duration rotationPeriod, @NonNull Duration verificationTtl,
            @NonNull KeyMaterialGenerator generator, @NonNull RotationListener listener, @NonNull Clock clock,
            @NonNull JWSSignerFactory jwsSignerFactory) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Key ring capacity must be at least 1, got %d".formatted(capacity));
        }
        if (rotationPeriod.isZero() || rotationPeriod.isNegative()) {
            throw new IllegalArgumentException("Rotation period must be positive, got %s".formatted(rotationPeriod));
        }
        if (rotationPeriod.multipliedBy(capacity).compareTo(verificationTtl) < 0) {
            throw new IllegalArgumentException(
                    "A ring of %d keys rotated every %s can not keep keys verifiable for %s".formatted(
                            capacity, rotationPeriod, verificationTtl));
        }
        this.name = name;
        this.algorithm = algorithm;
        this.rotationPeriod = rotationPeriod;
        this.verificationTtl = verificationTtl;
        this.generator = generator;
        this.listener = listener;
        this.clock = clock;
        this.slots = new KeyEntry[capacity];

        this.signerCache = new ConcurrentLruCache<>(capacity,
                key -> {
                    try {
                        return jwsSignerFactory.createJWSSigner(key, algorithm.getJwsAlgorithm());
                    } catch (JOSEException e) {
                        throw new TokenSigningException("Can not create signer for key %s".formatted(key.getKeyID()),
                                e);
                    }
                });
    }

    public int getCapacity() {
        return slots.length;
    }

    /**
     * Generates a new key and makes it the signing key, evicting the oldest key when the ring is full.
     *
     * @return the newly created key
     */
    public KeyEntry rotate() {
        try {
            lock.writeLock().lock();
            return doRotate();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Rotates when the ring is empty or the current key is older than the rotation period.
     * <p>
     * Concurrent callers observing the same expired key cause exactly one rotation.
     *
     * @return whether this call rotated the ring
     */
    public boolean rotateIfDue() {
        try {
            lock.readLock().lock();
            if (!isDue()) {
                return false;
            }
        } finally {
            lock.readLock().unlock();
        }

        try {
            lock.writeLock().lock();
            // Another thread may have rotated while we waited for the write lock
            if (!isDue()) {
                return false;
            }
            doRotate();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Rotates first when the current key is older than the rotation period, like {@link #sign(JWTClaimsSet)}.
     *
     * @return the public half of the current signing key
     * @throws EmptyKeyRingException when the ring never rotated
     */
    public JWK currentPublicKey() {
        if (!isEmpty()) {
            rotateIfDue();
        }
        try {
            lock.readLock().lock();
            return currentEntry().getPublicKey();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return all keys held by the ring, oldest first
     */
    public List<KeyEntry> getKeys() {
        try {
            lock.readLock().lock();
            return retainedKeys();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public JWKSet getSigningKeys() {
        return new JWKSet(getKeys().stream().map(KeyEntry::getPublicKey).toList());
    }

    @Override
    public SignedJWT sign(@NonNull JWTClaimsSet jwtClaimsSet) {
        rotateIfDue();

        try {
            jwtClaimsSet.toString();
        } catch (RuntimeException e) {
            throw new ClaimsSerializationException("Claims can not be serialized to JSON", e);
        }

        try {
            lock.readLock().lock();
            var entry = currentEntry();
            var signedJwt = new SignedJWT(new JWSHeader.Builder(algorithm.getJwsAlgorithm())
                    .type(JOSEObjectType.JWT)
                    .keyID(entry.getKeyId())
                    .build(),
                    jwtClaimsSet
            );
            signedJwt.sign(signerCache.get(entry.getPrivateKey()));
            return signedJwt;
        } catch (JOSEException e) {
            throw new TokenSigningException("Signing with key ring %s failed".formatted(name), e);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the ring contents with keys loaded from storage, without notifying the rotation listener.
     *
     * @param entries keys ordered oldest first; the last one becomes the signing key
     */
    void restore(@NonNull List<KeyEntry> entries) {
        if (entries.size() > slots.length) {
            throw new IllegalArgumentException("Can not restore %d keys into key ring %s of capacity %d".formatted(
                    entries.size(), name, slots.length));
        }
        for (int i = 1; i < entries.size(); i++) {
            if (!entries.get(i).getCreatedAt().isAfter(entries.get(i - 1).getCreatedAt())) {
                throw new IllegalArgumentException("Keys of key ring %s are not in creation order".formatted(name));
            }
        }

        try {
            lock.writeLock().lock();
            Arrays.fill(slots, null);
            for (int i = 0; i < entries.size(); i++) {
                slots[i] = entries.get(i);
            }
            current = entries.size() - 1;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean isEmpty() {
        try {
            lock.readLock().lock();
            return current < 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean isDue() {
        if (current < 0) {
            return true;
        }
        return clock.instant().isAfter(slots[current].getCreatedAt().plus(rotationPeriod));
    }

    private KeyEntry currentEntry() {
        if (current < 0) {
            throw new EmptyKeyRingException("Key ring %s has no keys".formatted(name));
        }
        return slots[current];
    }

    private List<KeyEntry> retainedKeys() {
        var keys = new ArrayList<KeyEntry>(slots.length);
        if (current < 0) {
            return keys;
        }
        for (int i = 1; i <= slots.length; i++) {
            var entry = slots[(current + i) % slots.length];
            if (entry != null) {
                keys.add(entry);
            }
        }
        return keys;
    }

    // Must hold the write lock
    private KeyEntry doRotate() {
        var created = new KeyEntry(generator.generate(algorithm), now());
        int next = current < 0 ? 0 : (current + 1) % slots.length;
        var evicted = slots[next];

        var retained = new ArrayList<KeyEntry>(slots.length);
        for (int i = 1; i < slots.length; i++) {
            var entry = slots[(next + i) % slots.length];
            if (entry != null) {
                retained.add(entry);
            }
        }
        retained.add(created);

        listener.onRotation(new KeyRotation(name, created, evicted, List.copyOf(retained), created.getCreatedAt()));

        slots[next] = created;
        current = next;

        if (evicted != null) {
            log.info("Rotated key ring {}: new signing key {}, evicted key {}", name, created.getKeyId(),
                    evicted.getKeyId());
        } else {
            log.info("Rotated key ring {}: new signing key {}", name, created.getKeyId());
        }
        return created;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
