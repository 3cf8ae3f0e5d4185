package com.contentgrid.oidc.security.jwt.issuer;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.NonNull;
import lombok.Value;

/**
 * Describes a rotation of a {@link KeyRing} that is about to be applied.
 */
@Value
public class KeyRotation {

    @NonNull
    String ringName;

    @NonNull
    KeyEntry created;

    /**
     * Key whose slot is overwritten by this rotation, {@code null} while the ring still has free slots.
     */
    KeyEntry evicted;

    /**
     * All keys held by the ring once the rotation is applied, oldest first. The last element is {@link #created}.
     */
    @NonNull
    List<KeyEntry> retained;

    @NonNull
    Instant rotatedAt;

    public Optional<KeyEntry> findEvicted() {
        return Optional.ofNullable(evicted);
    }
}
