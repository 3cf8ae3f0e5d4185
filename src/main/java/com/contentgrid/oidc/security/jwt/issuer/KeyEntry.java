package com.contentgrid.oidc.security.jwt.issuer;

import com.nimbusds.jose.jwk.JWK;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * One generated signing key of a {@link KeyRing}.
 * <p>
 * The private half is only reachable from this package.
 */
@EqualsAndHashCode(of = "keyId")
public final class KeyEntry {

    @Getter
    private final String keyId;

    @Getter
    private final Instant createdAt;

    @Getter(AccessLevel.PACKAGE)
    private final JWK privateKey;

    @Getter
    private final JWK publicKey;

    KeyEntry(@NonNull JWK privateKey, @NonNull Instant createdAt) {
        if (!privateKey.isPrivate()) {
            throw new IllegalArgumentException("Key %s has no private key material".formatted(privateKey.getKeyID()));
        }
        this.keyId = privateKey.getKeyID();
        this.createdAt = createdAt;
        this.privateKey = privateKey;
        this.publicKey = privateKey.toPublicJWK();
    }

    @Override
    public String toString() {
        return "KeyEntry(keyId=%s, createdAt=%s)".formatted(keyId, createdAt);
    }
}
