package com.contentgrid.oidc.security.jwt.issuer.jwk.source;

import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import java.time.Instant;
import java.util.Date;
import lombok.NonNull;
import lombok.Value;

/**
 * A published public key. Keys still in a key ring are not expirable; evicted keys stay published until
 * {@link #getExpireAt()}.
 */
@Value
public class ExpireableKey {

    @NonNull
    JWK key;

    boolean expirable;

    Instant expireAt;

    public ExpireableKey(@NonNull JWK key, boolean expirable, Instant expireAt) {
        if (expirable && expireAt == null) {
            throw new IllegalArgumentException("Expirable key %s needs an expiry instant".formatted(key.getKeyID()));
        }
        this.key = key.toPublicJWK();
        this.expirable = expirable;
        this.expireAt = expirable ? expireAt : null;
    }

    public static ExpireableKey active(JWK key) {
        return new ExpireableKey(key, false, null);
    }

    public static ExpireableKey retired(JWK key, @NonNull Instant expireAt) {
        return new ExpireableKey(key, true, expireAt);
    }

    public String getKeyId() {
        return key.getKeyID();
    }

    public boolean isValidAt(@NonNull Instant now) {
        return !expirable || expireAt.isAfter(now);
    }

    /**
     * @return the public JWK; retired keys carry their expiry as the {@code exp} attribute
     */
    public JWK toJWK() {
        if (!expirable) {
            return key;
        }
        var expirationTime = Date.from(expireAt);
        if (key instanceof RSAKey rsaKey) {
            return new RSAKey.Builder(rsaKey)
                    .expirationTime(expirationTime)
                    .build();
        } else if (key instanceof ECKey ecKey) {
            return new ECKey.Builder(ecKey)
                    .expirationTime(expirationTime)
                    .build();
        }
        return key;
    }
}
