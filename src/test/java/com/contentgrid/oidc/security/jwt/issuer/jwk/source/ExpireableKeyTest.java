package com.contentgrid.oidc.security.jwt.issuer.jwk.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.contentgrid.oidc.security.jwt.issuer.SigningAlgorithm;
import com.contentgrid.oidc.test.security.FixedPoolKeyMaterialGenerator;
import java.time.Instant;
import java.util.Date;
import org.junit.jupiter.api.Test;

class ExpireableKeyTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final FixedPoolKeyMaterialGenerator generator = new FixedPoolKeyMaterialGenerator();

    @Test
    void active_key_never_expires() {
        var key = ExpireableKey.active(generator.generate(SigningAlgorithm.RS256));

        assertThat(key.isExpirable()).isFalse();
        assertThat(key.getExpireAt()).isNull();
        assertThat(key.isValidAt(Instant.MAX)).isTrue();
        assertThat(key.toJWK().getExpirationTime()).isNull();
    }

    @Test
    void only_public_half_is_kept() {
        var key = ExpireableKey.active(generator.generate(SigningAlgorithm.RS256));

        assertThat(key.getKey().isPrivate()).isFalse();
    }

    @Test
    void retired_key_is_valid_until_expiry() {
        var key = ExpireableKey.retired(generator.generate(SigningAlgorithm.RS256), NOW);

        assertThat(key.isValidAt(NOW.minusMillis(1))).isTrue();
        assertThat(key.isValidAt(NOW)).isFalse();
        assertThat(key.toJWK().getExpirationTime()).isEqualTo(Date.from(NOW));
        assertThat(key.toJWK().getKeyID()).isEqualTo(key.getKeyId());
    }

    @Test
    void expirable_key_needs_expiry() {
        var jwk = generator.generate(SigningAlgorithm.RS256);
        assertThatThrownBy(() -> new ExpireableKey(jwk, true, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
