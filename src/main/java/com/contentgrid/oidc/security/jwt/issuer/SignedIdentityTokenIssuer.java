package com.contentgrid.oidc.security.jwt.issuer;

import com.contentgrid.oidc.security.jwt.issuer.jwk.source.PublicKeyPublisher;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.jwt.Jwt;

@Slf4j
public class SignedIdentityTokenIssuer implements IdentityTokenIssuer {

    public static final Duration DEFAULT_TOKEN_TTL = Duration.ofMinutes(2);

    private final NamedKeyRegistry registry;
    private final PublicKeyPublisher publisher;
    private final IdentityResolver identityResolver;
    private final String issuer;
    private final List<String> audience;
    private final Duration tokenTtl;
    private final Clock clock;

    public SignedIdentityTokenIssuer(NamedKeyRegistry registry, PublicKeyPublisher publisher,
            IdentityResolver identityResolver, String issuer, List<String> audience, Clock clock) {
        this(registry, publisher, identityResolver, issuer, audience, DEFAULT_TOKEN_TTL, clock);
    }

    public SignedIdentityTokenIssuer(@NonNull NamedKeyRegistry registry, @NonNull PublicKeyPublisher publisher,
            @NonNull IdentityResolver identityResolver, @NonNull String issuer, @NonNull List<String> audience,
            @NonNull Duration tokenTtl, @NonNull Clock clock) {
        if (tokenTtl.isZero() || tokenTtl.isNegative()) {
            throw new IllegalArgumentException("Token lifetime must be positive, got %s".formatted(tokenTtl));
        }
        this.registry = registry;
        this.publisher = publisher;
        this.identityResolver = identityResolver;
        this.issuer = issuer;
        this.audience = List.copyOf(audience);
        this.tokenTtl = tokenTtl;
        this.clock = clock;
    }

    @Override
    public JWKSet getJwkSet() {
        registry.rotateDueKeys();
        return publisher.getJWKSet();
    }

    @Override
    public IssuedIdentityToken issueToken(String keyName, Authentication caller) {
        var identity = identityResolver.resolve(caller)
                .orElseThrow(() -> new UnresolvedIdentityException(
                        "No entity is associated with %s".formatted(caller == null ? "the request" : caller.getName())));
        var signer = registry.getRequiredSigner(keyName);

        var now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        var claims = IdentityClaims.builder()
                .issuer(issuer)
                .subject(identity.getEntityId())
                .audience(audience)
                .issuedAt(now)
                .expiresAt(now.plus(tokenTtl))
                .authTime(identity.getAuthenticatedAt())
                .name(identity.getName())
                .groups(identity.getGroups())
                .build();

        var signedJwt = signer.sign(claims.toJWTClaimsSet());
        log.debug("Issued identity token for {} with key {}", identity.getEntityId(),
                signedJwt.getHeader().getKeyID());
        return new IssuedIdentityToken(toJwt(signedJwt), publisher.getJWKSet());
    }

    private static Jwt toJwt(SignedJWT signedJwt) {
        try {
            var claimsSet = signedJwt.getJWTClaimsSet();
            return Jwt.withTokenValue(signedJwt.serialize())
                    .headers(headers -> headers.putAll(signedJwt.getHeader().toJSONObject()))
                    .claims(claims -> claims.putAll(claimsSet.getClaims()))
                    // Spring requires these two to be Instant
                    .issuedAt(Optional.ofNullable(claimsSet.getIssueTime()).map(Date::toInstant).orElse(null))
                    .expiresAt(Optional.ofNullable(claimsSet.getExpirationTime()).map(Date::toInstant).orElse(null))
                    .build();
        } catch (ParseException e) {
            throw new TokenSigningException("Signed token can not be read back", e);
        }
    }
}
