package com.contentgrid.oidc.security.jwt.issuer;

import com.nimbusds.jose.jwk.JWKSet;
import lombok.NonNull;
import lombok.Value;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * A signed identity token, together with the public keys that can verify it.
 */
@Value
public class IssuedIdentityToken {

    @NonNull
    Jwt token;

    @NonNull
    JWKSet keys;
}
