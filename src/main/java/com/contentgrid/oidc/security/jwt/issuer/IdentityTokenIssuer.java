package com.contentgrid.oidc.security.jwt.issuer;

import com.nimbusds.jose.jwk.JWKSet;
import org.springframework.security.core.Authentication;

public interface IdentityTokenIssuer {

    JWKSet getJwkSet();

    /**
     * Issues an identity token for the caller, signed by the named key.
     *
     * @throws UnresolvedIdentityException when the caller is not bound to an entity
     * @throws NamedKeyNotFoundException when the named key does not exist
     */
    IssuedIdentityToken issueToken(String keyName, Authentication caller);
}
