package com.contentgrid.oidc.web;

import com.contentgrid.oidc.security.jwt.issuer.IssuedIdentityToken;
import java.util.Map;
import lombok.Value;

@Value
public class TokenResponse {

    String token;

    /**
     * Public key set in JWK Set format.
     */
    Map<String, Object> keys;

    static TokenResponse from(IssuedIdentityToken issued) {
        return new TokenResponse(issued.getToken().getTokenValue(), issued.getKeys().toJSONObject());
    }
}
