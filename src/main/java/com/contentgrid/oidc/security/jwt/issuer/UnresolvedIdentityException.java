package com.contentgrid.oidc.security.jwt.issuer;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The caller is authenticated, but its credential is not bound to any entity that could act as a token subject.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class UnresolvedIdentityException extends OidcKeyException {

    public UnresolvedIdentityException(String message) {
        super(message);
    }
}
