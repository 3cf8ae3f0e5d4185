package com.contentgrid.oidc.security.jwt.issuer;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR, reason = "No signing key available")
public class EmptyKeyRingException extends OidcKeyException {

    public EmptyKeyRingException(String message) {
        super(message);
    }
}
