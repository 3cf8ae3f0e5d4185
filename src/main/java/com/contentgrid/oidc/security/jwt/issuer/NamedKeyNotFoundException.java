package com.contentgrid.oidc.security.jwt.issuer;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class NamedKeyNotFoundException extends OidcKeyException {

    public NamedKeyNotFoundException(String message) {
        super(message);
    }
}
