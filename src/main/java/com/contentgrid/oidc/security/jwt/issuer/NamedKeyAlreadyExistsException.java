package com.contentgrid.oidc.security.jwt.issuer;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class NamedKeyAlreadyExistsException extends OidcKeyException {

    public NamedKeyAlreadyExistsException(String message) {
        super(message);
    }
}
