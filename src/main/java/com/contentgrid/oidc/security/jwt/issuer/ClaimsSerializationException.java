package com.contentgrid.oidc.security.jwt.issuer;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR, reason = "Token signing failed")
public class ClaimsSerializationException extends OidcKeyException {

    public ClaimsSerializationException(String message) {
        super(message);
    }

    public ClaimsSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
