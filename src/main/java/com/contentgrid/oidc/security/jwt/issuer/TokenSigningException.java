package com.contentgrid.oidc.security.jwt.issuer;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR, reason = "Token signing failed")
public class TokenSigningException extends OidcKeyException {

    public TokenSigningException(String message) {
        super(message);
    }

    public TokenSigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
