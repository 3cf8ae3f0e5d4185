package com.contentgrid.oidc.security.jwt.issuer;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class UnsupportedSigningAlgorithmException extends OidcKeyException {

    public UnsupportedSigningAlgorithmException(String message) {
        super(message);
    }
}
