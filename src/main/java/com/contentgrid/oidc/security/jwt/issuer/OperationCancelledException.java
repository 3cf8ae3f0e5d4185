package com.contentgrid.oidc.security.jwt.issuer;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The calling thread was interrupted before the operation reached a durable state; nothing was stored or published.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class OperationCancelledException extends OidcKeyException {

    public OperationCancelledException(String message) {
        super(message);
    }
}
