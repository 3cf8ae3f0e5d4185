package com.contentgrid.oidc.security.jwt.issuer;

/**
 * Base type for all failures raised by key management and token issuance.
 */
public abstract class OidcKeyException extends RuntimeException {

    protected OidcKeyException(String message) {
        super(message);
    }

    protected OidcKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
