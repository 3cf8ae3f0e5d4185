package com.contentgrid.oidc.storage;

import com.contentgrid.oidc.security.jwt.issuer.OidcKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR, reason = "Storage operation failed")
public class KeyStorageException extends OidcKeyException {

    public KeyStorageException(String message) {
        super(message);
    }

    public KeyStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
