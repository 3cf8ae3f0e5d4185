package com.contentgrid.oidc.security.jwt.issuer;

import lombok.NonNull;
import lombok.Value;

/**
 * Configuration of a named signing key. Immutable once created.
 */
@Value
public class NamedKeyConfig {

    @NonNull
    String name;

    @NonNull
    SigningAlgorithm algorithm;

    @NonNull
    KeyDuration rotationPeriod;

    @NonNull
    KeyDuration verificationTtl;

    /**
     * Number of keys the backing key ring retains.
     */
    int capacity;
}
