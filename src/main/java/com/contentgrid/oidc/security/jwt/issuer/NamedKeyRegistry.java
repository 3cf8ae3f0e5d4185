package com.contentgrid.oidc.security.jwt.issuer;

import java.util.Optional;

public interface NamedKeyRegistry {

    /**
     * Creates a named key and its first signing key.
     *
     * @param verificationTtl how long evicted keys stay published; defaults to {@code rotationPeriod} when blank
     * @throws InvalidKeyConfigurationException when the name or a duration is invalid
     * @throws UnsupportedSigningAlgorithmException when the algorithm is unknown
     * @throws NamedKeyAlreadyExistsException when a named key with this name exists
     */
    NamedKeyConfig create(String name, String rotationPeriod, String verificationTtl, String algorithm);

    /**
     * @throws NamedKeyNotFoundException when no named key with this name exists
     */
    NamedKeyConfig get(String name);

    Optional<JwtClaimsSigner> getSigner(String name);

    /**
     * Rotates every loaded named key whose signing key is older than its rotation period. Called before public keys
     * are read, so a key set fetched after a rotation period already holds the key that signs next.
     *
     * @return the number of rotated named keys
     */
    int rotateDueKeys();

    default JwtClaimsSigner getRequiredSigner(String name) {
        return getSigner(name).orElseThrow(
                () -> new NamedKeyNotFoundException("Named key %s does not exist.".formatted(name)));
    }
}
