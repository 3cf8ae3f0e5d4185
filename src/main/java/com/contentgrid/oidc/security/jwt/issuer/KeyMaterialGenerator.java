package com.contentgrid.oidc.security.jwt.issuer;

import com.nimbusds.jose.jwk.JWK;

@FunctionalInterface
public interface KeyMaterialGenerator {

    /**
     * Generates a fresh key pair with a globally unique key id.
     *
     * @return a JWK holding both the private and public key
     * @throws KeyGenerationException when the key can not be constructed
     * @throws OperationCancelledException when the calling thread is interrupted while waiting for the key
     */
    JWK generate(SigningAlgorithm algorithm);
}
