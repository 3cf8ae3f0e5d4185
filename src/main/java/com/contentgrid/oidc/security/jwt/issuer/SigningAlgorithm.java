package com.contentgrid.oidc.security.jwt.issuer;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.KeyType;
import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Signing algorithms a named key can be configured with.
 */
@Getter
@RequiredArgsConstructor
public enum SigningAlgorithm {
    RS256(JWSAlgorithm.RS256, KeyType.RSA);

    private final JWSAlgorithm jwsAlgorithm;
    private final KeyType keyType;

    public static SigningAlgorithm fromName(String name) {
        return Arrays.stream(values())
                .filter(algorithm -> algorithm.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new UnsupportedSigningAlgorithmException(
                        "unknown signing algorithm \"%s\"; supported algorithms are %s".formatted(name,
                                Arrays.toString(values()))));
    }
}
