package com.contentgrid.oidc.test.security;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;

@UtilityClass
public class CryptoTestUtils {

    @SneakyThrows
    public static KeyPair createKeyPair(String algorithm, int size) {
        var generator = KeyPairGenerator.getInstance(algorithm);
        generator.initialize(size);
        return generator.generateKeyPair();
    }
}
