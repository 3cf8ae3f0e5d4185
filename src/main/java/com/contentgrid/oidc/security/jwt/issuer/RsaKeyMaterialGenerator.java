package com.contentgrid.oidc.security.jwt.issuer;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.KeyType;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Generates RSA signing keys with a random UUID as key id.
 * <p>
 * Generation runs on a separate executor so a starved entropy source surfaces as a {@link KeyGenerationException}
 * after {@code timeout} instead of blocking the caller indefinitely.
 */
@Slf4j
@RequiredArgsConstructor
public class RsaKeyMaterialGenerator implements KeyMaterialGenerator {

    public static final int DEFAULT_KEY_SIZE = 2048;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final int keySize;

    @NonNull
    private final Duration timeout;

    @NonNull
    private final Executor executor;

    public RsaKeyMaterialGenerator() {
        this(DEFAULT_KEY_SIZE, DEFAULT_TIMEOUT, ForkJoinPool.commonPool());
    }

    @Override
    public JWK generate(@NonNull SigningAlgorithm algorithm) {
        if (!KeyType.RSA.equals(algorithm.getKeyType())) {
            throw new UnsupportedSigningAlgorithmException(
                    "signing algorithm %s does not use RSA keys".formatted(algorithm));
        }

        var future = CompletableFuture.supplyAsync(() -> createKey(algorithm), executor);
        try {
            var key = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Generated {}-bit RSA key {}", keySize, key.getKeyID());
            return key;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new KeyGenerationException("Key generation did not complete within %s".formatted(timeout), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while waiting for key generation");
        } catch (ExecutionException e) {
            throw new KeyGenerationException("Failed to generate %s key".formatted(algorithm), e.getCause());
        }
    }

    private RSAKey createKey(SigningAlgorithm algorithm) {
        try {
            return new RSAKeyGenerator(keySize)
                    .keyUse(KeyUse.SIGNATURE)
                    .algorithm(algorithm.getJwsAlgorithm())
                    .keyID(UUID.randomUUID().toString())
                    .generate();
        } catch (JOSEException e) {
            throw new CompletionException(e);
        }
    }
}
