package com.contentgrid.oidc.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.contentgrid.oidc.security.jwt.issuer.IdentityTokenIssuer;
import com.contentgrid.oidc.security.jwt.issuer.IssuedIdentityToken;
import com.contentgrid.oidc.security.jwt.issuer.KeyDuration;
import com.contentgrid.oidc.security.jwt.issuer.NamedKeyAlreadyExistsException;
import com.contentgrid.oidc.security.jwt.issuer.NamedKeyConfig;
import com.contentgrid.oidc.security.jwt.issuer.NamedKeyRegistry;
import com.contentgrid.oidc.security.jwt.issuer.OidcIssuerProperties;
import com.contentgrid.oidc.security.jwt.issuer.SigningAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.oauth2.jwt.Jwt;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class OidcKeyControllerDefaultsTest {

    private NamedKeyRegistry registry;
    private IdentityTokenIssuer tokenIssuer;
    private OidcKeyController controller;

    @BeforeEach
    void setup() {
        registry = mock(NamedKeyRegistry.class);
        tokenIssuer = mock(IdentityTokenIssuer.class);
        var properties = new OidcIssuerProperties();
        properties.getKeys().setDefaultRotationPeriod("12h");
        properties.getIssuer().setDefaultKey("platform");
        controller = new OidcKeyController(registry, tokenIssuer, properties);
    }

    private static NamedKeyConfig config(String name, String rotationPeriod, String verificationTtl) {
        return new NamedKeyConfig(name, SigningAlgorithm.RS256,
                KeyDuration.parse("rotation_period", rotationPeriod),
                KeyDuration.parse("verification_ttl", verificationTtl), 4);
    }

    @Test
    void createKey_withoutBody_usesConfiguredDefaults() {
        when(registry.create(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(config("svc", "12h", "12h"));

        StepVerifier.create(controller.createKey("svc", Mono.empty()))
                .verifyComplete();

        verify(registry).create("svc", "12h", "", "RS256");
    }

    @Test
    void createKey_passesRequestedValues() {
        when(registry.create(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(config("svc", "1h", "3h"));

        var request = CreateKeyRequest.builder()
                .rotationPeriod("1h")
                .verificationTtl("3h")
                .algorithm("RS256")
                .build();
        StepVerifier.create(controller.createKey("svc", Mono.just(request)))
                .verifyComplete();

        verify(registry).create("svc", "1h", "3h", "RS256");
    }

    @Test
    void createKey_propagatesRegistryErrors() {
        when(registry.create(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new NamedKeyAlreadyExistsException("Named key svc already exists"));

        StepVerifier.create(controller.createKey("svc", Mono.empty()))
                .expectError(NamedKeyAlreadyExistsException.class)
                .verify();
    }

    @Test
    void readKey_returnsConfigurationView() {
        when(registry.get("svc")).thenReturn(config("svc", "1h", "1h"));

        StepVerifier.create(controller.readKey("svc"))
                .assertNext(response -> {
                    assertThat(response.getRotationPeriod()).isEqualTo("1h");
                    assertThat(response.getVerificationTtl()).isEqualTo("1h");
                    assertThat(response.getAlgorithm()).isEqualTo("RS256");
                })
                .verifyComplete();
    }

    @Test
    void issueToken_withoutKeyName_usesDefaultKey() {
        var caller = new TestingAuthenticationToken("alice", "secret");
        var jwt = Jwt.withTokenValue("header.payload.signature")
                .header("alg", "RS256")
                .subject("entity-42")
                .build();
        when(tokenIssuer.issueToken(anyString(), any())).thenReturn(new IssuedIdentityToken(jwt, new JWKSet()));

        StepVerifier.create(controller.issueToken(null, caller))
                .assertNext(response -> {
                    assertThat(response.getToken()).isEqualTo("header.payload.signature");
                    assertThat(response.getKeys()).containsKey("keys");
                })
                .verifyComplete();

        verify(tokenIssuer).issueToken("platform", caller);
    }
}
