package com.contentgrid.oidc.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.springSecurity;

import com.contentgrid.oidc.security.jwt.issuer.KeyMaterialGenerator;
import com.contentgrid.oidc.test.security.FixedPoolKeyMaterialGenerator;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.SignedJWT;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest(properties = {
        "contentgrid.oidc.issuer.uri=https://issuer.example",
        "contentgrid.oidc.issuer.audience[0]=relying-party",
        "contentgrid.oidc.bootstrap.users[0].username=admin",
        "contentgrid.oidc.bootstrap.users[0].password=admin-secret",
        "contentgrid.oidc.bootstrap.users[0].roles[0]=KEY_ADMIN",
        "contentgrid.oidc.bootstrap.users[1].username=alice",
        "contentgrid.oidc.bootstrap.users[1].password=alice-secret",
        "contentgrid.oidc.bootstrap.users[1].entity-id=entity-42",
        "contentgrid.oidc.bootstrap.users[1].roles[0]=ORDERS",
        "contentgrid.oidc.bootstrap.users[2].username=root",
        "contentgrid.oidc.bootstrap.users[2].password=root-secret",
        "contentgrid.oidc.keys.sweep-enabled=false"
})
class OidcKeyControllerTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {
    };

    @TestConfiguration(proxyBeanMethods = false)
    static class FastKeysConfiguration {

        @Bean
        @Primary
        KeyMaterialGenerator fixedPoolKeyMaterialGenerator() {
            return new FixedPoolKeyMaterialGenerator();
        }
    }

    @Autowired
    ApplicationContext context;

    WebTestClient http;

    @BeforeEach
    void setup() {
        this.http = WebTestClient
                .bindToApplicationContext(this.context)
                .apply(springSecurity())
                .configureClient()
                .build();
    }

    private void createKey(String name, Map<String, String> body) {
        http.post().uri("/oidc/key/{name}", name)
                .headers(headers -> headers.setBasicAuth("admin", "admin-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isNoContent();
    }

    @Test
    void create_and_read_named_key() {
        createKey("orders", Map.of("rotation_period", "1h", "verification_ttl", "3h", "algorithm", "RS256"));

        http.get().uri("/oidc/key/{name}", "orders")
                .headers(headers -> headers.setBasicAuth("alice", "alice-secret"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.rotation_period").isEqualTo("1h")
                .jsonPath("$.verification_ttl").isEqualTo("3h")
                .jsonPath("$.algorithm").isEqualTo("RS256");
    }

    @Test
    void create_withEmptyBody_usesDefaults() {
        createKey("defaults", Map.of());

        http.get().uri("/oidc/key/{name}", "defaults")
                .headers(headers -> headers.setBasicAuth("admin", "admin-secret"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.rotation_period").isEqualTo("6h")
                .jsonPath("$.verification_ttl").isEqualTo("6h")
                .jsonPath("$.algorithm").isEqualTo("RS256");
    }

    @Test
    void create_duplicate_isConflict() {
        createKey("twice", Map.of("rotation_period", "1h"));

        http.post().uri("/oidc/key/{name}", "twice")
                .headers(headers -> headers.setBasicAuth("admin", "admin-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("rotation_period", "2h"))
                .exchange()
                .expectStatus().isEqualTo(409);
    }

    @Test
    void create_invalidRotationPeriod_isBadRequest() {
        http.post().uri("/oidc/key/{name}", "broken")
                .headers(headers -> headers.setBasicAuth("admin", "admin-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("rotation_period", "soon"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").value(message -> assertThat((String) message).contains("rotation_period"));
    }

    @Test
    void create_unsupportedAlgorithm_isBadRequest() {
        http.post().uri("/oidc/key/{name}", "hmac")
                .headers(headers -> headers.setBasicAuth("admin", "admin-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("rotation_period", "1h", "algorithm", "HS256"))
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void create_withoutAdminRole_isForbidden() {
        http.post().uri("/oidc/key/{name}", "sneaky")
                .headers(headers -> headers.setBasicAuth("alice", "alice-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("rotation_period", "1h"))
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    void read_unknownKey_isNotFound() {
        http.get().uri("/oidc/key/{name}", "missing")
                .headers(headers -> headers.setBasicAuth("alice", "alice-secret"))
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void issueToken_forBoundUser() throws Exception {
        createKey("svc", Map.of("rotation_period", "1h"));

        var body = http.post().uri("/oidc/token?key={key}", "svc")
                .headers(headers -> headers.setBasicAuth("alice", "alice-secret"))
                .exchange()
                .expectStatus().isOk()
                .expectBody(JSON_OBJECT)
                .returnResult()
                .getResponseBody();

        assertThat(body).containsKeys("token", "keys");
        var jwt = SignedJWT.parse((String) body.get("token"));
        var claims = jwt.getJWTClaimsSet();
        assertThat(claims.getIssuer()).isEqualTo("https://issuer.example");
        assertThat(claims.getSubject()).isEqualTo("entity-42");
        assertThat(claims.getAudience()).containsExactly("relying-party");
        assertThat(claims.getStringClaim("name")).isEqualTo("alice");
        assertThat(claims.getStringListClaim("groups")).containsExactly("ORDERS");

        @SuppressWarnings("unchecked")
        var keys = JWKSet.parse((Map<String, Object>) body.get("keys"));
        var signingKey = (RSAKey) keys.getKeyByKeyId(jwt.getHeader().getKeyID());
        assertThat(signingKey).isNotNull();
        assertThat(signingKey.isPrivate()).isFalse();
        assertThat(jwt.verify(new RSASSAVerifier(signingKey))).isTrue();
    }

    @Test
    void issueToken_forUnboundUser_isForbidden() {
        createKey("svc-unbound", Map.of("rotation_period", "1h"));

        http.post().uri("/oidc/token?key={key}", "svc-unbound")
                .headers(headers -> headers.setBasicAuth("root", "root-secret"))
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    void issueToken_unknownKey_isNotFound() {
        http.post().uri("/oidc/token?key={key}", "nope")
                .headers(headers -> headers.setBasicAuth("alice", "alice-secret"))
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void issueToken_unauthenticated_isUnauthorized() {
        http.post().uri("/oidc/token?key={key}", "svc")
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void jwksEndpoint_isPublic_andListsCreatedKeys() {
        createKey("published", Map.of("rotation_period", "1h"));

        var body = http.get().uri("/actuator/jwks")
                .exchange()
                .expectStatus().isOk()
                .expectBody(JSON_OBJECT)
                .returnResult()
                .getResponseBody();

        assertThat(body).containsKey("keys");
        assertThat((Iterable<?>) body.get("keys"))
                .isNotEmpty()
                .allSatisfy(key -> assertThat(key)
                        .asInstanceOf(InstanceOfAssertFactories.MAP)
                        .containsKey("kid")
                        .doesNotContainKey("d"));
    }
}
