package com.contentgrid.oidc.security.jwt.issuer;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties("contentgrid.oidc")
public class OidcIssuerProperties {

    @Valid
    @NotNull
    private Issuer issuer = new Issuer();

    @Valid
    @NotNull
    private Keys keys = new Keys();

    @Data
    public static class Issuer {

        /**
         * Value of the {@code iss} claim of issued tokens.
         */
        @NotBlank
        private String uri = "http://localhost:8080";

        /**
         * Value of the {@code aud} claim of issued tokens.
         */
        @NotEmpty
        private List<String> audience = new ArrayList<>(List.of("client_id_of_relying_party"));

        @NotNull
        private Duration tokenTtl = SignedIdentityTokenIssuer.DEFAULT_TOKEN_TTL;

        /**
         * Named key that signs tokens when a request does not name one.
         */
        @NotBlank
        private String defaultKey = "default";
    }

    @Data
    public static class Keys {

        /**
         * Minimum number of keys a key ring retains. Rings grow beyond this when the verification TTL needs it.
         */
        @Min(1)
        private int ringCapacity = StorageBackedNamedKeyRegistry.DEFAULT_RING_CAPACITY;

        @Min(2048)
        private int keySize = RsaKeyMaterialGenerator.DEFAULT_KEY_SIZE;

        @NotNull
        private Duration generationTimeout = RsaKeyMaterialGenerator.DEFAULT_TIMEOUT;

        @NotBlank
        private String defaultRotationPeriod = "6h";

        @NotBlank
        private String defaultAlgorithm = SigningAlgorithm.RS256.name();

        @NotNull
        private Duration sweepInterval = Duration.ofMinutes(5);
    }
}
