package com.contentgrid.oidc.security.jwt.issuer;

import com.nimbusds.jose.jwk.JWKSet;
import io.micrometer.common.KeyValues;
import io.micrometer.observation.Observation;
import io.micrometer.observation.Observation.Context;
import io.micrometer.observation.ObservationConvention;
import io.micrometer.observation.ObservationRegistry;
import java.util.Objects;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.Setter;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.jwt.Jwt;

@RequiredArgsConstructor
public class ObservationIdentityTokenIssuer implements IdentityTokenIssuer {

    private final ObservationRegistry registry;

    private final IdentityTokenIssuer delegate;

    @Setter
    private ObservationConvention<IdentityTokenIssuerContext> convention = new ContextObservationConvention();

    @Override
    public JWKSet getJwkSet() {
        return delegate.getJwkSet();
    }

    @Override
    public IssuedIdentityToken issueToken(String keyName, Authentication caller) {
        var context = new IdentityTokenIssuerContext();
        context.setKeyName(keyName);
        var observation = Observation.createNotStarted(this.convention, () -> context, this.registry).start();
        try (var scope = observation.openScope()) {
            var result = delegate.issueToken(keyName, caller);
            context.setToken(result.getToken());
            return result;
        } catch (RuntimeException e) {
            observation.error(e);
            throw e;
        } finally {
            observation.stop();
        }
    }

    @EqualsAndHashCode(callSuper = true)
    @Data
    static class IdentityTokenIssuerContext extends Context {
        private String keyName;
        private Jwt token;
    }

    private static class ContextObservationConvention implements ObservationConvention<IdentityTokenIssuerContext> {

        @Override
        public boolean supportsContext(Context context) {
            return context instanceof IdentityTokenIssuerContext;
        }

        @Override
        public String getName() {
            return "identity-token-issuer";
        }

        @Override
        public KeyValues getLowCardinalityKeyValues(IdentityTokenIssuerContext context) {
            return KeyValues.of("key", Objects.toString(context.getKeyName()));
        }

        @Override
        public KeyValues getHighCardinalityKeyValues(IdentityTokenIssuerContext context) {
            return KeyValues.of("token.issued", Boolean.toString(context.getToken() != null))
                    .and("token.keyId", Objects.toString(context.getToken() != null
                            ? context.getToken().getHeaders().get("kid") : null))
                    .and("token.expirationTime", Objects.toString(context.getToken() != null
                            ? context.getToken().getExpiresAt() : null))
                    .and("token.issuedAt", Objects.toString(context.getToken() != null
                            ? context.getToken().getIssuedAt() : null));
        }
    }
}
