package com.contentgrid.oidc.security.jwt.issuer.actuate;

import com.nimbusds.jose.jwk.JWKSet;
import java.util.Map;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.web.WebEndpointResponse;
import org.springframework.boot.actuate.endpoint.web.annotation.WebEndpoint;

@WebEndpoint(id = "jwks")
@RequiredArgsConstructor
public class JWKSetEndpoint {
    private final Supplier<JWKSet> jwkSetProvider;

    @ReadOperation(produces = JWKSet.MIME_TYPE)
    public WebEndpointResponse<Map<String, Object>> jwkSet() {
        return new WebEndpointResponse<>(jwkSetProvider.get().toJSONObject());
    }

}
