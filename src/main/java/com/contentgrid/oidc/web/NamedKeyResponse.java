package com.contentgrid.oidc.web;

import com.contentgrid.oidc.security.jwt.issuer.NamedKeyConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class NamedKeyResponse {

    @JsonProperty("rotation_period")
    String rotationPeriod;

    @JsonProperty("verification_ttl")
    String verificationTtl;

    String algorithm;

    static NamedKeyResponse from(NamedKeyConfig config) {
        return new NamedKeyResponse(
                config.getRotationPeriod().getText(),
                config.getVerificationTtl().getText(),
                config.getAlgorithm().name()
        );
    }
}
