package com.contentgrid.oidc.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a named key creation request. Absent fields take the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateKeyRequest {

    @JsonProperty("rotation_period")
    private String rotationPeriod;

    @JsonProperty("verification_ttl")
    private String verificationTtl;

    private String algorithm;
}
