package com.contentgrid.oidc.security.jwt.issuer;

import com.nimbusds.jwt.JWTClaimsSet;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Claims of an identity token. Only the claims listed here can appear in a token.
 */
@Value
@Builder
public class IdentityClaims {

    public static final String AUTH_TIME = "auth_time";
    public static final String NAME = "name";
    public static final String GROUPS = "groups";

    @NonNull
    String issuer;

    @NonNull
    String subject;

    @NonNull
    List<String> audience;

    @NonNull
    Instant issuedAt;

    @NonNull
    Instant expiresAt;

    Instant authTime;

    String name;

    List<String> groups;

    public JWTClaimsSet toJWTClaimsSet() {
        var builder = new JWTClaimsSet.Builder()
                .issuer(issuer)
                .subject(subject)
                .audience(audience)
                .issueTime(Date.from(issuedAt))
                .expirationTime(Date.from(expiresAt));
        if (authTime != null) {
            builder.claim(AUTH_TIME, authTime.getEpochSecond());
        }
        if (name != null) {
            builder.claim(NAME, name);
        }
        if (groups != null && !groups.isEmpty()) {
            builder.claim(GROUPS, groups);
        }
        return builder.build();
    }
}
