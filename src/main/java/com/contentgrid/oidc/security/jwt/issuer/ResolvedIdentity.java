package com.contentgrid.oidc.security.jwt.issuer;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * The entity a caller acts as, with the optional attributes that end up in its identity token.
 */
@Value
@Builder
public class ResolvedIdentity {

    @NonNull
    String entityId;

    String name;

    @Singular
    List<String> groups;

    Instant authenticatedAt;
}
