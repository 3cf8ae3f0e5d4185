package com.contentgrid.oidc.security.jwt.issuer;

import java.util.Optional;
import org.springframework.security.core.Authentication;

@FunctionalInterface
public interface IdentityResolver {

    /**
     * @return the entity bound to the caller, or empty when the caller does not act as an entity
     */
    Optional<ResolvedIdentity> resolve(Authentication caller);
}
