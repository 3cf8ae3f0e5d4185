package com.contentgrid.oidc.security.jwt.issuer;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;

/**
 * Resolves callers through a fixed binding of user names to entity ids. Users without a binding, like an
 * administrative root user, do not resolve.
 * <p>
 * Callers authenticate with every request, so the authentication time is the time of resolution.
 */
@Slf4j
@RequiredArgsConstructor
public class EntityBindingIdentityResolver implements IdentityResolver {

    private static final String ROLE_PREFIX = "ROLE_";

    @NonNull
    private final Map<String, String> entityBindings;

    @NonNull
    private final Clock clock;

    @Override
    public Optional<ResolvedIdentity> resolve(Authentication caller) {
        if (caller == null || !caller.isAuthenticated() || caller instanceof AnonymousAuthenticationToken) {
            return Optional.empty();
        }

        var entityId = entityBindings.get(caller.getName());
        if (entityId == null) {
            log.debug("User {} is not bound to an entity", caller.getName());
            return Optional.empty();
        }

        return Optional.of(ResolvedIdentity.builder()
                .entityId(entityId)
                .name(caller.getName())
                .authenticatedAt(clock.instant().truncatedTo(ChronoUnit.SECONDS))
                .groups(caller.getAuthorities()
                        .stream()
                        .map(GrantedAuthority::getAuthority)
                        .filter(authority -> authority != null && authority.startsWith(ROLE_PREFIX))
                        .map(authority -> authority.substring(ROLE_PREFIX.length()))
                        .toList())
                .build());
    }
}
