package com.contentgrid.oidc.web;

import com.contentgrid.oidc.security.jwt.issuer.IdentityTokenIssuer;
import com.contentgrid.oidc.security.jwt.issuer.NamedKeyRegistry;
import com.contentgrid.oidc.security.jwt.issuer.OidcIssuerProperties;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * HTTP routes for named key management and token issuance.
 * <p>
 * Key generation and storage block, so all work is moved to the bounded elastic scheduler.
 */
@Slf4j
@RestController
@RequestMapping("/oidc")
@RequiredArgsConstructor
public class OidcKeyController {

    private final NamedKeyRegistry registry;
    private final IdentityTokenIssuer tokenIssuer;
    private final OidcIssuerProperties properties;

    @PostMapping("/key/{name}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> createKey(@PathVariable String name,
            @RequestBody(required = false) Mono<CreateKeyRequest> request) {
        var defaults = properties.getKeys();
        return request
                .defaultIfEmpty(new CreateKeyRequest())
                .publishOn(Schedulers.boundedElastic())
                .map(body -> registry.create(
                        name,
                        StringUtils.hasText(body.getRotationPeriod()) ? body.getRotationPeriod()
                                : defaults.getDefaultRotationPeriod(),
                        // an empty verification TTL means: same as the rotation period
                        Objects.requireNonNullElse(body.getVerificationTtl(), ""),
                        StringUtils.hasText(body.getAlgorithm()) ? body.getAlgorithm() : defaults.getDefaultAlgorithm()
                ))
                .then();
    }

    @GetMapping("/key/{name}")
    public Mono<NamedKeyResponse> readKey(@PathVariable String name) {
        return Mono.fromCallable(() -> NamedKeyResponse.from(registry.get(name)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/token")
    public Mono<TokenResponse> issueToken(@RequestParam(name = "key", required = false) String key,
            Authentication authentication) {
        var keyName = StringUtils.hasText(key) ? key : properties.getIssuer().getDefaultKey();
        return Mono.fromCallable(() -> TokenResponse.from(tokenIssuer.issueToken(keyName, authentication)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
