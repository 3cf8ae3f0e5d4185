package com.contentgrid.oidc.security.jwt.issuer;

import com.contentgrid.oidc.security.jwt.issuer.actuate.JWKSetEndpoint;
import com.contentgrid.oidc.security.jwt.issuer.jwk.source.ExpiredKeySweeper;
import com.contentgrid.oidc.security.jwt.issuer.jwk.source.PublicKeyPublisher;
import com.contentgrid.oidc.storage.InMemoryKeyValueStorage;
import com.contentgrid.oidc.storage.KeyValueStorage;
import io.micrometer.observation.ObservationRegistry;
import java.time.Clock;
import java.util.concurrent.ForkJoinPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(OidcIssuerProperties.class)
@EnableScheduling
@Slf4j
public class OidcIssuerConfiguration {

    @Bean
    @ConditionalOnMissingBean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    KeyValueStorage keyValueStorage() {
        log.warn("No persistent storage configured, named keys are lost on restart");
        return new InMemoryKeyValueStorage();
    }

    @Bean
    PublicKeyPublisher publicKeyPublisher(KeyValueStorage storage, Clock clock) {
        var publisher = new PublicKeyPublisher(storage, clock);
        publisher.load();
        return publisher;
    }

    @Bean
    @ConditionalOnMissingBean
    KeyMaterialGenerator keyMaterialGenerator(OidcIssuerProperties properties) {
        return new RsaKeyMaterialGenerator(
                properties.getKeys().getKeySize(),
                properties.getKeys().getGenerationTimeout(),
                ForkJoinPool.commonPool()
        );
    }

    @Bean
    NamedKeyRegistry namedKeyRegistry(KeyValueStorage storage, PublicKeyPublisher publisher,
            KeyMaterialGenerator generator, OidcIssuerProperties properties, Clock clock) {
        return new StorageBackedNamedKeyRegistry(storage, publisher, generator,
                properties.getKeys().getRingCapacity(), clock);
    }

    @Bean
    IdentityTokenIssuer identityTokenIssuer(NamedKeyRegistry registry, PublicKeyPublisher publisher,
            IdentityResolver identityResolver, OidcIssuerProperties properties, Clock clock,
            ObjectProvider<ObservationRegistry> observationRegistry) {
        var issuer = properties.getIssuer();
        return new ObservationIdentityTokenIssuer(
                observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP),
                new SignedIdentityTokenIssuer(registry, publisher, identityResolver, issuer.getUri(),
                        issuer.getAudience(), issuer.getTokenTtl(), clock)
        );
    }

    @Bean
    @ConditionalOnAvailableEndpoint
    JWKSetEndpoint jwkSetEndpoint(IdentityTokenIssuer identityTokenIssuer) {
        return new JWKSetEndpoint(identityTokenIssuer::getJwkSet);
    }

    @Bean
    @ConditionalOnProperty(value = "contentgrid.oidc.keys.sweep-enabled", matchIfMissing = true)
    ExpiredKeySweeper expiredKeySweeper(PublicKeyPublisher publisher, Clock clock) {
        return new ExpiredKeySweeper(publisher, clock);
    }
}
