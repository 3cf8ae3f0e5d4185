package com.contentgrid.oidc;

import com.contentgrid.oidc.security.jwt.issuer.EntityBindingIdentityResolver;
import com.contentgrid.oidc.security.jwt.issuer.IdentityResolver;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.actuate.autoconfigure.security.reactive.EndpointRequest;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.info.InfoEndpoint;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity.CsrfSpec;
import org.springframework.security.core.userdetails.MapReactiveUserDetailsService;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.web.server.SecurityWebFilterChain;

@Slf4j
@SpringBootApplication
public class OidcIssuerApplication {

    public static final String ROLE_KEY_ADMIN = "KEY_ADMIN";

    public static void main(String[] args) {
        SpringApplication.run(OidcIssuerApplication.class, args);
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(BootstrapUsersConfiguration.BootstrapProperties.class)
    static class BootstrapUsersConfiguration {

        private static final String NOOP_PASSWORD = "{noop}";

        @Bean
        public MapReactiveUserDetailsService userDetailsService(BootstrapProperties bootstrapProperties) {
            List<BootstrapUser> users = bootstrapProperties.getUsers();
            users.forEach(user -> log.info("Bootstrapping user '{}' with roles {} bound to entity {}",
                    user.getUsername(), user.getRoles(), user.getEntityId()));
            if (users.isEmpty()) {
                log.warn("No users configured, all authenticated requests will be rejected");
                return new MapReactiveUserDetailsService(User.withUsername("disabled")
                        .password("{noop}")
                        .disabled(true)
                        .build());
            }
            return new MapReactiveUserDetailsService(users.stream()
                    .map(BootstrapUser::convert)
                    .toList());
        }

        @Bean
        public IdentityResolver identityResolver(BootstrapProperties bootstrapProperties, Clock clock) {
            var bindings = new LinkedHashMap<String, String>();
            bootstrapProperties.getUsers()
                    .stream()
                    .filter(user -> user.getEntityId() != null)
                    .forEach(user -> bindings.put(user.getUsername(), user.getEntityId()));
            return new EntityBindingIdentityResolver(Map.copyOf(bindings), clock);
        }

        @Data
        @ConfigurationProperties(prefix = "contentgrid.oidc.bootstrap")
        static class BootstrapProperties {

            List<BootstrapUser> users = new ArrayList<>();
        }

        @Data
        static class BootstrapUser {

            String username;
            String password;

            /**
             * Entity the user acts as when requesting identity tokens. Users without an entity can not obtain tokens.
             */
            String entityId;

            List<String> roles = new ArrayList<>();

            UserDetails convert() {
                return User
                        .withUsername(username)
                        .password(password != null && password.startsWith("{") ? password : NOOP_PASSWORD + password)
                        .roles(roles.toArray(String[]::new))
                        .build();
            }
        }
    }

    @Bean
    public SecurityWebFilterChain springWebFilterChain(ServerHttpSecurity http) {
        http.authorizeExchange(exchange -> exchange
                // the public key set and health are readable by anyone, relying parties need them to verify tokens
                .matchers(EndpointRequest.to(
                        InfoEndpoint.class,
                        HealthEndpoint.class
                )).permitAll()
                .matchers(EndpointRequest.to("jwks")).permitAll()

                .pathMatchers(HttpMethod.POST, "/oidc/key/**").hasRole(ROLE_KEY_ADMIN)
                .anyExchange().authenticated()
        );

        http.httpBasic(Customizer.withDefaults());
        http.csrf(CsrfSpec::disable);

        return http.build();
    }
}
