package com.github.dimitryivaniuta.scoped.gateway.config;

import com.github.dimitryivaniuta.scoped.core.auth.GroupScopeStore;
import com.github.dimitryivaniuta.scoped.gateway.security.GatewayScopeProperties;
import com.github.dimitryivaniuta.scoped.gateway.security.JwtAuthoritiesConverter;
import com.github.dimitryivaniuta.scoped.gateway.security.JwtProperties;
import com.github.dimitryivaniuta.scoped.gateway.security.ScopedJwtAuthenticationConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.oauth2.jwt.Jwt;
import reactor.core.publisher.Mono;

/**
 * Builds group-scoped principals from validated user tokens.
 */
@Configuration
@RequiredArgsConstructor
public class JwtConvertersConfig {

    private final JwtProperties jwtProperties;

    private final GatewayScopeProperties scopeProperties;

    @Bean
    public Converter<Jwt, Mono<AbstractAuthenticationToken>> reactiveJwtAuthConverter(final GroupScopeStore groupScopeStore) {
        return new ScopedJwtAuthenticationConverter(
                new JwtAuthoritiesConverter(),
                groupScopeStore,
                jwtProperties.getPrincipalClaim(),
                scopeProperties.getSuperuserAuthority());
    }
}
