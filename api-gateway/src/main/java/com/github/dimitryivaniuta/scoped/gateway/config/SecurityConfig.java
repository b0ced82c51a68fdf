package com.github.dimitryivaniuta.scoped.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.scoped.core.auth.ApiKeyAuthenticator;
import com.github.dimitryivaniuta.scoped.core.auth.CredentialExtractor;
import com.github.dimitryivaniuta.scoped.gateway.security.ApiErrorResponder;
import com.github.dimitryivaniuta.scoped.gateway.security.ApiKeyReactiveAuthenticationManager;
import com.github.dimitryivaniuta.scoped.gateway.security.ApiKeyServerAuthenticationConverter;
import com.github.dimitryivaniuta.scoped.gateway.security.JwtProperties;
import com.github.dimitryivaniuta.scoped.gateway.security.RequiredAudienceValidator;
import com.github.dimitryivaniuta.scoped.gateway.security.ResourceServerJwtProperties;
import com.github.dimitryivaniuta.scoped.gateway.security.ScopeAuthorizationManager;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.NimbusReactiveJwtDecoder;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.authentication.AuthenticationWebFilter;
import org.springframework.security.web.server.authentication.ServerAuthenticationEntryPointFailureHandler;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;
import org.springframework.security.web.server.savedrequest.NoOpServerRequestCache;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsConfigurationSource;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;
import reactor.core.publisher.Mono;

/**
 * Reactive security configuration.
 *
 * <p>Two stateless authentication mechanisms run side by side: API keys
 * ({@code Authorization: Api-Key <key>} or the configured custom header) and user JWTs.
 * Every exchange is then checked by {@link ScopeAuthorizationManager} against the scope
 * its handler requires.</p>
 */
@Slf4j
@Configuration
@EnableWebFluxSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    /** Audience and clock skew for user tokens. */
    private final JwtProperties jwtProperties;

    /** Issuer and optional jwk-set-uri for resource-server validation. */
    private final ResourceServerJwtProperties resourceProps;

    /** Jwt to group-scoped principal. */
    private final Converter<Jwt, Mono<AbstractAuthenticationToken>> jwtAuthConverter;

    @Bean
    public SecurityWebFilterChain springSecurityFilterChain(ServerHttpSecurity http,
                                                            ReactiveJwtDecoder decoder,
                                                            ApiKeyAuthenticator apiKeyAuthenticator,
                                                            CredentialExtractor extractor,
                                                            ScopeAuthorizationManager scopeAuthorizationManager,
                                                            ApiErrorResponder errors) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .cors(c -> c.configurationSource(corsConfigurationSource()))
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .logout(ServerHttpSecurity.LogoutSpec::disable)
                .requestCache(c -> c.requestCache(NoOpServerRequestCache.getInstance()))
                .securityContextRepository(NoOpServerSecurityContextRepository.getInstance())
                .exceptionHandling(e -> e
                        .authenticationEntryPoint(errors.entryPoint())
                        .accessDeniedHandler(errors.accessDeniedHandler()))
                .addFilterAt(apiKeyAuthenticationFilter(apiKeyAuthenticator, extractor, errors), SecurityWebFiltersOrder.AUTHENTICATION)
                .authorizeExchange(ex -> ex
                        .pathMatchers("/actuator/health", "/actuator/info").permitAll()
                        .anyExchange().access(scopeAuthorizationManager))
                .oauth2ResourceServer(oauth -> oauth
                        .authenticationEntryPoint(errors.entryPoint())
                        .accessDeniedHandler(errors.accessDeniedHandler())
                        .jwt(jwt -> jwt
                                .jwtDecoder(decoder)
                                .jwtAuthenticationConverter(jwtAuthConverter)))
                .build();
    }

    /**
     * API key authentication. Requests without a key pass through untouched; an invalid
     * key ends the exchange with 401. Not a bean, so WebFlux does not also register it globally.
     */
    private static AuthenticationWebFilter apiKeyAuthenticationFilter(ApiKeyAuthenticator authenticator,
                                                                      CredentialExtractor extractor,
                                                                      ApiErrorResponder errors) {
        AuthenticationWebFilter filter = new AuthenticationWebFilter(new ApiKeyReactiveAuthenticationManager(authenticator));
        filter.setServerAuthenticationConverter(new ApiKeyServerAuthenticationConverter(extractor));
        filter.setAuthenticationFailureHandler(new ServerAuthenticationEntryPointFailureHandler(errors.entryPoint()));
        return filter;
    }

    @Bean
    public ApiErrorResponder apiErrorResponder(ObjectMapper objectMapper, CredentialExtractor extractor, Clock clock) {
        return new ApiErrorResponder(objectMapper, extractor.keyword(), clock);
    }

    /**
     * Reactive JWT decoder built from issuer or JWK set and composed validators.
     * Validators:
     * - JwtTimestampValidator with the configured skew
     * - RequiredAudienceValidator if audience is configured
     */
    @Bean
    public ReactiveJwtDecoder reactiveJwtDecoder() {
        final NimbusReactiveJwtDecoder decoder =
                resourceProps.hasJwks()
                        ? NimbusReactiveJwtDecoder.withJwkSetUri(resourceProps.getJwkSetUri()).build()
                        : NimbusReactiveJwtDecoder.withIssuerLocation(resourceProps.getIssuerUri()).build();

        var validators = new ArrayList<OAuth2TokenValidator<Jwt>>();
        validators.add(new JwtTimestampValidator(jwtProperties.getClockSkew()));

        var audiences = RequiredAudienceValidator.parse(jwtProperties.getAudience());
        if (!audiences.isEmpty()) {
            validators.add(new RequiredAudienceValidator(audiences));
        } else {
            log.warn("security.jwt.audience is not set; accepting tokens for any audience");
        }

        decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(validators));
        return decoder;
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        var cfg = new CorsConfiguration();
        cfg.setAllowedOrigins(List.of("*"));
        cfg.setAllowedMethods(List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        cfg.setAllowedHeaders(List.of("*"));
        cfg.setExposedHeaders(List.of("X-Correlation-ID", "WWW-Authenticate"));
        cfg.setAllowCredentials(false);
        cfg.setMaxAge(3600L);

        var source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cfg);
        return source;
    }
}
