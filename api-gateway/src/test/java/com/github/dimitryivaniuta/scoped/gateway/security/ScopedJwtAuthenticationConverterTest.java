package com.github.dimitryivaniuta.scoped.gateway.security;

import com.github.dimitryivaniuta.scoped.core.auth.GroupPrincipal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.oauth2.jwt.Jwt;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ScopedJwtAuthenticationConverterTest {

    private final AtomicInteger lookups = new AtomicInteger();

    private final ScopedJwtAuthenticationConverter converter = new ScopedJwtAuthenticationConverter(
            new JwtAuthoritiesConverter(),
            userId -> Mono.fromSupplier(() -> {
                lookups.incrementAndGet();
                return Set.of("post.read");
            }),
            "sub",
            "ROLE_SUPERUSER");

    private static Jwt.Builder token() {
        return Jwt.withTokenValue("t").header("alg", "RS256");
    }

    @Test
    void userTokenBecomesGroupPrincipalWithLazyGrants() {
        Jwt jwt = token().subject("42").claim("scope", "openid profile").build();

        StepVerifier.create(converter.convert(jwt))
                .assertNext(auth -> {
                    assertThat(auth.isAuthenticated()).isTrue();
                    GroupPrincipal principal = (GroupPrincipal) auth.getPrincipal();
                    assertThat(principal.userId()).isEqualTo("42");
                    assertThat(principal.isSuperuser()).isFalse();
                    assertThat(lookups).hasValue(0);
                    assertThat(principal.grantedScopes().block()).containsExactly("post.read");
                })
                .verifyComplete();
    }

    @Test
    void superuserRoleFromFlatOrKeycloakClaims() {
        Jwt flat = token().subject("1").claim("roles", List.of("SUPERUSER")).build();
        Jwt keycloak = token().subject("2").claim("realm_access", Map.of("roles", List.of("SUPERUSER"))).build();

        StepVerifier.create(converter.convert(flat))
                .assertNext(auth -> assertThat(((GroupPrincipal) auth.getPrincipal()).isSuperuser()).isTrue())
                .verifyComplete();
        StepVerifier.create(converter.convert(keycloak))
                .assertNext(auth -> assertThat(((GroupPrincipal) auth.getPrincipal()).isSuperuser()).isTrue())
                .verifyComplete();
    }

    @Test
    void tokenWithoutSubjectIsRejected() {
        Jwt jwt = token().claim("scope", "openid").build();

        StepVerifier.create(converter.convert(jwt))
                .expectError(OAuth2AuthenticationException.class)
                .verify();
    }
}
