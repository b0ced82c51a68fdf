package com.github.dimitryivaniuta.scoped.gateway.security;

import com.github.dimitryivaniuta.scoped.core.auth.ApiKeyAuthenticationException;
import com.github.dimitryivaniuta.scoped.core.auth.ApiKeyAuthenticator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import reactor.core.publisher.Mono;

/**
 * Authenticates {@link ScopedAuthenticationToken} API key requests through the
 * {@link ApiKeyAuthenticator}. Every rejection surfaces as the same
 * {@link BadCredentialsException} so clients cannot tell why a key failed.
 */
@RequiredArgsConstructor
public class ApiKeyReactiveAuthenticationManager implements ReactiveAuthenticationManager {

    /** Authority granted to every authenticated API key. */
    public static final String API_KEY_AUTHORITY = "ROLE_API_KEY";

    private final ApiKeyAuthenticator authenticator;

    @Override
    public Mono<Authentication> authenticate(final Authentication authentication) {
        if (!(authentication.getCredentials() instanceof String rawKey)) {
            return Mono.empty();
        }
        return authenticator.authenticateKey(rawKey)
                .<Authentication>map(principal -> ScopedAuthenticationToken.authenticated(
                        principal, rawKey, List.of(new SimpleGrantedAuthority(API_KEY_AUTHORITY))))
                .onErrorMap(ApiKeyAuthenticationException.class,
                        e -> new BadCredentialsException(ApiKeyAuthenticationException.MESSAGE, e));
    }
}
