package com.github.dimitryivaniuta.scoped.gateway.security;

import com.github.dimitryivaniuta.scoped.core.auth.GroupPrincipal;
import com.github.dimitryivaniuta.scoped.core.auth.GroupScopeStore;
import java.util.Collection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.jwt.Jwt;
import reactor.core.publisher.Mono;

/**
 * Turns a validated user token into a {@link GroupPrincipal}. The principal's grants are
 * fetched lazily, only when a scope check needs them.
 */
@Slf4j
@RequiredArgsConstructor
public class ScopedJwtAuthenticationConverter implements Converter<Jwt, Mono<AbstractAuthenticationToken>> {

    private final Converter<Jwt, Collection<GrantedAuthority>> authoritiesConverter;

    private final GroupScopeStore groupScopeStore;

    private final String principalClaim;

    private final String superuserAuthority;

    @Override
    public Mono<AbstractAuthenticationToken> convert(final Jwt jwt) {
        String userId = jwt.getClaimAsString(principalClaim);
        if (userId == null || userId.isBlank()) {
            return Mono.error(new OAuth2AuthenticationException(
                    new OAuth2Error("invalid_token", "Token has no " + principalClaim + " claim", null)));
        }

        Collection<GrantedAuthority> authorities = authoritiesConverter.convert(jwt);
        boolean superuser = authorities.stream().anyMatch(a -> superuserAuthority.equals(a.getAuthority()));
        if (superuser) {
            log.debug("Superuser token user={}", userId);
        }
        GroupPrincipal principal = new GroupPrincipal(userId, superuser, groupScopeStore);
        return Mono.just(ScopedAuthenticationToken.authenticated(principal, jwt, authorities));
    }
}
