package com.github.dimitryivaniuta.scoped.gateway.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;

/**
 * Authorities of a user token: OAuth2 scopes as {@code SCOPE_*} plus roles as {@code ROLE_*},
 * read from a flat {@code roles} claim and Keycloak-style {@code realm_access}/{@code resource_access}.
 *
 * <p>These authorities only flag superusers; resource access is decided by group scopes.</p>
 */
public final class JwtAuthoritiesConverter implements Converter<Jwt, Collection<GrantedAuthority>> {

    private final JwtGrantedAuthoritiesConverter scopeConverter = new JwtGrantedAuthoritiesConverter();

    @Override
    public Collection<GrantedAuthority> convert(final Jwt jwt) {
        Set<GrantedAuthority> out = new LinkedHashSet<>(scopeConverter.convert(jwt));
        addRoles(out, jwt.getClaim("roles"));

        Map<String, Object> realm = jwt.getClaimAsMap("realm_access");
        if (realm != null) {
            addRoles(out, realm.get("roles"));
        }
        Map<String, Object> resource = jwt.getClaimAsMap("resource_access");
        if (resource != null) {
            resource.values().forEach(client -> {
                if (client instanceof Map<?, ?> m) {
                    addRoles(out, m.get("roles"));
                }
            });
        }
        return List.copyOf(out);
    }

    private static void addRoles(final Set<GrantedAuthority> out, final Object roles) {
        if (roles instanceof Collection<?> names) {
            names.forEach(r -> out.add(new SimpleGrantedAuthority(
                    r.toString().startsWith("ROLE_") ? r.toString() : "ROLE_" + r)));
        }
    }
}
