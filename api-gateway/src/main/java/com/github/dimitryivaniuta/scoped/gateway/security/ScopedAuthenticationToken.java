package com.github.dimitryivaniuta.scoped.gateway.security;

import com.github.dimitryivaniuta.scoped.core.auth.ScopedPrincipal;
import java.util.Collection;
import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;

/**
 * Authentication carrying a {@link ScopedPrincipal}.
 *
 * <p>Before authentication it only holds the raw API key presented by the client.</p>
 */
public final class ScopedAuthenticationToken extends AbstractAuthenticationToken {

    private final transient ScopedPrincipal principal;

    private transient Object credentials;

    private ScopedAuthenticationToken(final ScopedPrincipal principal,
                                      final Object credentials,
                                      final Collection<? extends GrantedAuthority> authorities,
                                      final boolean authenticated) {
        super(authorities);
        this.principal = principal;
        this.credentials = credentials;
        setAuthenticated(authenticated);
    }

    /** Unauthenticated request for the given raw key. */
    public static ScopedAuthenticationToken unauthenticated(final String rawKey) {
        return new ScopedAuthenticationToken(null, rawKey, List.of(), false);
    }

    public static ScopedAuthenticationToken authenticated(final ScopedPrincipal principal,
                                                          final Object credentials,
                                                          final Collection<? extends GrantedAuthority> authorities) {
        return new ScopedAuthenticationToken(principal, credentials, authorities, true);
    }

    @Override
    public Object getPrincipal() {
        return principal;
    }

    @Override
    public Object getCredentials() {
        return credentials;
    }

    @Override
    public String getName() {
        return principal != null ? principal.getName() : "";
    }

    @Override
    public void eraseCredentials() {
        super.eraseCredentials();
        if (credentials instanceof String) {
            credentials = null;
        }
    }
}
