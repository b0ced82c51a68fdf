package com.github.dimitryivaniuta.scoped.core.auth;

import java.util.Objects;
import java.util.Set;
import reactor.core.publisher.Mono;

/**
 * Principal produced by a successful API key authentication.
 */
public final class ApiKeyPrincipal implements ScopedPrincipal {

    private final ScopedApiKey apiKey;

    public ApiKeyPrincipal(final ScopedApiKey apiKey) {
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
    }

    public ScopedApiKey apiKey() {
        return apiKey;
    }

    @Override
    public PrincipalKind kind() {
        return PrincipalKind.API_KEY;
    }

    @Override
    public Mono<Set<String>> grantedScopes() {
        return Mono.just(apiKey.scopes());
    }

    @Override
    public String getName() {
        return apiKey.name() != null ? apiKey.name() : apiKey.prefix();
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof ApiKeyPrincipal other && Objects.equals(apiKey.id(), other.apiKey.id());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(apiKey.id());
    }

    @Override
    public String toString() {
        return "ApiKeyPrincipal[" + getName() + "]";
    }
}
