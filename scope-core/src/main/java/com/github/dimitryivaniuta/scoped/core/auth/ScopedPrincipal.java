package com.github.dimitryivaniuta.scoped.core.auth;

import java.security.Principal;
import java.util.Set;
import reactor.core.publisher.Mono;

/**
 * Authenticated identity whose grants are checked against required scopes.
 */
public interface ScopedPrincipal extends Principal {

    PrincipalKind kind();

    /**
     * Effective grant set. Implementations resolve it at most once per principal instance,
     * so repeated checks within one request do not repeat the lookup.
     *
     * @return granted scopes; completes with an empty set rather than empty
     */
    Mono<Set<String>> grantedScopes();

    /** Superusers bypass scope checks. Only user principals can be superusers. */
    default boolean isSuperuser() {
        return false;
    }
}
