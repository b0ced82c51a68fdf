package com.github.dimitryivaniuta.scoped.core.auth;

import java.util.Objects;
import java.util.Set;
import reactor.core.publisher.Mono;

/**
 * User principal whose grants are the union of the scopes of all the user's groups.
 *
 * <p>The union is fetched lazily with a single store query and cached on this instance;
 * create one principal per request.</p>
 */
public final class GroupPrincipal implements ScopedPrincipal {

    private final String userId;
    private final boolean superuser;
    private final Mono<Set<String>> grants;

    public GroupPrincipal(final String userId, final boolean superuser, final GroupScopeStore store) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.superuser = superuser;
        Objects.requireNonNull(store, "store");
        this.grants = Mono.defer(() -> store.scopesForUser(userId))
                .defaultIfEmpty(Set.of())
                .map(Set::copyOf)
                .cache();
    }

    public String userId() {
        return userId;
    }

    @Override
    public PrincipalKind kind() {
        return PrincipalKind.GROUP;
    }

    @Override
    public Mono<Set<String>> grantedScopes() {
        return grants;
    }

    @Override
    public boolean isSuperuser() {
        return superuser;
    }

    @Override
    public String getName() {
        return userId;
    }

    @Override
    public String toString() {
        return "GroupPrincipal[" + userId + (superuser ? ", superuser" : "") + "]";
    }
}
