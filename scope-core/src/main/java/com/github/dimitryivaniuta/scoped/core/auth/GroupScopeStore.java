package com.github.dimitryivaniuta.scoped.core.auth;

import java.util.Set;
import reactor.core.publisher.Mono;

/**
 * Read access to group grants.
 */
public interface GroupScopeStore {

    /**
     * Union of the grant sets of every group the user belongs to, in one round trip.
     *
     * @param userId user identifier
     * @return merged scopes; empty set when the user has no scoped groups
     */
    Mono<Set<String>> scopesForUser(String userId);
}
