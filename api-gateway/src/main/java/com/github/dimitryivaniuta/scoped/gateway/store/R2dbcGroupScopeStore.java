package com.github.dimitryivaniuta.scoped.gateway.store;

import com.github.dimitryivaniuta.scoped.core.auth.GroupScopeStore;
import com.github.dimitryivaniuta.scoped.gateway.model.ScopedGroupRepository;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * {@link GroupScopeStore} resolving a user's grants with a single union query.
 */
@Component
@RequiredArgsConstructor
public class R2dbcGroupScopeStore implements GroupScopeStore {

    private final ScopedGroupRepository repository;

    @Override
    public Mono<Set<String>> scopesForUser(final String userId) {
        return repository.findScopesForUser(userId)
                .collect(LinkedHashSet<String>::new, Set::add)
                .map(Set::copyOf);
    }
}
