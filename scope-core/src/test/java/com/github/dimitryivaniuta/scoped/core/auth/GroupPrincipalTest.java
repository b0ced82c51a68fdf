package com.github.dimitryivaniuta.scoped.core.auth;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class GroupPrincipalTest {

    @Test
    void grantsAreResolvedLazilyAndOnce() {
        AtomicInteger lookups = new AtomicInteger();
        GroupScopeStore store = userId -> Mono.fromSupplier(() -> {
            lookups.incrementAndGet();
            return Set.of("posts.read", "comments.read");
        });

        GroupPrincipal principal = new GroupPrincipal("5", false, store);
        assertEquals(0, lookups.get());

        StepVerifier.create(principal.grantedScopes())
                .expectNext(Set.of("posts.read", "comments.read"))
                .verifyComplete();
        StepVerifier.create(principal.grantedScopes())
                .expectNext(Set.of("posts.read", "comments.read"))
                .verifyComplete();
        assertEquals(1, lookups.get());
    }

    @Test
    void userWithoutGroupsHasEmptyGrantSet() {
        GroupPrincipal principal = new GroupPrincipal("5", false, userId -> Mono.empty());

        StepVerifier.create(principal.grantedScopes()).expectNext(Set.of()).verifyComplete();
        assertEquals(PrincipalKind.GROUP, principal.kind());
        assertEquals("5", principal.getName());
        assertFalse(principal.isSuperuser());
    }
}
