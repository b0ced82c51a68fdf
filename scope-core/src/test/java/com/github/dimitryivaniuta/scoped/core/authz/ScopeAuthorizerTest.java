package com.github.dimitryivaniuta.scoped.core.authz;

import com.github.dimitryivaniuta.scoped.core.auth.ApiKeyPrincipal;
import com.github.dimitryivaniuta.scoped.core.auth.GroupPrincipal;
import com.github.dimitryivaniuta.scoped.core.auth.GroupScopeStore;
import com.github.dimitryivaniuta.scoped.core.auth.ScopedApiKey;
import com.github.dimitryivaniuta.scoped.core.authz.ScopeDecision.Basis;
import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointDescriptor;
import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointOperation;
import com.github.dimitryivaniuta.scoped.core.endpoint.ResourceNameResolver;
import com.github.dimitryivaniuta.scoped.core.endpoint.StandardOperation;
import com.github.dimitryivaniuta.scoped.core.scope.ScopeCatalog;
import com.github.dimitryivaniuta.scoped.core.scope.ScopeDiscovery;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScopeAuthorizerTest {

    private final ResourceNameResolver resolver = new ResourceNameResolver();
    private final ScopeAuthorizer authorizer = new ScopeAuthorizer(resolver);

    private static final EndpointDescriptor POSTS = EndpointDescriptor.builder()
            .module("blog")
            .implementation("com.acme.blog.PostViewSet")
            .resourceName("posts")
            .standardOperation(StandardOperation.CREATE)
            .standardOperation(StandardOperation.LIST)
            .standardOperation(StandardOperation.DESTROY)
            .customOperation("publish")
            .build();

    private static ApiKeyPrincipal apiKey(final String... scopes) {
        return new ApiKeyPrincipal(ScopedApiKey.builder()
                .id("1").name("ci").prefix("abcd1234").hashedKey("x")
                .scopes(Set.of(scopes))
                .build());
    }

    private static GroupPrincipal user(final Set<String> scopes) {
        return new GroupPrincipal("42", false, userId -> Mono.just(scopes));
    }

    @Test
    void writeWithReadOnlyKeyIsDeniedNamingTheMissingScope() {
        StepVerifier.create(authorizer.authorize(apiKey("posts.read"), POSTS, EndpointOperation.named("create")))
                .assertNext(decision -> {
                    assertFalse(decision.granted());
                    assertEquals("posts.write", decision.reason());
                    assertEquals(Basis.SCOPE_MISSING, decision.basis());
                })
                .verifyComplete();
    }

    @Test
    void grantedScopeAllows() {
        StepVerifier.create(authorizer.authorize(apiKey("posts.read"), POSTS, EndpointOperation.named("list")))
                .assertNext(decision -> {
                    assertTrue(decision.granted());
                    assertNull(decision.reason());
                })
                .verifyComplete();
    }

    @Test
    void customOperationRequiresItsOwnScope() {
        StepVerifier.create(authorizer.authorize(apiKey("posts.write"), POSTS, EndpointOperation.named("publish")))
                .assertNext(decision -> assertEquals("posts.publish", decision.reason()))
                .verifyComplete();
        StepVerifier.create(authorizer.authorize(apiKey("posts.publish"), POSTS, EndpointOperation.named("publish")))
                .assertNext(decision -> assertTrue(decision.granted()))
                .verifyComplete();
    }

    @Test
    void keyWithEmptyGrantSetIsUnrestricted() {
        ApiKeyPrincipal legacy = apiKey();
        for (String op : List.of("list", "create", "destroy", "publish", "anything")) {
            ScopeDecision decision = authorizer.authorize(legacy, POSTS, EndpointOperation.named(op)).block();
            assertTrue(decision.granted(), op);
            assertEquals(Basis.LEGACY_UNRESTRICTED, decision.basis());
        }
    }

    @Test
    void groupPrincipalWithEmptyGrantSetIsDenied() {
        GroupPrincipal nobody = user(Set.of());
        for (String op : List.of("list", "create", "destroy", "publish")) {
            ScopeDecision decision = authorizer.authorize(nobody, POSTS, EndpointOperation.named(op)).block();
            assertFalse(decision.granted(), op);
            assertEquals(Basis.NO_GRANTS, decision.basis());
        }
    }

    @Test
    void groupPrincipalNeedsTheExactScope() {
        GroupPrincipal editor = user(Set.of("posts.read", "posts.write"));

        assertTrue(authorizer.authorize(editor, POSTS, EndpointOperation.named("update")).block().granted());
        assertFalse(authorizer.authorize(editor, POSTS, EndpointOperation.named("destroy")).block().granted());
    }

    @Test
    void scopesAreCaseSensitiveAndHaveNoWildcards() {
        GroupPrincipal principal = user(Set.of("Posts.read", "posts.*", "posts"));

        assertFalse(authorizer.authorize(principal, POSTS, EndpointOperation.named("list")).block().granted());
    }

    @Test
    void superuserBypassesScopes() {
        GroupPrincipal admin = new GroupPrincipal("1", true, userId -> Mono.just(Set.of()));

        ScopeDecision decision = authorizer.authorize(admin, POSTS, EndpointOperation.named("destroy")).block();

        assertTrue(decision.granted());
        assertEquals(Basis.SUPERUSER, decision.basis());
    }

    @Test
    void anonymousRequestIsDeniedWhenAScopeIsRequired() {
        ScopeDecision decision = authorizer.authorize(null, POSTS, EndpointOperation.named("list")).block();

        assertFalse(decision.granted());
        assertEquals(Basis.NO_PRINCIPAL, decision.basis());
        assertEquals("posts.read", decision.reason());
    }

    @Test
    void endpointWithoutResourceRequiresNothing() {
        EndpointDescriptor anonymous = EndpointDescriptor.builder().standardOperation(StandardOperation.LIST).build();

        assertEquals(RequiredScope.none(), authorizer.requiredScope(anonymous, EndpointOperation.named("list")));
        ScopeDecision decision = authorizer.authorize(null, anonymous, EndpointOperation.named("list")).block();
        assertTrue(decision.granted());
        assertEquals(Basis.NO_SCOPE_REQUIRED, decision.basis());
    }

    @Test
    void explicitRequiredScopeWinsOverDerivedScope() {
        EndpointDescriptor export = EndpointDescriptor.builder()
                .implementation("com.acme.PostViewSet")
                .resourceName("posts")
                .requiredScope("analytics.export")
                .standardOperation(StandardOperation.LIST)
                .build();

        RequiredScope required = authorizer.requiredScope(export, EndpointOperation.named("list"));
        assertEquals(RequiredScope.explicit("analytics.export"), required);

        assertTrue(authorizer.authorize(apiKey("analytics.export"), export, EndpointOperation.named("list")).block().granted());
        ScopeDecision denied = authorizer.authorize(apiKey("posts.read"), export, EndpointOperation.named("list")).block();
        assertFalse(denied.granted());
        assertEquals("analytics.export", denied.reason());
    }

    @Test
    void misconfiguredEndpointIsDenied() {
        EndpointDescriptor broken = EndpointDescriptor.builder().resourceName("a.b").build();

        ScopeDecision decision = authorizer.authorize(apiKey(), broken, EndpointOperation.named("list")).block();

        assertFalse(decision.granted());
        assertEquals(Basis.MISCONFIGURED_ENDPOINT, decision.basis());
    }

    @Test
    void repeatedChecksAgreeAndResolveGrantsOnce() {
        AtomicInteger lookups = new AtomicInteger();
        GroupScopeStore store = userId -> Mono.fromSupplier(() -> {
            lookups.incrementAndGet();
            return Set.of("posts.read");
        });
        GroupPrincipal principal = new GroupPrincipal("7", false, store);

        ScopeDecision first = authorizer.authorize(principal, POSTS, EndpointOperation.named("list")).block();
        ScopeDecision second = authorizer.authorize(principal, POSTS, EndpointOperation.named("list")).block();
        ScopeDecision third = authorizer.authorize(principal, POSTS, EndpointOperation.named("create")).block();

        assertEquals(first, second);
        assertTrue(first.granted());
        assertFalse(third.granted());
        assertEquals(1, lookups.get());
    }

    @Test
    void enforcedScopesAreAlwaysInTheDiscoveredCatalogue() {
        List<EndpointDescriptor> endpoints = List.of(
                POSTS,
                EndpointDescriptor.builder().module("shop").implementation("com.acme.shop.OrderController")
                        .standardOperation(StandardOperation.LIST).standardOperation(StandardOperation.PARTIAL_UPDATE)
                        .customOperation("refund").build(),
                EndpointDescriptor.builder().module("shop").implementation("com.acme.shop.CartViewSet")
                        .standardOperation(StandardOperation.DESTROY).build());
        ScopeCatalog catalog = new ScopeDiscovery(resolver).discover(endpoints);

        for (EndpointDescriptor endpoint : endpoints) {
            for (StandardOperation op : endpoint.standardOperations()) {
                String required = authorizer.requiredScope(endpoint, EndpointOperation.standard(op)).scope();
                assertTrue(catalog.contains(required), required);
            }
            for (String custom : endpoint.customOperations()) {
                String required = authorizer.requiredScope(endpoint, EndpointOperation.custom(custom)).scope();
                assertTrue(catalog.contains(required), required);
            }
        }
        assertTrue(catalog.contains("order.refund"));
        assertTrue(catalog.contains("cart.delete"));
    }
}
