package com.github.dimitryivaniuta.scoped.core.scope;

import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointDescriptor;
import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointIntrospectionException;
import com.github.dimitryivaniuta.scoped.core.endpoint.ResourceNameResolver;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Enumerates every scope reachable through the registered endpoints.
 *
 * <p>A pure fold over the endpoint descriptors: resource names come from the shared
 * {@link ResourceNameResolver} and actions from {@link ScopeActions}, exactly as the
 * authorizer computes them. An endpoint with an explicit required scope contributes that
 * scope only, because it is the only one ever enforced on it.</p>
 *
 * <p>Endpoints without a resource are left out. An endpoint whose metadata cannot be
 * introspected is logged and skipped; the rest of the catalogue is still produced.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ScopeDiscovery {

    private final ResourceNameResolver resolver;

    /**
     * Builds the catalogue.
     *
     * @param endpoints registered endpoints, in registration order
     * @return module → resource → ordered scopes
     */
    public ScopeCatalog discover(final Collection<EndpointDescriptor> endpoints) {
        Map<String, Map<String, Set<String>>> acc = new TreeMap<>();
        int skipped = 0;

        for (EndpointDescriptor endpoint : endpoints) {
            try {
                collect(endpoint, acc);
            } catch (EndpointIntrospectionException e) {
                skipped++;
                log.warn("Skipping endpoint during scope discovery endpoint={} reason={}",
                        endpoint.label(), e.getMessage());
            } catch (RuntimeException e) {
                skipped++;
                log.warn("Skipping endpoint during scope discovery endpoint={}",
                        endpoint == null ? null : endpoint.label(), e);
            }
        }

        ScopeCatalog catalog = ScopeCatalog.of(acc);
        log.debug("Scope discovery finished endpoints={} skipped={} resources={} scopes={}",
                endpoints.size(), skipped, catalog.resourceCount(), catalog.scopeCount());
        return catalog;
    }

    private void collect(final EndpointDescriptor endpoint, final Map<String, Map<String, Set<String>>> acc) {
        Optional<String> explicit = endpoint.explicitRequiredScope();
        if (explicit.isPresent()) {
            String scope = explicit.get();
            if (scope.isBlank()) {
                throw new EndpointIntrospectionException("Blank required scope on endpoint " + endpoint.label());
            }
            scopesFor(acc, endpoint.module(), Scopes.resourceOf(scope)).add(scope);
            return;
        }

        Optional<String> resource = resolver.resolve(endpoint);
        if (resource.isEmpty()) {
            log.trace("Endpoint has no resource name, not scoped endpoint={}", endpoint.label());
            return;
        }

        Set<String> actions = ScopeActions.actionsOf(endpoint);
        if (actions.isEmpty()) return;

        Set<String> scopes = scopesFor(acc, endpoint.module(), resource.get());
        for (String action : actions) {
            scopes.add(Scopes.of(resource.get(), action));
        }
    }

    private static Set<String> scopesFor(final Map<String, Map<String, Set<String>>> acc,
                                         final String module, final String resource) {
        return acc.computeIfAbsent(module, k -> new TreeMap<>())
                .computeIfAbsent(resource, k -> new LinkedHashSet<>());
    }
}
