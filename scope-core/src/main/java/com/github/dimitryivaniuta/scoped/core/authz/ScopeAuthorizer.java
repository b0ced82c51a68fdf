package com.github.dimitryivaniuta.scoped.core.authz;

import com.github.dimitryivaniuta.scoped.core.auth.PrincipalKind;
import com.github.dimitryivaniuta.scoped.core.auth.ScopedPrincipal;
import com.github.dimitryivaniuta.scoped.core.authz.ScopeDecision.Basis;
import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointDescriptor;
import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointIntrospectionException;
import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointOperation;
import com.github.dimitryivaniuta.scoped.core.endpoint.ResourceNameResolver;
import com.github.dimitryivaniuta.scoped.core.scope.ScopeActions;
import com.github.dimitryivaniuta.scoped.core.scope.Scopes;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Decides whether a principal may invoke an endpoint operation.
 *
 * <p>Per request:</p>
 * <ol>
 *   <li>Required scope: the endpoint's explicit required scope if declared, otherwise
 *       {@code resource.action} from {@link ResourceNameResolver} and {@link ScopeActions};
 *       no resource means nothing is required and the request is allowed.</li>
 *   <li>No principal is denied. An API key with an empty grant set is allowed (legacy mode);
 *       a superuser is allowed; a group principal with an empty grant set is denied.</li>
 *   <li>Otherwise the required scope must be in the grant set.</li>
 * </ol>
 *
 * <p>Checks have no side effects and may be repeated within a request.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ScopeAuthorizer {

    private final ResourceNameResolver resolver;

    /**
     * Computes the scope an operation requires. An explicit required scope short-circuits
     * resource name derivation entirely.
     *
     * @throws EndpointIntrospectionException when the endpoint metadata is invalid
     */
    public RequiredScope requiredScope(final EndpointDescriptor endpoint, final EndpointOperation operation) {
        if (endpoint.requiredScope() != null) {
            if (endpoint.requiredScope().isBlank()) {
                throw new EndpointIntrospectionException("Blank required scope on endpoint " + endpoint.label());
            }
            return RequiredScope.explicit(endpoint.requiredScope());
        }
        return resolver.resolve(endpoint)
                .map(resource -> RequiredScope.derived(Scopes.of(resource, ScopeActions.actionOf(operation))))
                .orElse(RequiredScope.none());
    }

    /**
     * Pure decision over an already resolved grant set.
     *
     * @param required  required scope
     * @param principal principal, {@code null} when the request is anonymous
     * @param grants    the principal's effective grant set
     */
    public ScopeDecision decide(final RequiredScope required, final ScopedPrincipal principal, final Set<String> grants) {
        if (!required.isRequired()) {
            return ScopeDecision.of(required, Basis.NO_SCOPE_REQUIRED);
        }
        if (principal == null) {
            return ScopeDecision.of(required, Basis.NO_PRINCIPAL);
        }

        final Set<String> granted = grants == null ? Set.of() : grants;
        if (principal.kind() == PrincipalKind.API_KEY && granted.isEmpty()) {
            return ScopeDecision.of(required, Basis.LEGACY_UNRESTRICTED);
        }
        if (principal.isSuperuser()) {
            return ScopeDecision.of(required, Basis.SUPERUSER);
        }
        if (granted.isEmpty()) {
            return ScopeDecision.of(required, Basis.NO_GRANTS);
        }
        return ScopeDecision.of(required, granted.contains(required.scope()) ? Basis.SCOPE_GRANTED : Basis.SCOPE_MISSING);
    }

    /**
     * Full check: computes the required scope, resolves the principal's grants only when
     * needed, then decides. Misconfigured endpoints are denied.
     *
     * @param principal principal, {@code null} when the request is anonymous
     * @param endpoint  endpoint being invoked
     * @param operation dispatched operation
     */
    public Mono<ScopeDecision> authorize(final ScopedPrincipal principal,
                                         final EndpointDescriptor endpoint,
                                         final EndpointOperation operation) {
        final RequiredScope required;
        try {
            required = requiredScope(endpoint, operation);
        } catch (EndpointIntrospectionException e) {
            log.error("Denying request to misconfigured endpoint endpoint={} reason={}", endpoint.label(), e.getMessage());
            return Mono.just(new ScopeDecision(false, null, Basis.MISCONFIGURED_ENDPOINT));
        }

        if (!required.isRequired() || principal == null || principal.isSuperuser()) {
            return Mono.just(decide(required, principal, Set.of()));
        }
        return principal.grantedScopes()
                .defaultIfEmpty(Set.of())
                .map(grants -> decide(required, principal, grants));
    }
}
