package com.github.dimitryivaniuta.scoped.gateway.security;

import com.github.dimitryivaniuta.scoped.core.auth.ScopedPrincipal;
import com.github.dimitryivaniuta.scoped.core.authz.ScopeAuthorizer;
import com.github.dimitryivaniuta.scoped.core.authz.ScopeDecision;
import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointOperation;
import com.github.dimitryivaniuta.scoped.gateway.registry.EndpointBinding;
import com.github.dimitryivaniuta.scoped.gateway.registry.EndpointRegistry;
import com.github.dimitryivaniuta.scoped.gateway.util.CorrelationIdFilter;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.ReactiveAuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.server.authorization.AuthorizationContext;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Checks the scope the target handler requires against the authenticated principal.
 *
 * <p>Exchanges that map to no registered handler (exempt controllers, unknown paths)
 * are granted here and left to the rest of the chain.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScopeAuthorizationManager implements ReactiveAuthorizationManager<AuthorizationContext> {

    private final EndpointRegistry registry;

    private final ScopeAuthorizer authorizer;

    @Override
    public Mono<AuthorizationDecision> check(final Mono<Authentication> authentication, final AuthorizationContext ctx) {
        final ServerWebExchange exchange = ctx.getExchange();
        return registry.resolve(exchange)
                .flatMap(binding -> principalOf(authentication)
                        .flatMap(principal -> decide(exchange, binding, principal.orElse(null))))
                .map(decision -> new AuthorizationDecision(decision.granted()))
                .defaultIfEmpty(new AuthorizationDecision(true));
    }

    private Mono<ScopeDecision> decide(final ServerWebExchange exchange,
                                       final EndpointBinding binding,
                                       final ScopedPrincipal principal) {
        final EndpointOperation operation = binding.operationFor(exchange.getRequest().getMethod().name());
        return authorizer.authorize(principal, binding.endpoint(), operation)
                .doOnNext(decision -> {
                    if (!decision.granted()) {
                        log.debug("Scope check denied cid={} principal={} endpoint={} operation={} reason={} basis={}",
                                exchange.getAttribute(CorrelationIdFilter.ATTR_CORRELATION_ID),
                                principal == null ? null : principal.getName(),
                                binding.endpoint().label(), operation.name(), decision.reason(), decision.basis());
                    }
                });
    }

    private static Mono<Optional<ScopedPrincipal>> principalOf(final Mono<Authentication> authentication) {
        return authentication
                .filter(Authentication::isAuthenticated)
                .map(Authentication::getPrincipal)
                .ofType(ScopedPrincipal.class)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }
}
