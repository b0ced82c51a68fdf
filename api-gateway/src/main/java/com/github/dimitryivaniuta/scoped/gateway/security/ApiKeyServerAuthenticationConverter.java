package com.github.dimitryivaniuta.scoped.gateway.security;

import com.github.dimitryivaniuta.scoped.core.auth.CredentialExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.server.authentication.ServerAuthenticationConverter;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Reads the API key from the request headers. Requests without one complete empty so
 * the chain continues to other authentication mechanisms.
 */
@RequiredArgsConstructor
public class ApiKeyServerAuthenticationConverter implements ServerAuthenticationConverter {

    private final CredentialExtractor extractor;

    @Override
    public Mono<Authentication> convert(final ServerWebExchange exchange) {
        return Mono.justOrEmpty(extractor.extract(exchange.getRequest().getHeaders()::getFirst))
                .map(ScopedAuthenticationToken::unauthenticated);
    }
}
