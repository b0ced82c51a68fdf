package com.github.dimitryivaniuta.scoped.gateway.util;

import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Ensures every exchange carries a correlation id:
 * <ul>
 *   <li>Reads {@code X-Correlation-ID} or generates one.</li>
 *   <li>Mirrors it on the response.</li>
 *   <li>Exposes it as an exchange attribute and in the Reactor context for log lines.</li>
 * </ul>
 *
 * <p>Runs ahead of the security chain so authentication and scope decisions can be
 * correlated.</p>
 */
@Slf4j
@Component
public class CorrelationIdFilter implements WebFilter, Ordered {

    /** Exchange attribute key containing the correlation id. */
    public static final String ATTR_CORRELATION_ID = "com.github.dimitryivaniuta.scoped.correlation-id";

    /** Reactor context key containing the correlation id. */
    public static final String CTX_CORRELATION_ID = "correlationId";

    /** HTTP header name for correlation id propagation. */
    public static final String HEADER_CORRELATION_ID = "X-Correlation-ID";

    private static final int MAX_LENGTH = 200;

    @Override
    public Mono<Void> filter(final ServerWebExchange exchange, final WebFilterChain chain) {
        final String id = correlationIdOf(exchange);
        exchange.getAttributes().put(ATTR_CORRELATION_ID, id);
        exchange.getResponse().getHeaders().set(HEADER_CORRELATION_ID, id);
        return chain.filter(exchange).contextWrite(ctx -> ctx.put(CTX_CORRELATION_ID, id));
    }

    /** Ahead of Spring Security's WebFilterChainProxy (order -100). */
    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }

    private static String correlationIdOf(final ServerWebExchange exchange) {
        final String cached = exchange.getAttribute(ATTR_CORRELATION_ID);
        if (cached != null && !cached.isBlank()) return cached;

        final String raw = exchange.getRequest().getHeaders().getFirst(HEADER_CORRELATION_ID);
        if (raw != null) {
            final String v = raw.trim();
            if (!v.isEmpty() && v.length() <= MAX_LENGTH) return v;
        }

        final String generated = UUID.randomUUID().toString();
        if (log.isDebugEnabled()) {
            log.debug("Generated new correlation id {}", generated);
        }
        return generated;
    }
}
