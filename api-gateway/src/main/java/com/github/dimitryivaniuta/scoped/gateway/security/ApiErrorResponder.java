package com.github.dimitryivaniuta.scoped.gateway.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.scoped.gateway.util.CorrelationIdFilter;
import com.github.dimitryivaniuta.scoped.gateway.web.dto.ApiError;
import java.time.Clock;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.web.server.ServerAuthenticationEntryPoint;
import org.springframework.security.web.server.authorization.ServerAccessDeniedHandler;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Writes {@link ApiError} bodies for authentication and authorization failures.
 *
 * <p>401 responses carry {@code WWW-Authenticate} challenges for both the API key keyword
 * and bearer tokens. Messages never reveal why a credential was rejected.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ApiErrorResponder {

    private final ObjectMapper objectMapper;

    private final String apiKeyKeyword;

    private final Clock clock;

    public ServerAuthenticationEntryPoint entryPoint() {
        return (exchange, ex) -> {
            exchange.getResponse().getHeaders().add(HttpHeaders.WWW_AUTHENTICATE, apiKeyKeyword);
            exchange.getResponse().getHeaders().add(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
            String message = ex.getMessage() == null ? "Authentication required" : ex.getMessage();
            return write(exchange, HttpStatus.UNAUTHORIZED, message);
        };
    }

    public ServerAccessDeniedHandler accessDeniedHandler() {
        return (exchange, denied) -> write(exchange, HttpStatus.FORBIDDEN, "Insufficient scope");
    }

    Mono<Void> write(final ServerWebExchange exchange, final HttpStatus status, final String message) {
        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            return Mono.empty();
        }
        ApiError body = new ApiError(
                status.value(),
                status.name().toLowerCase(Locale.ROOT),
                message,
                exchange.getRequest().getPath().value(),
                exchange.getAttribute(CorrelationIdFilter.ATTR_CORRELATION_ID),
                clock.instant());

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize error body status={}", status.value(), e);
            bytes = new byte[0];
        }
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }
}
