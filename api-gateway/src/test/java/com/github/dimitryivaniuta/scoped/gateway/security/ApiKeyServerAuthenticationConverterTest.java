package com.github.dimitryivaniuta.scoped.gateway.security;

import com.github.dimitryivaniuta.scoped.core.auth.CredentialExtractor;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ApiKeyServerAuthenticationConverterTest {

    private final ApiKeyServerAuthenticationConverter converter =
            new ApiKeyServerAuthenticationConverter(new CredentialExtractor("Api-Key", "X-Api-Key"));

    @Test
    void authorizationHeaderKey() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/posts")
                .header(HttpHeaders.AUTHORIZATION, "api-key abcd1234.secret"));

        StepVerifier.create(converter.convert(exchange))
                .assertNext(auth -> {
                    assertThat(auth.isAuthenticated()).isFalse();
                    assertThat(auth.getCredentials()).isEqualTo("abcd1234.secret");
                })
                .verifyComplete();
    }

    @Test
    void customHeaderKey() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/posts")
                .header("X-Api-Key", "abcd1234.secret"));

        StepVerifier.create(converter.convert(exchange))
                .assertNext(auth -> assertThat(auth.getCredentials()).isEqualTo("abcd1234.secret"))
                .verifyComplete();
    }

    @Test
    void bearerTokensAndMissingHeadersAreLeftAlone() {
        StepVerifier.create(converter.convert(MockServerWebExchange.from(MockServerHttpRequest.get("/posts")
                .header(HttpHeaders.AUTHORIZATION, "Bearer eyJ")))).verifyComplete();
        StepVerifier.create(converter.convert(MockServerWebExchange.from(MockServerHttpRequest.get("/posts"))))
                .verifyComplete();
    }
}
