package com.github.dimitryivaniuta.scoped.gateway.web;

import com.github.dimitryivaniuta.scoped.gateway.service.ApiKeyService;
import com.github.dimitryivaniuta.scoped.gateway.web.dto.ApiKeyView;
import com.github.dimitryivaniuta.scoped.gateway.web.dto.CreateApiKeyRequest;
import com.github.dimitryivaniuta.scoped.gateway.web.dto.IssuedApiKey;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApiKeyControllerTest {

    private ApiKeyService service;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        service = mock(ApiKeyService.class);
        client = WebTestClient.bindToController(new ApiKeyController(service)).build();
    }

    @Test
    void revokeActiveKeyReturnsNoContent() {
        when(service.revoke(7L)).thenReturn(Mono.just(true));

        client.post().uri("/api-keys/7/revoke").exchange()
                .expectStatus().isNoContent()
                .expectBody().isEmpty();
    }

    @Test
    void revokeUnknownOrAlreadyRevokedKeyReturnsNotFound() {
        when(service.revoke(8L)).thenReturn(Mono.just(false));

        client.post().uri("/api-keys/8/revoke").exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void createReturnsIssuedKeyOnce() {
        when(service.issue(any())).thenReturn(Mono.just(
                new IssuedApiKey(1L, "ci", "abcd1234", "abcd1234.secret", List.of("posts.read"), null)));

        client.post().uri("/api-keys")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"name\":\"ci\",\"scopes\":[\"posts.read\"]}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.key").isEqualTo("abcd1234.secret")
                .jsonPath("$.scopes[0]").isEqualTo("posts.read");

        ArgumentCaptor<CreateApiKeyRequest> req = ArgumentCaptor.forClass(CreateApiKeyRequest.class);
        verify(service).issue(req.capture());
        assertThat(req.getValue().scopes()).containsExactly("posts.read");
    }

    @Test
    void nullScopeIsRejectedAsBadRequest() {
        client.post().uri("/api-keys")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"name\":\"ci\",\"scopes\":[null]}")
                .exchange()
                .expectStatus().isBadRequest();

        verify(service, never()).issue(any());
    }

    @Test
    void malformedScopeIsRejectedAsBadRequest() {
        client.post().uri("/api-keys")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"name\":\"ci\",\"scopes\":[\"posts\"]}")
                .exchange()
                .expectStatus().isBadRequest();

        verify(service, never()).issue(any());
    }

    @Test
    void listReturnsViews() {
        when(service.list()).thenReturn(Flux.just(new ApiKeyView(1L, "ci", "abcd1234", List.of("posts.read"),
                "posts(read)", false, false, null, null, null)));

        client.get().uri("/api-keys").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].prefix").isEqualTo("abcd1234")
                .jsonPath("$[0].summary").isEqualTo("posts(read)")
                .jsonPath("$[0].key").doesNotExist();
    }
}
