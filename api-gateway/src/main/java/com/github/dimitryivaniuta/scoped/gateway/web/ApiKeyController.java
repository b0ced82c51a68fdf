package com.github.dimitryivaniuta.scoped.gateway.web;

import com.github.dimitryivaniuta.scoped.gateway.registry.ScopedOperation;
import com.github.dimitryivaniuta.scoped.gateway.registry.ScopedResource;
import com.github.dimitryivaniuta.scoped.gateway.service.ApiKeyService;
import com.github.dimitryivaniuta.scoped.gateway.web.dto.ApiKeyView;
import com.github.dimitryivaniuta.scoped.gateway.web.dto.CreateApiKeyRequest;
import com.github.dimitryivaniuta.scoped.gateway.web.dto.IssuedApiKey;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * API key administration: {@code apikeys.read}, {@code apikeys.write}, {@code apikeys.revoke}.
 */
@Validated
@RestController
@RequestMapping(path = "/api-keys", produces = MediaType.APPLICATION_JSON_VALUE)
@ScopedResource(name = "apikeys", module = "admin")
@RequiredArgsConstructor
public class ApiKeyController {

    private final ApiKeyService apiKeyService;

    @GetMapping
    public Flux<ApiKeyView> list() {
        return apiKeyService.list();
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<IssuedApiKey> create(@Valid @RequestBody final CreateApiKeyRequest req) {
        return apiKeyService.issue(req);
    }

    @PostMapping("/{id}/revoke")
    @ScopedOperation(custom = "revoke")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> revoke(@PathVariable("id") final Long id) {
        return apiKeyService.revoke(id)
                .flatMap(revoked -> revoked
                        ? Mono.<Void>empty()
                        : Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "No active API key " + id)));
    }
}
