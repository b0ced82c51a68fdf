package com.github.dimitryivaniuta.scoped.gateway.service;

import com.github.dimitryivaniuta.scoped.core.auth.ApiKeyGenerator;
import com.github.dimitryivaniuta.scoped.core.auth.GeneratedApiKey;
import com.github.dimitryivaniuta.scoped.core.scope.ScopeCatalog;
import com.github.dimitryivaniuta.scoped.gateway.admin.ScopeSummaryFormatter;
import com.github.dimitryivaniuta.scoped.gateway.model.ApiKeyEntity;
import com.github.dimitryivaniuta.scoped.gateway.model.ApiKeyRepository;
import com.github.dimitryivaniuta.scoped.gateway.model.ScopeList;
import com.github.dimitryivaniuta.scoped.gateway.registry.EndpointRegistry;
import com.github.dimitryivaniuta.scoped.gateway.web.dto.ApiKeyView;
import com.github.dimitryivaniuta.scoped.gateway.web.dto.CreateApiKeyRequest;
import com.github.dimitryivaniuta.scoped.gateway.web.dto.IssuedApiKey;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Issues, lists and revokes API keys.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    private final ApiKeyRepository repository;

    private final ApiKeyGenerator generator;

    private final EndpointRegistry registry;

    private final ScopeSummaryFormatter summaryFormatter;

    private final Clock clock;

    /**
     * Issues a key. Scopes missing from the catalogue are accepted with a warning so keys
     * can be provisioned ahead of a deployment that adds the endpoint.
     *
     * @return the issued key including the raw key, which is not retrievable later
     */
    public Mono<IssuedApiKey> issue(final CreateApiKeyRequest req) {
        final ScopeList scopes = ScopeList.of(req.scopes());
        final ScopeCatalog catalog = registry.catalog();
        scopes.values().stream()
                .filter(s -> !catalog.contains(s))
                .forEach(s -> log.warn("Issuing API key with scope not served by any endpoint scope={}", s));

        // BCrypt is CPU-bound
        return Mono.fromCallable(generator::generate)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(generated -> repository.save(ApiKeyEntity.builder()
                                .name(req.name().trim())
                                .prefix(generated.prefix())
                                .hashedKey(generated.hashedKey())
                                .scopes(scopes)
                                .expiresAt(req.expiresAt())
                                .build())
                        .map(saved -> toIssued(saved, generated)))
                .doOnNext(k -> log.info("API key issued id={} name={} prefix={} scopes={}",
                        k.id(), k.name(), k.prefix(), summaryFormatter.summarize(k.scopes())));
    }

    public Flux<ApiKeyView> list() {
        final OffsetDateTime now = OffsetDateTime.now(clock);
        return repository.findAllByOrderByIdAsc().map(e -> toView(e, now));
    }

    /**
     * @return true when the key existed and was active
     */
    public Mono<Boolean> revoke(final Long id) {
        return repository.revoke(id)
                .map(rows -> rows > 0)
                .doOnNext(revoked -> {
                    if (revoked) log.info("API key revoked id={}", id);
                });
    }

    private static IssuedApiKey toIssued(final ApiKeyEntity e, final GeneratedApiKey generated) {
        return new IssuedApiKey(e.getId(), e.getName(), e.getPrefix(), generated.rawKey(),
                e.getScopes().values(), e.getExpiresAt());
    }

    ApiKeyView toView(final ApiKeyEntity e, final OffsetDateTime now) {
        List<String> scopes = e.getScopes() == null ? List.of() : e.getScopes().values();
        boolean expired = e.getExpiresAt() != null && !e.getExpiresAt().isAfter(now);
        return new ApiKeyView(e.getId(), e.getName(), e.getPrefix(), scopes, summaryFormatter.summarize(scopes),
                e.isRevoked(), expired, e.getExpiresAt(), e.getLastUsedAt(), e.getCreatedAt());
    }
}
