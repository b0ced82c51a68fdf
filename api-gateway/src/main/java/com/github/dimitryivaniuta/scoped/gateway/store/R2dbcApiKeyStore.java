package com.github.dimitryivaniuta.scoped.gateway.store;

import com.github.dimitryivaniuta.scoped.core.auth.ApiKeyStore;
import com.github.dimitryivaniuta.scoped.core.auth.ScopedApiKey;
import com.github.dimitryivaniuta.scoped.gateway.model.ApiKeyEntity;
import com.github.dimitryivaniuta.scoped.gateway.model.ApiKeyRepository;
import com.github.dimitryivaniuta.scoped.gateway.model.ScopeList;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * {@link ApiKeyStore} backed by the {@code api_keys} table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class R2dbcApiKeyStore implements ApiKeyStore {

    private final ApiKeyRepository repository;

    @Override
    public Mono<ScopedApiKey> findByPrefix(final String prefix) {
        return repository.findByPrefix(prefix).map(R2dbcApiKeyStore::toApiKey);
    }

    @Override
    public Mono<Void> recordUsage(final String id, final Instant usedAt) {
        return repository.touchLastUsed(Long.valueOf(id), usedAt.atOffset(ZoneOffset.UTC))
                .doOnNext(rows -> {
                    if (rows == 0) log.debug("No API key row to stamp id={}", id);
                })
                .then();
    }

    static ScopedApiKey toApiKey(final ApiKeyEntity e) {
        ScopeList scopes = e.getScopes() == null ? ScopeList.empty() : e.getScopes();
        return ScopedApiKey.builder()
                .id(String.valueOf(e.getId()))
                .name(e.getName())
                .prefix(e.getPrefix())
                .hashedKey(e.getHashedKey())
                .scopes(scopes.asSet())
                .revoked(e.isRevoked())
                .expiresAt(toInstant(e.getExpiresAt()))
                .lastUsedAt(toInstant(e.getLastUsedAt()))
                .build();
    }

    private static Instant toInstant(final OffsetDateTime t) {
        return t == null ? null : t.toInstant();
    }
}
