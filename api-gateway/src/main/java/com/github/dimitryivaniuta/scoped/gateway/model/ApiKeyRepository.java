package com.github.dimitryivaniuta.scoped.gateway.model;

import java.time.OffsetDateTime;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive repository for {@link ApiKeyEntity}.
 */
@Repository
public interface ApiKeyRepository extends ReactiveCrudRepository<ApiKeyEntity, Long> {

    /** Looks up a key by prefix, including revoked ones so revocation can be reported. */
    Mono<ApiKeyEntity> findByPrefix(String prefix);

    Flux<ApiKeyEntity> findAllByOrderByIdAsc();

    /**
     * Stamps the last successful use without loading the entity.
     *
     * @return rows updated (0 or 1)
     */
    @Modifying
    @Query("UPDATE api_keys SET last_used_at = :usedAt WHERE id = :id")
    Mono<Integer> touchLastUsed(@Param("id") Long id, @Param("usedAt") OffsetDateTime usedAt);

    @Modifying
    @Query("UPDATE api_keys SET revoked = TRUE WHERE id = :id AND revoked = FALSE")
    Mono<Integer> revoke(@Param("id") Long id);
}
