package com.github.dimitryivaniuta.scoped.core.auth;

import java.time.Instant;
import reactor.core.publisher.Mono;

/**
 * Read access to keyed credentials plus the last-used write.
 */
public interface ApiKeyStore {

    /**
     * Finds the credential registered under a key prefix. Stores may leave revoked
     * keys out; callers check revocation again regardless.
     *
     * @param prefix clear-text key prefix
     * @return the credential, or empty when none matches
     */
    Mono<ScopedApiKey> findByPrefix(String prefix);

    /**
     * Records a successful use. Concurrent writes for the same key may race; the last one wins.
     *
     * @param id     credential id
     * @param usedAt time of use
     * @return completion signal
     */
    Mono<Void> recordUsage(String id, Instant usedAt);
}
