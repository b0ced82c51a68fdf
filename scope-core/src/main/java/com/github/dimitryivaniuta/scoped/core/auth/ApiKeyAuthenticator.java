package com.github.dimitryivaniuta.scoped.core.auth;

import com.github.dimitryivaniuta.scoped.core.auth.ApiKeyAuthenticationException.Reason;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Turns a request's API key into a {@link ScopedPrincipal}.
 *
 * <p>Outcomes:</p>
 * <ul>
 *   <li>no key in the request: empty (anonymous, other mechanisms may still authenticate);</li>
 *   <li>unknown, mismatching, revoked or expired key: {@link ApiKeyAuthenticationException};</li>
 *   <li>valid key: an {@link ApiKeyPrincipal}.</li>
 * </ul>
 *
 * <p>With last-used tracking on, a successful authentication fires a best-effort timestamp
 * write that never delays or fails the result.</p>
 */
@Slf4j
public class ApiKeyAuthenticator {

    private final CredentialExtractor extractor;

    private final ApiKeyStore store;

    /** Hash verification (BCrypt by default). */
    private final PasswordEncoder passwordEncoder;

    private final boolean trackLastUsed;

    private final Clock clock;

    public ApiKeyAuthenticator(final CredentialExtractor extractor,
                               final ApiKeyStore store,
                               final PasswordEncoder passwordEncoder,
                               final boolean trackLastUsed) {
        this(extractor, store, passwordEncoder, trackLastUsed, Clock.systemUTC());
    }

    public ApiKeyAuthenticator(final CredentialExtractor extractor,
                               final ApiKeyStore store,
                               final PasswordEncoder passwordEncoder,
                               final boolean trackLastUsed,
                               final Clock clock) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.store = Objects.requireNonNull(store, "store");
        this.passwordEncoder = Objects.requireNonNull(passwordEncoder, "passwordEncoder");
        this.trackLastUsed = trackLastUsed;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Authenticates from request headers.
     *
     * @param headers request headers
     * @return principal, empty when no key was presented, or an error for an invalid key
     */
    public Mono<ScopedPrincipal> authenticate(final HeaderLookup headers) {
        return Mono.defer(() -> extractor.extract(headers)
                .map(this::authenticateKey)
                .orElseGet(Mono::empty));
    }

    /**
     * Authenticates an already extracted raw key.
     *
     * @param rawKey presented key, {@code prefix.secret}
     * @return principal or {@link ApiKeyAuthenticationException}
     */
    public Mono<ScopedPrincipal> authenticateKey(final String rawKey) {
        String prefix = ApiKeyGenerator.prefixOf(rawKey).orElse(null);
        if (prefix == null) {
            return Mono.error(rejected(null, Reason.NOT_FOUND));
        }

        return store.findByPrefix(prefix)
                .switchIfEmpty(Mono.error(() -> rejected(prefix, Reason.NOT_FOUND)))
                .flatMap(key -> verifyHash(rawKey, key))
                .flatMap(this::checkStatus)
                .doOnNext(this::recordUsage)
                .<ScopedPrincipal>map(ApiKeyPrincipal::new);
    }

    private Mono<ScopedApiKey> verifyHash(final String rawKey, final ScopedApiKey key) {
        // BCrypt is CPU-bound; keep it off the event loop
        return Mono.fromCallable(() -> key.hashedKey() != null && passwordEncoder.matches(rawKey, key.hashedKey()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(matches -> matches
                        ? Mono.just(key)
                        : Mono.error(rejected(key.prefix(), Reason.HASH_MISMATCH)));
    }

    private Mono<ScopedApiKey> checkStatus(final ScopedApiKey key) {
        // stores normally filter revoked keys already
        if (!key.isActive()) {
            return Mono.error(rejected(key.prefix(), Reason.REVOKED));
        }
        if (key.isExpired(clock.instant())) {
            return Mono.error(rejected(key.prefix(), Reason.EXPIRED));
        }
        return Mono.just(key);
    }

    private void recordUsage(final ScopedApiKey key) {
        if (!trackLastUsed) return;

        final Instant now = clock.instant();
        Mono.defer(() -> store.recordUsage(key.id(), now))
                .subscribe(
                        v -> { },
                        e -> log.warn("Failed to record API key use prefix={} id={}", key.prefix(), key.id(), e));
    }

    private static ApiKeyAuthenticationException rejected(final String prefix, final Reason reason) {
        log.debug("API key rejected prefix={} reason={}", prefix, reason);
        return new ApiKeyAuthenticationException(reason);
    }
}
