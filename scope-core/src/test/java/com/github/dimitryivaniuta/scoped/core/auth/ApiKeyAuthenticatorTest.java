package com.github.dimitryivaniuta.scoped.core.auth;

import com.github.dimitryivaniuta.scoped.core.auth.ApiKeyAuthenticationException.Reason;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApiKeyAuthenticatorTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private final PasswordEncoder encoder = new BCryptPasswordEncoder(4);
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private ApiKeyStore store;
    private GeneratedApiKey generated;
    private ScopedApiKey record;

    @BeforeEach
    void setUp() {
        store = mock(ApiKeyStore.class);
        generated = new ApiKeyGenerator(encoder).generate();
        record = ScopedApiKey.builder()
                .id("11")
                .name("reporting")
                .prefix(generated.prefix())
                .hashedKey(generated.hashedKey())
                .scopes(Set.of("posts.read"))
                .build();
        when(store.findByPrefix(anyString())).thenReturn(Mono.empty());
        when(store.recordUsage(anyString(), any())).thenReturn(Mono.empty());
    }

    private ApiKeyAuthenticator authenticator(final boolean trackLastUsed) {
        return new ApiKeyAuthenticator(new CredentialExtractor(), store, encoder, trackLastUsed, clock);
    }

    private static HeaderLookup authorization(final String value) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.put("Authorization", value);
        return headers::get;
    }

    private void assertRejected(final Mono<ScopedPrincipal> result, final Reason reason) {
        StepVerifier.create(result)
                .expectErrorSatisfies(e -> {
                    ApiKeyAuthenticationException ex = assertInstanceOf(ApiKeyAuthenticationException.class, e);
                    assertEquals(reason, ex.getReason());
                    assertEquals(ApiKeyAuthenticationException.MESSAGE, ex.getMessage());
                })
                .verify();
    }

    @Test
    void noCredentialIsAnonymousNotAnError() {
        StepVerifier.create(authenticator(false).authenticate(name -> null)).verifyComplete();
        StepVerifier.create(authenticator(false).authenticate(authorization("Bearer abc"))).verifyComplete();
    }

    @Test
    void validKeyProducesApiKeyPrincipal() {
        when(store.findByPrefix(generated.prefix())).thenReturn(Mono.just(record));

        StepVerifier.create(authenticator(false).authenticate(authorization("Api-Key " + generated.rawKey())))
                .assertNext(principal -> {
                    assertEquals(PrincipalKind.API_KEY, principal.kind());
                    assertEquals("reporting", principal.getName());
                    assertEquals(Set.of("posts.read"), principal.grantedScopes().block());
                })
                .verifyComplete();
        verify(store, never()).recordUsage(anyString(), any());
    }

    @Test
    void keywordCasingDoesNotMatter() {
        when(store.findByPrefix(generated.prefix())).thenReturn(Mono.just(record));

        ScopedPrincipal upper = authenticator(false).authenticate(authorization("API-KEY " + generated.rawKey())).block();
        ScopedPrincipal lower = authenticator(false).authenticate(authorization("api-key " + generated.rawKey())).block();

        assertEquals(upper, lower);
    }

    @Test
    void unknownPrefixFails() {
        assertRejected(authenticator(false).authenticate(authorization("Api-Key nope1234.secret")), Reason.NOT_FOUND);
    }

    @Test
    void keyWithoutPrefixSeparatorFails() {
        assertRejected(authenticator(false).authenticateKey("abc123"), Reason.NOT_FOUND);
    }

    @Test
    void wrongSecretFails() {
        when(store.findByPrefix(generated.prefix())).thenReturn(Mono.just(record));

        assertRejected(authenticator(false).authenticateKey(generated.prefix() + ".wrongsecret"), Reason.HASH_MISMATCH);
    }

    @Test
    void revokedKeyNeverAuthenticatesEvenWithCorrectSecret() {
        when(store.findByPrefix(generated.prefix())).thenReturn(Mono.just(record.toBuilder().revoked(true).build()));

        assertRejected(authenticator(true).authenticateKey(generated.rawKey()), Reason.REVOKED);
        verify(store, never()).recordUsage(anyString(), any());
    }

    @Test
    void expiredKeyNeverAuthenticatesEvenWithCorrectSecret() {
        when(store.findByPrefix(generated.prefix()))
                .thenReturn(Mono.just(record.toBuilder().expiresAt(NOW.minus(Duration.ofMinutes(1))).build()));

        assertRejected(authenticator(false).authenticateKey(generated.rawKey()), Reason.EXPIRED);
    }

    @Test
    void keyExpiringInTheFutureAuthenticates() {
        when(store.findByPrefix(generated.prefix()))
                .thenReturn(Mono.just(record.toBuilder().expiresAt(NOW.plus(Duration.ofDays(1))).build()));

        StepVerifier.create(authenticator(false).authenticateKey(generated.rawKey()))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    void successRecordsLastUseWhenTracking() {
        when(store.findByPrefix(generated.prefix())).thenReturn(Mono.just(record));

        StepVerifier.create(authenticator(true).authenticateKey(generated.rawKey()))
                .expectNextCount(1)
                .verifyComplete();

        verify(store, timeout(1000)).recordUsage(eq("11"), eq(NOW));
    }

    @Test
    void failedLastUseWriteDoesNotFailAuthentication() {
        when(store.findByPrefix(generated.prefix())).thenReturn(Mono.just(record));
        when(store.recordUsage(anyString(), any())).thenReturn(Mono.error(new IllegalStateException("db down")));

        StepVerifier.create(authenticator(true).authenticateKey(generated.rawKey()))
                .assertNext(principal -> assertEquals(PrincipalKind.API_KEY, principal.kind()))
                .verifyComplete();
    }

    @Test
    void lastUseWriteThrowingSynchronouslyDoesNotFailAuthentication() {
        when(store.findByPrefix(generated.prefix())).thenReturn(Mono.just(record));
        when(store.recordUsage(anyString(), any())).thenThrow(new IllegalStateException("pool closed"));

        StepVerifier.create(authenticator(true).authenticateKey(generated.rawKey()))
                .expectNextCount(1)
                .verifyComplete();
    }
}
