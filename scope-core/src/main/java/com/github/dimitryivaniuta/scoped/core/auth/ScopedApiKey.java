package com.github.dimitryivaniuta.scoped.core.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Builder;

/**
 * Keyed credential with its grant set, as read from the credential store.
 *
 * <p>An empty grant set is read by {@link com.github.dimitryivaniuta.scoped.core.authz.ScopeAuthorizer} as unrestricted access (legacy mode).</p>
 *
 * @param id         store identifier
 * @param name       display name
 * @param prefix     clear-text lookup prefix
 * @param hashedKey  hash of the full key; never logged
 * @param scopes     granted scopes
 * @param revoked    revoked keys never authenticate
 * @param expiresAt  optional expiry
 * @param lastUsedAt optional last successful use
 */
@Builder(toBuilder = true)
public record ScopedApiKey(
        String id,
        String name,
        String prefix,
        String hashedKey,
        Set<String> scopes,
        boolean revoked,
        Instant expiresAt,
        Instant lastUsedAt
) {

    public ScopedApiKey {
        scopes = scopes == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
    }

    public boolean isActive() {
        return !revoked;
    }

    /** Expired once the expiry instant is reached. */
    public boolean isExpired(final Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    @Override
    public String toString() {
        return "ScopedApiKey[id=" + id + ", name=" + name + ", prefix=" + prefix
                + ", scopes=" + (scopes.isEmpty() ? "unrestricted" : scopes)
                + ", revoked=" + revoked + ", expiresAt=" + expiresAt + "]";
    }
}
