package com.github.dimitryivaniuta.scoped.gateway.web.dto;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Stored key as shown to administrators; never includes the key or its hash.
 *
 * @param summary grants in {@code resource(action, ...)} form
 */
public record ApiKeyView(Long id, String name, String prefix, List<String> scopes, String summary,
                         boolean revoked, boolean expired, OffsetDateTime expiresAt,
                         OffsetDateTime lastUsedAt, OffsetDateTime createdAt) {
}
