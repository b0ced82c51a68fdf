package com.github.dimitryivaniuta.scoped.gateway.web.dto;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A newly issued key. {@code key} is only ever returned here; the gateway keeps the hash.
 */
public record IssuedApiKey(Long id, String name, String prefix, String key, List<String> scopes,
                           OffsetDateTime expiresAt) {

    @Override
    public String toString() {
        return "IssuedApiKey[id=" + id + ", name=" + name + ", prefix=" + prefix + "]";
    }
}
