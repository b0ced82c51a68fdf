package com.github.dimitryivaniuta.scoped.core.auth;

/**
 * Freshly issued key. The raw key is shown to its owner once and never stored.
 *
 * @param prefix    clear-text lookup prefix
 * @param rawKey    full key, {@code prefix.secret}
 * @param hashedKey hash to persist
 */
public record GeneratedApiKey(String prefix, String rawKey, String hashedKey) {

    @Override
    public String toString() {
        return "GeneratedApiKey[prefix=" + prefix + "]";
    }
}
