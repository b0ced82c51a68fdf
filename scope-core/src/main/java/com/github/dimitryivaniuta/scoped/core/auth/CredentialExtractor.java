package com.github.dimitryivaniuta.scoped.core.auth;

import java.util.Optional;

/**
 * Locates a raw API key in request headers.
 *
 * <p>Reads {@code Authorization: <keyword> <key>} with the keyword matched case-insensitively.
 * When that header is missing or carries another scheme, an optional custom header holding
 * the bare key is consulted.</p>
 */
public final class CredentialExtractor {

    public static final String AUTHORIZATION = "Authorization";

    public static final String DEFAULT_KEYWORD = "Api-Key";

    private final String keyword;

    private final String customHeader;

    public CredentialExtractor() {
        this(DEFAULT_KEYWORD, null);
    }

    public CredentialExtractor(final String keyword, final String customHeader) {
        this.keyword = keyword == null || keyword.isBlank() ? DEFAULT_KEYWORD : keyword.trim();
        this.customHeader = customHeader == null || customHeader.isBlank() ? null : customHeader.trim();
    }

    /**
     * @param headers request headers
     * @return the raw key, or empty when the request carries no API key
     */
    public Optional<String> extract(final HeaderLookup headers) {
        Optional<String> fromAuthorization = fromAuthorization(headers.first(AUTHORIZATION));
        if (fromAuthorization.isPresent() || customHeader == null) {
            return fromAuthorization;
        }
        return nonBlank(headers.first(customHeader));
    }

    /** Scheme keyword, also used for the {@code WWW-Authenticate} challenge. */
    public String keyword() {
        return keyword;
    }

    public Optional<String> customHeader() {
        return Optional.ofNullable(customHeader);
    }

    private Optional<String> fromAuthorization(final String header) {
        if (header == null || header.isBlank()) return Optional.empty();

        String[] parts = header.trim().split("\\s+", 2);
        if (parts.length < 2) return Optional.empty();
        if (!parts[0].equalsIgnoreCase(keyword)) return Optional.empty();
        return nonBlank(parts[1]);
    }

    private static Optional<String> nonBlank(final String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        return v.isEmpty() ? Optional.empty() : Optional.of(v);
    }
}
