package com.github.dimitryivaniuta.scoped.gateway.web.dto;

import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Request to issue an API key.
 *
 * @param name      display name
 * @param scopes    granted scopes; empty issues an unrestricted (legacy) key
 * @param expiresAt optional expiry
 */
public record CreateApiKeyRequest(
        @NotBlank @Size(max = 100) String name,
        List<@NotNull @Pattern(regexp = "[^.\\s]+\\.[^.\\s]+", message = "must be resource.action") String> scopes,
        @Future OffsetDateTime expiresAt
) {
}
