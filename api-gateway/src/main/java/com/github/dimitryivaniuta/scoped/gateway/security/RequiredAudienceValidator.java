package com.github.dimitryivaniuta.scoped.gateway.security;

import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Accepts a token when its {@code aud} claim names at least one accepted audience.
 */
@Slf4j
public final class RequiredAudienceValidator implements OAuth2TokenValidator<Jwt> {

    private static final OAuth2Error INVALID_AUDIENCE =
            new OAuth2Error("invalid_token", "Token audience is not accepted", null);

    private final List<String> acceptedAudiences;

    public RequiredAudienceValidator(final List<String> acceptedAudiences) {
        this.acceptedAudiences = List.copyOf(acceptedAudiences);
    }

    /**
     * Parses a comma-separated audience setting such as {@code "api,admin-api"}.
     *
     * @return accepted audiences, empty when the setting is blank
     */
    public static List<String> parse(final String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public OAuth2TokenValidatorResult validate(final Jwt jwt) {
        List<String> aud = jwt.getAudience();
        if (aud != null && aud.stream().anyMatch(acceptedAudiences::contains)) {
            return OAuth2TokenValidatorResult.success();
        }
        log.debug("Rejecting token sub={} aud={} accepted={}", jwt.getSubject(), aud, acceptedAudiences);
        return OAuth2TokenValidatorResult.failure(INVALID_AUDIENCE);
    }
}
