package com.github.dimitryivaniuta.scoped.gateway.security;

import java.time.Duration;
import lombok.Data;
import org.springframework.validation.annotation.Validated;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * JWT validation settings for user tokens.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "security.jwt")
public class JwtProperties {

    /** Expected audience for this API; single value or comma-separated list. */
    private String audience;

    /** Clock skew tolerated on exp/nbf checks. */
    private Duration clockSkew = Duration.ofMinutes(2);

    /** Claim holding the user id that group memberships are keyed by. */
    private String principalClaim = "sub";
}
