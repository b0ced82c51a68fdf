package com.github.dimitryivaniuta.scoped.gateway.security;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gateway-side scope settings. Shares the {@code security.scopes} prefix with the
 * engine settings bound in scope-core.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "security.scopes")
public class GatewayScopeProperties {

    /** BCrypt strength used when hashing newly issued API keys. */
    @Min(4)
    @Max(31)
    private int apiKeyHashStrength = 10;

    /** JWT authority that bypasses scope checks for user tokens. */
    @NotBlank
    private String superuserAuthority = "ROLE_SUPERUSER";
}
