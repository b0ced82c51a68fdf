package com.github.dimitryivaniuta.scoped.gateway.security;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where user tokens are verified: a JWK set URI, or OIDC discovery from the issuer.
 */
@Data
@ConfigurationProperties(prefix = "spring.security.oauth2.resourceserver.jwt")
public class ResourceServerJwtProperties {

    private String issuerUri;

    private String jwkSetUri;

    public boolean hasIssuer() {
        return issuerUri != null && !issuerUri.isBlank();
    }

    public boolean hasJwks() {
        return jwkSetUri != null && !jwkSetUri.isBlank();
    }
}
