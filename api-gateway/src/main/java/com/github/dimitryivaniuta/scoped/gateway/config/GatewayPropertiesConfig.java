package com.github.dimitryivaniuta.scoped.gateway.config;

import com.github.dimitryivaniuta.scoped.gateway.security.GatewayScopeProperties;
import com.github.dimitryivaniuta.scoped.gateway.security.JwtProperties;
import com.github.dimitryivaniuta.scoped.gateway.security.ResourceServerJwtProperties;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers config properties for the gateway.
 */
@Configuration
@EnableConfigurationProperties({
        JwtProperties.class,
        ResourceServerJwtProperties.class,
        GatewayScopeProperties.class,
})
public class GatewayPropertiesConfig {

    /** Expiry checks and last-used stamps read this clock. */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
