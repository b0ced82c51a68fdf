package com.github.dimitryivaniuta.scoped.gateway.config;

import com.github.dimitryivaniuta.scoped.gateway.security.GatewayScopeProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Exposes the BCrypt encoder used to hash and verify API keys.
 */
@Configuration
public class PasswordEncoderConfig {

    /**
     * Strength applies to newly issued keys only; stored hashes carry their own cost.
     *
     * @return password encoder
     */
    @Bean
    public PasswordEncoder passwordEncoder(final GatewayScopeProperties props) {
        return new BCryptPasswordEncoder(props.getApiKeyHashStrength());
    }
}
