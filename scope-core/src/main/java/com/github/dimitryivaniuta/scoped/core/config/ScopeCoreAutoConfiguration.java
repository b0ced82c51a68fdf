package com.github.dimitryivaniuta.scoped.core.config;

import com.github.dimitryivaniuta.scoped.core.auth.ApiKeyAuthenticator;
import com.github.dimitryivaniuta.scoped.core.auth.ApiKeyGenerator;
import com.github.dimitryivaniuta.scoped.core.auth.ApiKeyStore;
import com.github.dimitryivaniuta.scoped.core.auth.CredentialExtractor;
import com.github.dimitryivaniuta.scoped.core.authz.ScopeAuthorizer;
import com.github.dimitryivaniuta.scoped.core.endpoint.ResourceNameResolver;
import com.github.dimitryivaniuta.scoped.core.scope.ScopeDiscovery;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Wires the scope engine from {@link ScopedPermissionsProperties}.
 * Every bean backs off when the application defines its own.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(ScopedPermissionsProperties.class)
public class ScopeCoreAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ResourceNameResolver resourceNameResolver(ScopedPermissionsProperties props) {
        return new ResourceNameResolver(props.getResourceSuffixes());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScopeDiscovery scopeDiscovery(ResourceNameResolver resolver) {
        return new ScopeDiscovery(resolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScopeAuthorizer scopeAuthorizer(ResourceNameResolver resolver) {
        return new ScopeAuthorizer(resolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialExtractor credentialExtractor(ScopedPermissionsProperties props) {
        return new CredentialExtractor(props.getAuthKeyword(), props.getCustomHeader());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ApiKeyStore.class, PasswordEncoder.class})
    public ApiKeyAuthenticator apiKeyAuthenticator(CredentialExtractor extractor,
                                                   ApiKeyStore store,
                                                   PasswordEncoder passwordEncoder,
                                                   ScopedPermissionsProperties props,
                                                   ObjectProvider<Clock> clock) {
        log.info("API key authentication enabled keyword={} customHeader={} trackLastUsed={}",
                extractor.keyword(), props.getCustomHeader(), props.isTrackLastUsed());
        return new ApiKeyAuthenticator(extractor, store, passwordEncoder, props.isTrackLastUsed(),
                clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(PasswordEncoder.class)
    public ApiKeyGenerator apiKeyGenerator(PasswordEncoder passwordEncoder) {
        return new ApiKeyGenerator(passwordEncoder);
    }
}
