package com.github.dimitryivaniuta.scoped.core.config;

import com.github.dimitryivaniuta.scoped.core.auth.CredentialExtractor;
import com.github.dimitryivaniuta.scoped.core.endpoint.ResourceNameResolver;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * API key and scope enforcement settings.
 */
@Getter @Setter
@ConfigurationProperties(prefix = "security.scopes")
public class ScopedPermissionsProperties {

    /** Scheme keyword in {@code Authorization: <keyword> <key>}; matched case-insensitively. */
    private String authKeyword = CredentialExtractor.DEFAULT_KEYWORD;

    /** Optional header carrying the bare key, consulted when Authorization holds no API key. */
    private String customHeader;

    /** Persist a last-used timestamp on each successful API key authentication. */
    private boolean trackLastUsed = false;

    /** Suffixes stripped from implementation names when deriving resource names. */
    private List<String> resourceSuffixes = new ArrayList<>(ResourceNameResolver.DEFAULT_SUFFIXES);
}
