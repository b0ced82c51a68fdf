package com.github.dimitryivaniuta.scoped.gateway.web;

import com.github.dimitryivaniuta.scoped.core.auth.PrincipalKind;
import com.github.dimitryivaniuta.scoped.core.auth.ScopedPrincipal;
import com.github.dimitryivaniuta.scoped.gateway.admin.ScopeChoice;
import com.github.dimitryivaniuta.scoped.gateway.admin.ScopeChoiceRenderer;
import com.github.dimitryivaniuta.scoped.gateway.admin.ScopeListingFormatter;
import com.github.dimitryivaniuta.scoped.gateway.admin.ScopeSummaryFormatter;
import com.github.dimitryivaniuta.scoped.gateway.registry.EndpointRegistry;
import com.github.dimitryivaniuta.scoped.gateway.registry.ScopeExempt;
import com.github.dimitryivaniuta.scoped.gateway.registry.ScopedResource;
import com.github.dimitryivaniuta.scoped.gateway.web.dto.PrincipalScopes;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Read-only views of the scope catalogue ({@code scopes.read}).
 */
@RestController
@RequestMapping(path = "/scopes", produces = MediaType.APPLICATION_JSON_VALUE)
@ScopedResource(name = "scopes", module = "admin")
@RequiredArgsConstructor
public class ScopeCatalogController {

    static final String NO_GRANTS = "No scopes";

    private final EndpointRegistry registry;

    private final ScopeChoiceRenderer choiceRenderer;

    private final ScopeListingFormatter listingFormatter;

    private final ScopeSummaryFormatter summaryFormatter;

    /** module → resource → scopes. */
    @GetMapping
    public Map<String, Map<String, List<String>>> byModule() {
        return registry.catalog().byModule();
    }

    /** resource → scopes, merged across modules. */
    @GetMapping("/resources")
    public Map<String, List<String>> byResource() {
        return registry.catalog().byResource();
    }

    /** Flat selectable options, one per scope. */
    @GetMapping(path = "/choices", params = "!group")
    public List<ScopeChoice> choices() {
        return choiceRenderer.choices(registry.catalog());
    }

    /** Options grouped under their resource label; any other {@code group} value is a 400. */
    @GetMapping(path = "/choices", params = "group=resource")
    public Map<String, List<ScopeChoice>> choicesByResource() {
        return choiceRenderer.byResource(registry.catalog());
    }

    @GetMapping(path = "/choices", params = "group=module")
    public Map<String, Map<String, List<ScopeChoice>>> choicesByModule() {
        return choiceRenderer.byModule(registry.catalog());
    }

    @GetMapping(path = "/listing", produces = MediaType.TEXT_PLAIN_VALUE)
    public String listing() {
        return listingFormatter.format(registry.catalog());
    }

    /** The caller's own grants; needs authentication but no scope. */
    @ScopeExempt
    @GetMapping("/me")
    public Mono<PrincipalScopes> me(@AuthenticationPrincipal final ScopedPrincipal principal) {
        if (principal == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required"));
        }
        return principal.grantedScopes()
                .defaultIfEmpty(Set.of())
                .map(grants -> {
                    List<String> sorted = List.copyOf(new TreeSet<>(grants));
                    String summary = sorted.isEmpty() && principal.kind() == PrincipalKind.GROUP
                            ? NO_GRANTS
                            : summaryFormatter.summarize(sorted);
                    return new PrincipalScopes(principal.getName(), principal.kind().name(),
                            principal.isSuperuser(), sorted, summary);
                });
    }
}
