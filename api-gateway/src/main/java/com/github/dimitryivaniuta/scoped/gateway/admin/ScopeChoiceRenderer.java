package com.github.dimitryivaniuta.scoped.gateway.admin;

import com.github.dimitryivaniuta.scoped.core.scope.ScopeCatalog;
import com.github.dimitryivaniuta.scoped.core.scope.Scopes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Turns the scope catalogue into options an administrator picks grants from.
 *
 * <p>Labels are humanized: underscores become spaces and every word is capitalized,
 * so {@code blog_posts.partial_update} reads {@code Blog Posts - Partial Update}.</p>
 */
@Component
public class ScopeChoiceRenderer {

    /** Flat list, resources in name order, actions in catalogue order. */
    public List<ScopeChoice> choices(final ScopeCatalog catalog) {
        List<ScopeChoice> out = new ArrayList<>();
        catalog.byResource().values().forEach(scopes -> scopes.forEach(scope ->
                out.add(new ScopeChoice(scope, humanize(Scopes.resourceOf(scope)) + " - " + humanize(Scopes.actionOf(scope))))));
        return Collections.unmodifiableList(out);
    }

    /** Resource display name to its options, each labelled with the action only. */
    public Map<String, List<ScopeChoice>> byResource(final ScopeCatalog catalog) {
        return group(catalog.byResource());
    }

    /** Module to resource display name to options. */
    public Map<String, Map<String, List<ScopeChoice>>> byModule(final ScopeCatalog catalog) {
        Map<String, Map<String, List<ScopeChoice>>> out = new LinkedHashMap<>();
        catalog.byModule().forEach((module, resources) -> out.put(module, group(resources)));
        return Collections.unmodifiableMap(out);
    }

    private static Map<String, List<ScopeChoice>> group(final Map<String, List<String>> resources) {
        Map<String, List<ScopeChoice>> out = new LinkedHashMap<>();
        resources.forEach((resource, scopes) -> out.put(humanize(resource), scopes.stream()
                .map(scope -> new ScopeChoice(scope, humanize(Scopes.actionOf(scope))))
                .toList()));
        return Collections.unmodifiableMap(out);
    }

    static String humanize(final String name) {
        if (name == null || name.isEmpty()) return "";
        return Arrays.stream(name.replace('_', ' ').split(" "))
                .filter(w -> !w.isEmpty())
                .map(w -> w.substring(0, 1).toUpperCase(Locale.ROOT) + w.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }
}
