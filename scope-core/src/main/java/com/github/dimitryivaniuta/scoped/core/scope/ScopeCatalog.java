package com.github.dimitryivaniuta.scoped.core.scope;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;

/**
 * Catalogue of assignable scopes: owning module, then resource, then ordered scopes.
 *
 * <p>Modules and resources iterate in natural order; scopes keep action order.
 * Instances are immutable.</p>
 */
@EqualsAndHashCode
public final class ScopeCatalog {

    private static final ScopeCatalog EMPTY = new ScopeCatalog(Map.of());

    private final Map<String, Map<String, List<String>>> modules;

    private ScopeCatalog(final Map<String, ? extends Map<String, ? extends Collection<String>>> source) {
        Map<String, Map<String, List<String>>> copy = new TreeMap<>();
        source.forEach((module, resources) -> {
            Map<String, List<String>> res = new TreeMap<>();
            resources.forEach((resource, scopes) -> res.put(resource, List.copyOf(scopes)));
            copy.put(module, Collections.unmodifiableMap(res));
        });
        this.modules = Collections.unmodifiableMap(copy);
    }

    public static ScopeCatalog of(final Map<String, ? extends Map<String, ? extends Collection<String>>> byModule) {
        return byModule.isEmpty() ? EMPTY : new ScopeCatalog(byModule);
    }

    public static ScopeCatalog empty() {
        return EMPTY;
    }

    /** module → resource → scopes. */
    public Map<String, Map<String, List<String>>> byModule() {
        return modules;
    }

    /**
     * resource → scopes, merged across modules. A resource registered by two modules
     * lists each scope once, in first-seen order.
     */
    public Map<String, List<String>> byResource() {
        Map<String, Set<String>> merged = new TreeMap<>();
        modules.values().forEach(resources -> resources.forEach((resource, scopes) ->
                merged.computeIfAbsent(resource, k -> new LinkedHashSet<>()).addAll(scopes)));
        Map<String, List<String>> out = new LinkedHashMap<>();
        merged.forEach((resource, scopes) -> out.put(resource, List.copyOf(scopes)));
        return Collections.unmodifiableMap(out);
    }

    /** Every scope once, in catalogue order. */
    public Set<String> allScopes() {
        Set<String> all = new LinkedHashSet<>();
        byResource().values().forEach(all::addAll);
        return Collections.unmodifiableSet(all);
    }

    public boolean contains(final String scope) {
        if (scope == null) return false;
        for (Map<String, List<String>> resources : modules.values()) {
            for (List<String> scopes : resources.values()) {
                if (scopes.contains(scope)) return true;
            }
        }
        return false;
    }

    public int resourceCount() {
        return byResource().size();
    }

    public int scopeCount() {
        return allScopes().size();
    }

    public boolean isEmpty() {
        return modules.isEmpty();
    }

    @Override
    public String toString() {
        return "ScopeCatalog" + modules;
    }
}
