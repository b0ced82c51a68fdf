package com.github.dimitryivaniuta.scoped.gateway.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Scopes stored in a JSONB array column. Wrapped so R2DBC maps the column through the
 * JSONB converters instead of treating it as a Postgres array.
 *
 * @param values scopes in stored order, without duplicates or nulls
 */
public record ScopeList(List<String> values) {

    private static final ScopeList EMPTY = new ScopeList(List.of());

    public ScopeList {
        values = values == null ? List.of() : values.stream()
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }

    /** Null elements are dropped. */
    public static ScopeList of(final Collection<String> scopes) {
        return scopes == null || scopes.isEmpty() ? EMPTY : new ScopeList(new ArrayList<>(scopes));
    }

    public static ScopeList empty() {
        return EMPTY;
    }

    public Set<String> asSet() {
        return new LinkedHashSet<>(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
