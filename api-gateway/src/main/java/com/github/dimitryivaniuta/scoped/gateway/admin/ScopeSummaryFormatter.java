package com.github.dimitryivaniuta.scoped.gateway.admin;

import com.github.dimitryivaniuta.scoped.core.scope.Scopes;
import java.util.Collection;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * One-line summary of a credential's grants, e.g. {@code comments(read) | posts(read, write)}.
 *
 * <p>Resources and actions are sorted; values without a separator are left out.
 * An empty grant set reads {@link #UNRESTRICTED}.</p>
 */
@Component
public class ScopeSummaryFormatter {

    public static final String UNRESTRICTED = "Unrestricted (legacy)";

    public String summarize(final Collection<String> scopes) {
        if (scopes == null || scopes.isEmpty()) {
            return UNRESTRICTED;
        }
        Map<String, TreeSet<String>> byResource = new TreeMap<>();
        for (String scope : scopes) {
            if (scope == null || scope.indexOf(Scopes.SEPARATOR) < 0) continue;
            byResource.computeIfAbsent(Scopes.resourceOf(scope), k -> new TreeSet<>()).add(Scopes.actionOf(scope));
        }

        StringJoiner out = new StringJoiner(" | ");
        byResource.forEach((resource, actions) -> out.add(resource + "(" + String.join(", ", actions) + ")"));
        return out.toString();
    }
}
