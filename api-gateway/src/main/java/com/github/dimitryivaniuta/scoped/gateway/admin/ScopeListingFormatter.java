package com.github.dimitryivaniuta.scoped.gateway.admin;

import com.github.dimitryivaniuta.scoped.core.scope.ScopeCatalog;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Plain-text listing of every available scope, grouped by resource.
 */
@Component
public class ScopeListingFormatter {

    static final String EMPTY = "No scopes found. Make sure your controllers are registered.";

    public String format(final ScopeCatalog catalog) {
        Map<String, List<String>> byResource = catalog.byResource();
        if (byResource.isEmpty()) {
            return EMPTY + "\n";
        }

        StringBuilder out = new StringBuilder("Available API Scopes:\n\n");
        int total = 0;
        for (Map.Entry<String, List<String>> e : byResource.entrySet()) {
            out.append(e.getKey()).append(":\n");
            for (String scope : e.getValue()) {
                out.append("  - ").append(scope).append('\n');
                total++;
            }
            out.append('\n');
        }
        out.append("Total: ").append(byResource.size()).append(" resources, ").append(total).append(" scopes\n");
        return out.toString();
    }
}
