package com.github.dimitryivaniuta.scoped.core.endpoint;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;

/**
 * Static registration metadata of one endpoint, built once at startup.
 *
 * <p>Both scope discovery and scope enforcement read the same descriptor, so the
 * resource name and the action set can never drift apart between the two.</p>
 *
 * @param module             owning module (app) used to group the scope catalogue
 * @param implementation     implementation identifier, usually the fully-qualified class name;
 *                           {@code null} for anonymous endpoints
 * @param resourceName       explicit resource name override, optional
 * @param requiredScope      explicit required scope override, optional
 * @param standardOperations standard operations present on the endpoint
 * @param customOperations   custom operation names in registration order
 */
@Builder(toBuilder = true)
public record EndpointDescriptor(
        String module,
        String implementation,
        String resourceName,
        String requiredScope,
        @Singular Set<StandardOperation> standardOperations,
        @Singular List<String> customOperations
) {

    /** Module used when an endpoint does not name one. */
    public static final String DEFAULT_MODULE = "default";

    public EndpointDescriptor {
        module = module == null || module.isBlank() ? DEFAULT_MODULE : module;
        standardOperations = standardOperations == null || standardOperations.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(standardOperations));
        customOperations = customOperations == null ? List.of() : List.copyOf(customOperations);
    }

    public Optional<String> explicitRequiredScope() {
        return Optional.ofNullable(requiredScope);
    }

    /** Short label for log lines. */
    public String label() {
        return implementation != null ? implementation
                : resourceName != null ? resourceName : "<anonymous>";
    }
}
