package com.github.dimitryivaniuta.scoped.core.endpoint;

import java.util.Objects;

/**
 * One dispatched operation on an endpoint, tagged by kind.
 *
 * <p>Standard operations carry their CRUD name ({@code list}, {@code destroy}, ...);
 * custom operations carry the name they were registered under, which is also their action.</p>
 *
 * @param kind operation bucket
 * @param name operation name
 */
public record EndpointOperation(OperationKind kind, String name) {

    public EndpointOperation {
        Objects.requireNonNull(kind, "kind");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Operation name must not be blank");
        }
    }

    public static EndpointOperation standard(final StandardOperation operation) {
        return new EndpointOperation(operation.kind(), operation.operationName());
    }

    public static EndpointOperation custom(final String name) {
        return new EndpointOperation(OperationKind.CUSTOM, name);
    }

    /**
     * Maps a dispatched operation name: standard CRUD names land in their bucket,
     * anything else is a custom operation.
     */
    public static EndpointOperation named(final String name) {
        return StandardOperation.fromName(name)
                .map(EndpointOperation::standard)
                .orElseGet(() -> custom(name));
    }

    /**
     * Fallback for endpoints that do not declare their operations; unknown methods read.
     */
    public static EndpointOperation forHttpMethod(final String method) {
        return standard(StandardOperation.forHttpMethod(method).orElse(StandardOperation.LIST));
    }

    /**
     * @return the scope action this operation requires
     */
    public String action() {
        return kind.isStandard() ? kind.action() : name;
    }
}
