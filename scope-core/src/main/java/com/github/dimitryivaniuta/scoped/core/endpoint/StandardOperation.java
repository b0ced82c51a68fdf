package com.github.dimitryivaniuta.scoped.core.endpoint;

import java.util.Locale;
import java.util.Optional;

/**
 * CRUD-style operations an endpoint may expose and the bucket each one maps into.
 */
public enum StandardOperation {

    LIST("list", OperationKind.READ),
    RETRIEVE("retrieve", OperationKind.READ),
    CREATE("create", OperationKind.WRITE),
    UPDATE("update", OperationKind.WRITE),
    PARTIAL_UPDATE("partial_update", OperationKind.WRITE),
    DESTROY("destroy", OperationKind.DELETE);

    private final String operationName;
    private final OperationKind kind;

    StandardOperation(final String operationName, final OperationKind kind) {
        this.operationName = operationName;
        this.kind = kind;
    }

    public String operationName() {
        return operationName;
    }

    public OperationKind kind() {
        return kind;
    }

    /**
     * Parses an operation name such as {@code list} or {@code partial_update}.
     *
     * @param name operation name, may be null
     * @return matching operation or empty when the name is not a standard one
     */
    public static Optional<StandardOperation> fromName(final String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        for (StandardOperation op : values()) {
            if (op.operationName.equals(name)) return Optional.of(op);
        }
        return Optional.empty();
    }

    /**
     * Standard operation conventionally served by an HTTP method.
     * GET, HEAD and OPTIONS list; POST creates; PUT updates; PATCH partially updates; DELETE destroys.
     *
     * @param method HTTP method name, any case
     * @return matching operation or empty for unknown methods
     */
    public static Optional<StandardOperation> forHttpMethod(final String method) {
        if (method == null) return Optional.empty();
        return switch (method.toUpperCase(Locale.ROOT)) {
            case "GET", "HEAD", "OPTIONS" -> Optional.of(LIST);
            case "POST" -> Optional.of(CREATE);
            case "PUT" -> Optional.of(UPDATE);
            case "PATCH" -> Optional.of(PARTIAL_UPDATE);
            case "DELETE" -> Optional.of(DESTROY);
            default -> Optional.empty();
        };
    }
}
