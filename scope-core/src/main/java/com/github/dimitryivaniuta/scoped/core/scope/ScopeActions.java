package com.github.dimitryivaniuta.scoped.core.scope;

import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointDescriptor;
import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointOperation;
import com.github.dimitryivaniuta.scoped.core.endpoint.OperationKind;
import com.github.dimitryivaniuta.scoped.core.endpoint.StandardOperation;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Operation-to-action mapping shared by discovery and enforcement.
 */
public final class ScopeActions {

    /** Standard buckets in the order they appear in the catalogue. */
    private static final List<OperationKind> STANDARD_ORDER =
            List.of(OperationKind.READ, OperationKind.WRITE, OperationKind.DELETE);

    private ScopeActions() {}

    /**
     * All actions an endpoint can require: {@code read}, {@code write}, {@code delete}
     * (each once, when present) followed by custom operations in registration order.
     */
    public static Set<String> actionsOf(final EndpointDescriptor endpoint) {
        Set<String> actions = new LinkedHashSet<>();
        for (OperationKind kind : STANDARD_ORDER) {
            for (StandardOperation op : endpoint.standardOperations()) {
                if (op.kind() == kind) {
                    actions.add(kind.action());
                    break;
                }
            }
        }
        for (String custom : endpoint.customOperations()) {
            actions.add(EndpointOperation.custom(custom).action());
        }
        return actions;
    }

    /** The action a single dispatched operation requires. */
    public static String actionOf(final EndpointOperation operation) {
        return operation.action();
    }
}
