package com.github.dimitryivaniuta.scoped.core.endpoint;

/**
 * Canonical action buckets an endpoint operation falls into.
 *
 * <p>The three standard buckets each contribute exactly one action name to a scope;
 * {@link #CUSTOM} operations contribute their own operation name.</p>
 */
public enum OperationKind {

    /** Safe / listing operations. */
    READ("read"),

    /** Create and update operations. */
    WRITE("write"),

    /** Destructive operations. */
    DELETE("delete"),

    /** Explicitly registered operation named after itself. */
    CUSTOM(null);

    private final String action;

    OperationKind(final String action) {
        this.action = action;
    }

    /**
     * @return the action name for standard kinds, {@code null} for {@link #CUSTOM}
     */
    public String action() {
        return action;
    }

    public boolean isStandard() {
        return this != CUSTOM;
    }
}
