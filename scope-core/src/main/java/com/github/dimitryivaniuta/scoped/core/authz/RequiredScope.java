package com.github.dimitryivaniuta.scoped.core.authz;

/**
 * Scope a request must hold, and where it came from.
 *
 * @param scope  required scope, {@code null} when none is required
 * @param source origin of the requirement
 */
public record RequiredScope(String scope, Source source) {

    private static final RequiredScope NONE = new RequiredScope(null, Source.NONE);

    public enum Source {
        /** Declared verbatim on the endpoint. */
        EXPLICIT,
        /** Resource name plus operation action. */
        DERIVED,
        /** Endpoint has no resource; not scope-enforced. */
        NONE
    }

    public static RequiredScope explicit(final String scope) {
        return new RequiredScope(scope, Source.EXPLICIT);
    }

    public static RequiredScope derived(final String scope) {
        return new RequiredScope(scope, Source.DERIVED);
    }

    public static RequiredScope none() {
        return NONE;
    }

    public boolean isRequired() {
        return scope != null;
    }
}
