package com.github.dimitryivaniuta.scoped.core.scope;

/**
 * Scope string helpers. A scope is the opaque atom {@code resource.action};
 * scopes are compared by exact, case-sensitive string equality.
 */
public final class Scopes {

    /** Separator between resource and action. */
    public static final char SEPARATOR = '.';

    private Scopes() {}

    public static String of(final String resource, final String action) {
        return resource + SEPARATOR + action;
    }

    /** Resource part of a scope; the whole string when there is no separator. */
    public static String resourceOf(final String scope) {
        int i = scope.indexOf(SEPARATOR);
        return i < 0 ? scope : scope.substring(0, i);
    }

    /** Action part of a scope (everything after the first separator); empty when there is none. */
    public static String actionOf(final String scope) {
        int i = scope.indexOf(SEPARATOR);
        return i < 0 ? "" : scope.substring(i + 1);
    }

    /** True when the name can be used as one side of a scope. */
    public static boolean isValidPart(final String part) {
        if (part == null || part.isEmpty()) return false;
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c == SEPARATOR || Character.isWhitespace(c)) return false;
        }
        return true;
    }
}
