package com.github.dimitryivaniuta.scoped.core.auth;

/**
 * How a principal was established, which decides what an empty grant set means.
 */
public enum PrincipalKind {

    /** Keyed credential; an empty grant set is unrestricted (legacy mode). */
    API_KEY,

    /** User whose grants come from group memberships; an empty grant set grants nothing. */
    GROUP
}
