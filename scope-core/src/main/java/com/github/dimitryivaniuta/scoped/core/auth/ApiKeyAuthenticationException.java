package com.github.dimitryivaniuta.scoped.core.auth;

import java.io.Serial;

/**
 * A presented API key did not authenticate.
 *
 * <p>The message is the same for every cause so callers cannot probe for valid prefixes;
 * {@link #getReason()} is meant for server-side logs only.</p>
 */
public class ApiKeyAuthenticationException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1L;

    /** Message exposed to callers regardless of the cause. */
    public static final String MESSAGE = "Invalid API key";

    /** Why the key was rejected. */
    public enum Reason {
        NOT_FOUND,
        HASH_MISMATCH,
        REVOKED,
        EXPIRED
    }

    private final Reason reason;

    public ApiKeyAuthenticationException(final Reason reason) {
        super(MESSAGE);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
