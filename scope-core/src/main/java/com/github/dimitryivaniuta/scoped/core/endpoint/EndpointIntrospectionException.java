package com.github.dimitryivaniuta.scoped.core.endpoint;

import java.io.Serial;

/**
 * Raised when an endpoint's registration metadata cannot be turned into a scope.
 */
public class EndpointIntrospectionException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1L;

    public EndpointIntrospectionException(final String message) {
        super(message);
    }
}
