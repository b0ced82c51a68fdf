package com.github.dimitryivaniuta.scoped.gateway.registry;

import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointDescriptor;
import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointOperation;

/**
 * What a handler method is bound to: its endpoint and, when declared, its operation.
 *
 * @param endpoint  endpoint descriptor shared with scope discovery
 * @param operation declared operation, {@code null} to follow the HTTP method
 */
public record EndpointBinding(EndpointDescriptor endpoint, EndpointOperation operation) {

    public EndpointOperation operationFor(final String httpMethod) {
        return operation != null ? operation : EndpointOperation.forHttpMethod(httpMethod);
    }
}
