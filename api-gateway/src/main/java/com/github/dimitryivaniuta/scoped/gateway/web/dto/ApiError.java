package com.github.dimitryivaniuta.scoped.gateway.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Error body returned for 401/403 and request validation failures.
 *
 * @param status        HTTP status code
 * @param error         short error name, e.g. {@code forbidden}
 * @param message       human readable message
 * @param path          request path
 * @param correlationId correlation id of the request
 * @param timestamp     when the error was produced
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(int status, String error, String message, String path, String correlationId,
                       Instant timestamp) {
}
