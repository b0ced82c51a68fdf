package com.github.dimitryivaniuta.scoped.core.auth;

/**
 * Case-insensitive access to request headers.
 */
@FunctionalInterface
public interface HeaderLookup {

    /**
     * @param name header name
     * @return first value of the header or {@code null} when absent
     */
    String first(String name);
}
