package com.github.dimitryivaniuta.scoped.core.endpoint;

import com.github.dimitryivaniuta.scoped.core.scope.Scopes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Single source of truth for an endpoint's canonical resource name.
 *
 * <p>An explicit resource name always wins. Otherwise the name is derived from the
 * implementation identifier: simple name, first matching suffix stripped, lower-cased
 * ({@code com.acme.PostViewSet} becomes {@code post}). Scope discovery and the
 * authorizer both go through {@link #resolve(EndpointDescriptor)}.</p>
 *
 * <p>Immutable and free of I/O; safe to share between threads.</p>
 */
public final class ResourceNameResolver {

    /** Suffixes stripped from implementation names unless configured otherwise. */
    public static final List<String> DEFAULT_SUFFIXES = List.of("ViewSet", "Controller", "Resource", "View");

    /** Longest first so {@code ViewSet} is tried before {@code View}. */
    private final List<String> suffixes;

    public ResourceNameResolver() {
        this(DEFAULT_SUFFIXES);
    }

    public ResourceNameResolver(final List<String> suffixes) {
        List<String> sorted = new ArrayList<>();
        if (suffixes != null) {
            suffixes.stream().filter(s -> s != null && !s.isBlank()).forEach(sorted::add);
        }
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        this.suffixes = List.copyOf(sorted);
    }

    /**
     * Resolves the canonical resource name.
     *
     * @param endpoint endpoint metadata
     * @return resource name, or empty when none can be derived (anonymous endpoint)
     * @throws EndpointIntrospectionException if the explicit name is blank or not a valid scope part
     */
    public Optional<String> resolve(final EndpointDescriptor endpoint) {
        if (endpoint.resourceName() != null) {
            String explicit = endpoint.resourceName();
            if (!Scopes.isValidPart(explicit)) {
                throw new EndpointIntrospectionException(
                        "Invalid resource name '" + explicit + "' on endpoint " + endpoint.label());
            }
            return Optional.of(explicit);
        }
        return deriveFromImplementation(endpoint.implementation());
    }

    /**
     * Derives a resource name from an implementation identifier alone.
     */
    public Optional<String> deriveFromImplementation(final String implementation) {
        if (implementation == null || implementation.isBlank()) return Optional.empty();

        String name = simpleName(implementation.trim());
        for (String suffix : suffixes) {
            if (name.endsWith(suffix)) {
                name = name.substring(0, name.length() - suffix.length());
                break;
            }
        }
        name = name.toLowerCase(Locale.ROOT);
        return Scopes.isValidPart(name) ? Optional.of(name) : Optional.empty();
    }

    public List<String> suffixes() {
        return suffixes;
    }

    private static String simpleName(final String implementation) {
        int cut = Math.max(implementation.lastIndexOf('.'), implementation.lastIndexOf('$'));
        return cut < 0 ? implementation : implementation.substring(cut + 1);
    }
}
