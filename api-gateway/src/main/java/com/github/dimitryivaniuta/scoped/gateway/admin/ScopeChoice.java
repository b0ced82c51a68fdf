package com.github.dimitryivaniuta.scoped.gateway.admin;

/**
 * One selectable scope.
 *
 * @param scope the scope value, e.g. {@code blog_posts.read}
 * @param label display label, e.g. {@code Blog Posts - Read}
 */
public record ScopeChoice(String scope, String label) {
}
