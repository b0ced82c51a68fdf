package com.github.dimitryivaniuta.scoped.gateway.web.dto;

import java.util.List;

/**
 * The caller's identity and effective grants.
 */
public record PrincipalScopes(String name, String kind, boolean superuser, List<String> scopes, String summary) {
}
