package com.github.dimitryivaniuta.scoped.core.authz;

import java.util.Locale;

/**
 * Allow/deny outcome of a scope check.
 *
 * @param granted       whether the request may proceed
 * @param requiredScope scope that was checked, {@code null} when none was required
 * @param basis         rule that produced the outcome
 */
public record ScopeDecision(boolean granted, String requiredScope, Basis basis) {

    /** Rule that decided. */
    public enum Basis {
        NO_SCOPE_REQUIRED(true),
        LEGACY_UNRESTRICTED(true),
        SUPERUSER(true),
        SCOPE_GRANTED(true),
        NO_PRINCIPAL(false),
        NO_GRANTS(false),
        SCOPE_MISSING(false),
        MISCONFIGURED_ENDPOINT(false);

        private final boolean granting;

        Basis(final boolean granting) {
            this.granting = granting;
        }

        public boolean isGranting() {
            return granting;
        }
    }

    public static ScopeDecision of(final RequiredScope required, final Basis basis) {
        return new ScopeDecision(basis.isGranting(), required.scope(), basis);
    }

    /**
     * Diagnostic reason for a denial: the missing scope name, or the rule when no scope
     * could be computed. {@code null} for granted decisions.
     */
    public String reason() {
        if (granted) return null;
        return requiredScope != null ? requiredScope : basis.name().toLowerCase(Locale.ROOT);
    }
}
