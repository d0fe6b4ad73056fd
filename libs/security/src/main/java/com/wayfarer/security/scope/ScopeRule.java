package com.wayfarer.security.scope;

import com.wayfarer.security.Principal;

/**
 * Narrows a module's rows for one role, given the requesting principal.
 * Must be a pure function of the principal.
 */
@FunctionalInterface
public interface ScopeRule {

    ScopePredicate apply(Principal principal);

    /** Rows whose {@code column} holds the principal's id. */
    static ScopeRule ownedBy(String column) {
        return principal -> ScopePredicate.columnEquals(column, principal.id());
    }

    /** Rows where any of {@code columns} holds the principal's id. */
    static ScopeRule ownedByAny(String... columns) {
        if (columns.length == 0) {
            throw new IllegalArgumentException("at least one column is required");
        }
        return principal -> {
            ScopePredicate[] terms = new ScopePredicate[columns.length];
            for (int i = 0; i < columns.length; i++) {
                terms[i] = ScopePredicate.columnEquals(columns[i], principal.id());
            }
            return ScopePredicate.anyOf(terms);
        };
    }
}
