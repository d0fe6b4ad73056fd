package com.wayfarer.security.scope;

import com.wayfarer.security.Principal;
import com.wayfarer.security.ResourceNotFoundException;
import com.wayfarer.security.UnauthenticatedException;
import java.util.Map;
import java.util.Optional;

/**
 * Computes which rows of a module a principal may see or mutate.
 * <p>
 * Resource models call this when assembling their base query, in addition to the access
 * gate, never instead of it. Administrators are never narrowed; roles without a rule on a
 * module get the unrestricted predicate, so coarse permission alone governs them.
 * Evaluation is a pure function of {@code (module, principal)}.
 * <p>
 * Compared values go through the policy's {@link ScopeValueBinding} before the predicate is
 * handed out, so a query filter and {@link #requireVisible} agree on every row.
 */
public class RowScopingPolicy {

    private final ScopeRuleSet rules;
    private final ScopeValueBinding binding;

    public RowScopingPolicy(ScopeRuleSet rules) {
        this(rules, ScopeValueBinding.asIs());
    }

    public RowScopingPolicy(ScopeRuleSet rules, ScopeValueBinding binding) {
        if (rules == null) {
            throw new IllegalArgumentException("rules must not be null");
        }
        if (binding == null) {
            throw new IllegalArgumentException("binding must not be null");
        }
        this.rules = rules;
        this.binding = binding;
    }

    /**
     * The predicate the caller must apply verbatim to its query.
     *
     * @throws UnauthenticatedException if principal is null
     */
    public ScopePredicate scopeFilter(String module, Principal principal) {
        if (principal == null) {
            throw new UnauthenticatedException();
        }
        if (module == null || module.isBlank()) {
            throw new IllegalArgumentException("module must not be null or blank");
        }
        if (principal.isAdmin()) {
            return ScopePredicate.unrestricted();
        }
        return rules.find(module, principal.role())
                .map(rule -> rule.apply(principal).bindValues(binding))
                .orElse(ScopePredicate.unrestricted());
    }

    /**
     * Precondition for reads by id and for mutations: returns the row only if it exists
     * and is in scope.
     *
     * @param row the looked-up target row, empty if absent
     * @throws ResourceNotFoundException if the row is absent or out of scope; both cases
     *                                   are reported identically
     */
    public <T extends Map<String, ?>> T requireVisible(
            String module, Principal principal, String id, Optional<T> row) {
        ScopePredicate predicate = scopeFilter(module, principal);
        return row.filter(predicate::matches)
                .orElseThrow(() -> new ResourceNotFoundException(module, id));
    }
}
