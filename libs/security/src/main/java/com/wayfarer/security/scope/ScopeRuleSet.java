package com.wayfarer.security.scope;

import com.wayfarer.security.Roles;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of {@link ScopeRule}s keyed by {@code (module, role)}.
 * <p>
 * Registering a second rule for the same pair is a configuration error and fails at build
 * time instead of letting the later rule silently win.
 */
public final class ScopeRuleSet {

    private final Map<String, Map<String, ScopeRule>> rules;

    private ScopeRuleSet(Map<String, Map<String, ScopeRule>> rules) {
        this.rules = rules;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A rule set with no rules: every role is unrestricted on every module. */
    public static ScopeRuleSet empty() {
        return new ScopeRuleSet(Map.of());
    }

    /** The rule registered for {@code (module, role)}, if any. */
    public Optional<ScopeRule> find(String module, String role) {
        return Optional.ofNullable(rules.getOrDefault(module, Map.of()).get(role));
    }

    public static final class Builder {

        private final Map<String, Map<String, ScopeRule>> rules = new HashMap<>();

        private Builder() {
        }

        /**
         * Registers {@code rule} on {@code module} for each of {@code roles}.
         *
         * @throws IllegalArgumentException if a pair already has a rule, or for the admin role
         */
        public Builder rule(String module, ScopeRule rule, String... roles) {
            if (module == null || module.isBlank()) {
                throw new IllegalArgumentException("module must not be null or blank");
            }
            if (rule == null) {
                throw new IllegalArgumentException("rule must not be null");
            }
            if (roles.length == 0) {
                throw new IllegalArgumentException("at least one role is required");
            }
            Map<String, ScopeRule> byRole = rules.computeIfAbsent(module, m -> new HashMap<>());
            for (String role : roles) {
                if (Roles.isAdmin(role)) {
                    throw new IllegalArgumentException("admin is never scoped");
                }
                if (byRole.putIfAbsent(role, rule) != null) {
                    throw new IllegalArgumentException(
                            "duplicate scope rule for module '%s', role '%s'".formatted(module, role));
                }
            }
            return this;
        }

        public ScopeRuleSet build() {
            Map<String, Map<String, ScopeRule>> frozen = new HashMap<>();
            rules.forEach((module, byRole) -> frozen.put(module, Map.copyOf(byRole)));
            return new ScopeRuleSet(Map.copyOf(frozen));
        }
    }
}
