package com.wayfarer.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of the permission matrix, indexed {@code role -> module -> actions}.
 * <p>
 * Lookups are hash lookups, so checking a grant costs the same regardless of how many
 * rows the matrix holds. Rows with {@code granted = false} and missing rows are
 * indistinguishable: both deny.
 */
public final class PermissionMatrix {

    private static final PermissionMatrix EMPTY = new PermissionMatrix(Map.of(), List.of());

    private final Map<String, Map<String, Set<Action>>> index;
    private final List<PermissionGrant> grants;

    private PermissionMatrix(Map<String, Map<String, Set<Action>>> index, List<PermissionGrant> grants) {
        this.index = index;
        this.grants = grants;
    }

    /** A matrix with no grants; every non-admin check against it fails. */
    public static PermissionMatrix empty() {
        return EMPTY;
    }

    /** Builds a snapshot from matrix rows. Denied rows are kept in {@link #grants()} but never indexed. */
    public static PermissionMatrix of(Collection<PermissionGrant> rows) {
        Map<String, Map<String, EnumSet<Action>>> building = new HashMap<>();
        for (PermissionGrant row : rows) {
            if (!row.granted()) {
                continue;
            }
            building.computeIfAbsent(row.role(), r -> new HashMap<>())
                    .computeIfAbsent(row.module(), m -> EnumSet.noneOf(Action.class))
                    .add(row.action());
        }

        Map<String, Map<String, Set<Action>>> frozen = new HashMap<>();
        building.forEach((role, modules) -> {
            Map<String, Set<Action>> frozenModules = new HashMap<>();
            modules.forEach((module, actions) -> frozenModules.put(module, Set.copyOf(actions)));
            frozen.put(role, Map.copyOf(frozenModules));
        });
        return new PermissionMatrix(Map.copyOf(frozen), List.copyOf(rows));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Whether {@code role} holds {@code action} on {@code module}, directly or through MANAGE. */
    public boolean isGranted(String role, String module, Action action) {
        Set<Action> actions = index.getOrDefault(role, Map.of()).get(module);
        if (actions == null) {
            return false;
        }
        return actions.contains(action) || actions.contains(Action.MANAGE);
    }

    /** Modules on which {@code role} holds at least one action. */
    public Set<String> modulesFor(String role) {
        return index.getOrDefault(role, Map.of()).keySet();
    }

    /** Effective actions of {@code role} on {@code module}; MANAGE expands to every action. */
    public Set<Action> actionsFor(String role, String module) {
        Set<Action> actions = index.getOrDefault(role, Map.of()).get(module);
        if (actions == null) {
            return Set.of();
        }
        if (actions.contains(Action.MANAGE)) {
            return Set.copyOf(EnumSet.allOf(Action.class));
        }
        return actions;
    }

    /** The rows this snapshot was built from. */
    public List<PermissionGrant> grants() {
        return grants;
    }

    /** Number of rows in the snapshot. */
    public int size() {
        return grants.size();
    }

    /** Fluent builder, mostly for seeds and tests. */
    public static final class Builder {

        private final List<PermissionGrant> rows = new ArrayList<>();

        private Builder() {
        }

        /** Grants each of {@code actions} on {@code module} to {@code role}. */
        public Builder grant(String role, String module, Action... actions) {
            for (Action action : actions) {
                rows.add(PermissionGrant.allow(role, module, action));
            }
            return this;
        }

        /** Adds an explicit row, granted or not. */
        public Builder row(PermissionGrant grant) {
            rows.add(grant);
            return this;
        }

        public PermissionMatrix build() {
            return PermissionMatrix.of(rows);
        }
    }
}
