package com.wayfarer.security.scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Composable boolean condition over a row, produced by a {@link ScopeRule}.
 * <p>
 * Kept as data rather than as an opaque lambda so the same predicate can be evaluated
 * against an in-memory row ({@link #matches(Map)}) or rendered into a query
 * ({@link SqlScopeRenderer}). Equality compares string forms; callers whose columns are
 * typed bind the values first ({@link #bindValues(ScopeValueBinding)}) so both evaluations see
 * the same value.
 */
public interface ScopePredicate {

    /** Whether the row satisfies this predicate. */
    boolean matches(Map<String, ?> row);

    /** Whether this predicate admits every row. */
    default boolean isUnrestricted() {
        return false;
    }

    /** Whether this predicate admits no row. */
    default boolean isNone() {
        return false;
    }

    /**
     * This predicate with every compared value passed through {@code binding}. A comparison
     * whose value does not bind can never hold and becomes {@link #none()}.
     */
    ScopePredicate bindValues(ScopeValueBinding binding);

    default ScopePredicate and(ScopePredicate other) {
        return allOf(this, other);
    }

    default ScopePredicate or(ScopePredicate other) {
        return anyOf(this, other);
    }

    /** The predicate that admits every row. */
    static ScopePredicate unrestricted() {
        return Unrestricted.INSTANCE;
    }

    /** The predicate that admits no row. */
    static ScopePredicate none() {
        return None.INSTANCE;
    }

    /** {@code column = value}. */
    static ScopePredicate columnEquals(String column, Object value) {
        return new ColumnEquals(column, value);
    }

    /**
     * Disjunction; collapses to {@link #unrestricted()} if any term is unrestricted. Terms that
     * admit nothing are dropped.
     */
    static ScopePredicate anyOf(ScopePredicate... terms) {
        if (terms == null || terms.length == 0) {
            throw new IllegalArgumentException("anyOf requires at least one term");
        }
        List<ScopePredicate> flat = new ArrayList<>();
        for (ScopePredicate term : terms) {
            if (term == null) {
                throw new IllegalArgumentException("terms must not contain null");
            }
            if (term.isUnrestricted()) {
                return unrestricted();
            }
            if (term.isNone()) {
                continue;
            }
            if (term instanceof AnyOf nested) {
                flat.addAll(nested.terms());
            } else {
                flat.add(term);
            }
        }
        if (flat.isEmpty()) {
            return none();
        }
        return flat.size() == 1 ? flat.get(0) : new AnyOf(flat);
    }

    /**
     * Conjunction; unrestricted terms are dropped, an all-unrestricted conjunction is
     * unrestricted, and a term that admits nothing makes the whole conjunction admit nothing.
     */
    static ScopePredicate allOf(ScopePredicate... terms) {
        if (terms == null || terms.length == 0) {
            throw new IllegalArgumentException("allOf requires at least one term");
        }
        List<ScopePredicate> flat = new ArrayList<>();
        for (ScopePredicate term : terms) {
            if (term == null) {
                throw new IllegalArgumentException("terms must not contain null");
            }
            if (term.isUnrestricted()) {
                continue;
            }
            if (term.isNone()) {
                return none();
            }
            if (term instanceof AllOf nested) {
                flat.addAll(nested.terms());
            } else {
                flat.add(term);
            }
        }
        if (flat.isEmpty()) {
            return unrestricted();
        }
        return flat.size() == 1 ? flat.get(0) : new AllOf(flat);
    }

    /** Admits every row. */
    enum Unrestricted implements ScopePredicate {
        INSTANCE;

        @Override
        public boolean matches(Map<String, ?> row) {
            return true;
        }

        @Override
        public boolean isUnrestricted() {
            return true;
        }

        @Override
        public ScopePredicate bindValues(ScopeValueBinding binding) {
            return this;
        }

        @Override
        public String toString() {
            return "unrestricted";
        }
    }

    /** Admits no row. */
    enum None implements ScopePredicate {
        INSTANCE;

        @Override
        public boolean matches(Map<String, ?> row) {
            return false;
        }

        @Override
        public boolean isNone() {
            return true;
        }

        @Override
        public ScopePredicate bindValues(ScopeValueBinding binding) {
            return this;
        }

        @Override
        public String toString() {
            return "none";
        }
    }

    /**
     * Ownership-column equality.
     *
     * @param column unqualified column name, letters, digits and underscores only
     * @param value  value the column must equal (typically the principal id)
     */
    record ColumnEquals(String column, Object value) implements ScopePredicate {

        private static final Pattern COLUMN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

        public ColumnEquals {
            if (column == null || !COLUMN.matcher(column).matches()) {
                throw new IllegalArgumentException("invalid column name: " + column);
            }
            if (value == null) {
                throw new IllegalArgumentException("value must not be null");
            }
        }

        @Override
        public boolean matches(Map<String, ?> row) {
            if (row == null) {
                return false;
            }
            Object actual = row.get(column);
            return actual != null && String.valueOf(actual).equals(String.valueOf(value));
        }

        @Override
        public ScopePredicate bindValues(ScopeValueBinding binding) {
            return binding.bind(value)
                    .<ScopePredicate>map(bound -> new ColumnEquals(column, bound))
                    .orElse(none());
        }

        @Override
        public String toString() {
            return column + " = " + value;
        }
    }

    /** Disjunction of two or more terms. */
    record AnyOf(List<ScopePredicate> terms) implements ScopePredicate {

        public AnyOf {
            terms = List.copyOf(terms);
        }

        @Override
        public boolean matches(Map<String, ?> row) {
            return terms.stream().anyMatch(term -> term.matches(row));
        }

        @Override
        public ScopePredicate bindValues(ScopeValueBinding binding) {
            return anyOf(terms.stream().map(term -> term.bindValues(binding)).toArray(ScopePredicate[]::new));
        }
    }

    /** Conjunction of two or more terms. */
    record AllOf(List<ScopePredicate> terms) implements ScopePredicate {

        public AllOf {
            terms = List.copyOf(terms);
        }

        @Override
        public boolean matches(Map<String, ?> row) {
            return terms.stream().allMatch(term -> term.matches(row));
        }

        @Override
        public ScopePredicate bindValues(ScopeValueBinding binding) {
            return allOf(terms.stream().map(term -> term.bindValues(binding)).toArray(ScopePredicate[]::new));
        }
    }
}
