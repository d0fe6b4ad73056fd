package com.wayfarer.security.scope;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders a {@link ScopePredicate} into a parameterized SQL {@code WHERE} fragment.
 * <p>
 * Values always travel as bind parameters; column names are validated by
 * {@link ScopePredicate.ColumnEquals}, so the rendered text never contains caller input.
 */
public final class SqlScopeRenderer {

    private SqlScopeRenderer() {
        // utility class
    }

    /** Renders with unqualified column names. */
    public static SqlFragment render(ScopePredicate predicate) {
        return render(predicate, null);
    }

    /**
     * Renders with columns qualified by {@code tableAlias} (e.g. {@code l.agent_id}).
     *
     * @param tableAlias alias to prefix columns with, or null for none
     */
    public static SqlFragment render(ScopePredicate predicate, String tableAlias) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate must not be null");
        }
        String prefix = tableAlias == null || tableAlias.isBlank() ? "" : tableAlias + ".";
        List<Object> params = new ArrayList<>();
        String sql = append(predicate, prefix, params);
        return new SqlFragment(sql, params);
    }

    private static String append(ScopePredicate predicate, String prefix, List<Object> params) {
        if (predicate.isUnrestricted()) {
            return "1 = 1";
        }
        if (predicate.isNone()) {
            return "1 = 0";
        }
        if (predicate instanceof ScopePredicate.ColumnEquals eq) {
            params.add(eq.value());
            return prefix + eq.column() + " = ?";
        }
        if (predicate instanceof ScopePredicate.AnyOf any) {
            return join(any.terms(), " OR ", prefix, params);
        }
        if (predicate instanceof ScopePredicate.AllOf all) {
            return join(all.terms(), " AND ", prefix, params);
        }
        throw new IllegalArgumentException("cannot render predicate type " + predicate.getClass().getName());
    }

    private static String join(List<ScopePredicate> terms, String operator, String prefix, List<Object> params) {
        StringJoiner joiner = new StringJoiner(operator, "(", ")");
        for (ScopePredicate term : terms) {
            joiner.add(append(term, prefix, params));
        }
        return joiner.toString();
    }
}
