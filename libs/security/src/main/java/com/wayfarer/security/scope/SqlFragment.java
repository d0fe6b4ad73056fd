package com.wayfarer.security.scope;

import java.util.List;

/**
 * A parameterized SQL boolean expression.
 *
 * @param sql    expression text with {@code ?} placeholders
 * @param params positional parameters, in placeholder order
 */
public record SqlFragment(String sql, List<Object> params) {

    public SqlFragment {
        params = List.copyOf(params);
    }

    public Object[] paramArray() {
        return params.toArray();
    }
}
