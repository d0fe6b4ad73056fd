package com.wayfarer.security.scope;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Converts a value compared by a {@link ScopePredicate} to the type of the column it is
 * compared with. An empty result means the value cannot occur in that column.
 */
@FunctionalInterface
public interface ScopeValueBinding {

    Pattern INTEGER = Pattern.compile("-?\\d{1,18}");

    Optional<Object> bind(Object value);

    /** Values are compared as they are. */
    static ScopeValueBinding asIs() {
        return Optional::of;
    }

    /**
     * For integer ownership columns: integral numbers and decimal-digit strings become
     * {@code Long} ({@code "07"} binds as {@code 7}); anything else binds to nothing.
     */
    static ScopeValueBinding integerIds() {
        return value -> {
            if (value instanceof Long || value instanceof Integer || value instanceof Short) {
                return Optional.of(((Number) value).longValue());
            }
            if (value instanceof String text && INTEGER.matcher(text.strip()).matches()) {
                return Optional.of(Long.valueOf(text.strip()));
            }
            return Optional.empty();
        };
    }
}
