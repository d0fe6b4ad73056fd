package com.wayfarer.database;

import com.wayfarer.security.Action;
import com.wayfarer.security.PermissionStore;
import com.wayfarer.security.PolicyUnavailableException;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link PermissionStore} reading the {@code permissions} / {@code role_permissions} tables.
 *
 * <p>Every call runs one query against the live tables, so grant changes apply to the next
 * request. A missing table, a lost connection or any other {@link DataAccessException} is
 * reported as {@link PolicyUnavailableException}; the caller never sees an empty answer for
 * a store it could not read.
 */
public class JdbcPermissionStore implements PermissionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcPermissionStore.class);

    private static final String GRANTED_JOIN =
            "FROM role_permissions rp JOIN permissions p ON p.id = rp.permission_id ";

    private static final String IS_GRANTED_SQL =
            "SELECT COUNT(*) "
                    + GRANTED_JOIN
                    + "WHERE rp.role = ? AND p.module = ? AND rp.granted = TRUE AND p.action IN (?, ?)";

    private static final String MODULES_SQL =
            "SELECT DISTINCT p.module " + GRANTED_JOIN + "WHERE rp.role = ? AND rp.granted = TRUE";

    private static final String ACTIONS_SQL =
            "SELECT p.action " + GRANTED_JOIN + "WHERE rp.role = ? AND p.module = ? AND rp.granted = TRUE";

    private final JdbcTemplate jdbcTemplate;

    public JdbcPermissionStore(JdbcTemplate jdbcTemplate) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("jdbcTemplate must not be null");
        }
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean isGranted(String role, String module, Action action) {
        Integer count =
                query(
                        () ->
                                jdbcTemplate.queryForObject(
                                        IS_GRANTED_SQL,
                                        Integer.class,
                                        role,
                                        module,
                                        action.value(),
                                        Action.MANAGE.value()));
        return count != null && count > 0;
    }

    @Override
    public Set<String> modulesWithAnyGrant(String role) {
        List<String> modules = query(() -> jdbcTemplate.queryForList(MODULES_SQL, String.class, role));
        return new LinkedHashSet<>(modules);
    }

    @Override
    public Set<Action> actionsFor(String role, String module) {
        List<String> stored =
                query(() -> jdbcTemplate.queryForList(ACTIONS_SQL, String.class, role, module));
        Set<Action> actions = EnumSet.noneOf(Action.class);
        for (String value : stored) {
            toAction(value).ifPresent(actions::add);
        }
        if (actions.contains(Action.MANAGE)) {
            return EnumSet.allOf(Action.class);
        }
        return actions;
    }

    private static Optional<Action> toAction(String value) {
        Optional<Action> action = Action.fromString(value);
        if (action.isEmpty()) {
            log.warn("Ignoring permission row with unknown action '{}'", value);
        }
        return action;
    }

    private static <T> T query(Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Permission store query failed", e);
            throw new PolicyUnavailableException(PolicyUnavailableException.DEFAULT_MESSAGE, e);
        }
    }
}
