package com.wayfarer.crm.infrastructure.persistence;

import com.wayfarer.security.PolicyInitializer;
import com.wayfarer.security.Principal;
import com.wayfarer.security.ResourceNotFoundException;
import com.wayfarer.security.scope.RowScopingPolicy;
import com.wayfarer.security.scope.SqlFragment;
import com.wayfarer.security.scope.SqlScopeRenderer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Base for resource tables whose rows are narrowed by the caller's role.
 *
 * <p>Every statement, reads and writes alike, carries the {@link RowScopingPolicy} predicate for
 * the repository's module. Reads by id and mutations first load the target through that
 * predicate; a row that is absent and a row that is out of scope both end in
 * {@link ResourceNotFoundException}.
 *
 * <p>Ownership columns are {@code BIGINT}; the policy handed in must bind scope values as
 * integer ids ({@link com.wayfarer.security.scope.ScopeValueBinding#integerIds()}).
 *
 * @param <T> row type
 */
public abstract class ScopedJdbcRepository<T> {

    private static final Logger log = LoggerFactory.getLogger(ScopedJdbcRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final RowScopingPolicy scopingPolicy;
    private final PolicyInitializer initializer;
    private final String module;
    private final String table;

    protected ScopedJdbcRepository(
            JdbcTemplate jdbcTemplate,
            RowScopingPolicy scopingPolicy,
            PolicyInitializer initializer,
            String module,
            String table) {
        this.jdbcTemplate = jdbcTemplate;
        this.scopingPolicy = scopingPolicy;
        this.initializer = initializer;
        this.module = module;
        this.table = table;
    }

    /** Maps one column map (keys are case-insensitive) to the row type. */
    protected abstract T map(Map<String, Object> row);

    /** The module whose scope rules apply. */
    public String module() {
        return module;
    }

    /** Rows visible to {@code principal}, ordered by id. May be empty. */
    public List<T> findAll(Principal principal) {
        SqlFragment scope = scope(principal);
        String sql = "SELECT * FROM " + table + " WHERE " + scope.sql() + " ORDER BY id";
        return jdbcTemplate.queryForList(sql, scope.params().toArray()).stream()
                .map(this::map)
                .toList();
    }

    /**
     * The row with {@code id} if visible to {@code principal}.
     *
     * @throws ResourceNotFoundException if the row is absent or out of scope
     */
    public T findVisible(Principal principal, long id) {
        return map(requireVisibleRow(principal, id));
    }

    /**
     * Applies {@code changes} to a visible row and returns it re-read.
     *
     * @param changes column to value, in SET order; column names come from subclasses, never callers
     * @throws ResourceNotFoundException if the row is absent or out of scope
     */
    protected T updateVisible(Principal principal, long id, Map<String, Object> changes) {
        requireVisibleRow(principal, id);

        SqlFragment scope = scope(principal);
        StringJoiner assignments = new StringJoiner(", ");
        List<Object> params = new ArrayList<>();
        changes.forEach((column, value) -> {
            assignments.add(column + " = ?");
            params.add(value);
        });
        assignments.add("updated_at = CURRENT_TIMESTAMP");
        params.add(id);
        params.addAll(scope.params());

        int updated = jdbcTemplate.update(
                "UPDATE " + table + " SET " + assignments + " WHERE id = ? AND " + scope.sql(),
                params.toArray());
        if (updated == 0) {
            // deleted between the precondition read and the write
            throw new ResourceNotFoundException(module, String.valueOf(id));
        }
        log.info("Updated {} {} columns {} by principal {}", module, id, changes.keySet(), principal.id());
        return findVisible(principal, id);
    }

    /**
     * Deletes a visible row.
     *
     * @throws ResourceNotFoundException if the row is absent or out of scope
     */
    public void deleteVisible(Principal principal, long id) {
        requireVisibleRow(principal, id);

        SqlFragment scope = scope(principal);
        List<Object> params = new ArrayList<>();
        params.add(id);
        params.addAll(scope.params());
        int deleted = jdbcTemplate.update(
                "DELETE FROM " + table + " WHERE id = ? AND " + scope.sql(), params.toArray());
        if (deleted == 0) {
            throw new ResourceNotFoundException(module, String.valueOf(id));
        }
        log.info("Deleted {} {} by principal {}", module, id, principal.id());
    }

    /** Convenience for single-column updates. */
    protected static Map<String, Object> set(String column, Object value) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(column, value);
        return changes;
    }

    private Map<String, Object> requireVisibleRow(Principal principal, long id) {
        SqlFragment scope = scope(principal);
        List<Object> params = new ArrayList<>();
        params.add(id);
        params.addAll(scope.params());
        Optional<Map<String, Object>> row = jdbcTemplate
                .queryForList("SELECT * FROM " + table + " WHERE id = ? AND " + scope.sql(), params.toArray())
                .stream()
                .findFirst();
        return scopingPolicy.requireVisible(module, principal, String.valueOf(id), row);
    }

    private SqlFragment scope(Principal principal) {
        // the resource tables are provisioned by the same migration as the permission matrix
        initializer.awaitReady();
        return SqlScopeRenderer.render(scopingPolicy.scopeFilter(module, principal));
    }
}
