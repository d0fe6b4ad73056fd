package com.wayfarer.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.wayfarer.security.Action;
import com.wayfarer.security.Modules;
import com.wayfarer.security.PermissionMatrix;
import com.wayfarer.security.PolicyUnavailableException;
import com.wayfarer.security.Roles;
import com.wayfarer.security.testing.TestPrincipals;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Runs the permission migrations against an in-memory H2 database and reads them back through
 * {@link JdbcPermissionStore}.
 */
@DisplayName("JdbcPermissionStore")
class JdbcPermissionStoreTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcPermissionStore store;

    @BeforeEach
    void setUp() {
        DataSource dataSource = freshDatabase();
        Flyway.configure()
                .dataSource(dataSource)
                .locations("classpath:db/migration/policy")
                .load()
                .migrate();
        jdbcTemplate = new JdbcTemplate(dataSource);
        store = new JdbcPermissionStore(jdbcTemplate);
    }

    @Nested
    @DisplayName("seeded matrix")
    class Seed {

        @Test
        @DisplayName("provisions every module and action")
        void permissionsProvisioned() {
            Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM permissions", Integer.class);

            assertThat(count).isEqualTo(Modules.SEEDED.size() * Action.values().length);
        }

        @Test
        @DisplayName("answers exactly like the in-memory fixture")
        void matchesFixture() {
            PermissionMatrix expected = TestPrincipals.seededMatrix();
            List<String> roles = new ArrayList<>(Roles.STAFF_AND_CUSTOMER);
            roles.add(Roles.ADMIN);

            for (String role : roles) {
                assertThat(store.modulesWithAnyGrant(role))
                        .as("modules of %s", role)
                        .containsExactlyInAnyOrderElementsOf(expected.modulesFor(role));
                for (String module : Modules.SEEDED) {
                    for (Action action : Action.values()) {
                        assertThat(store.isGranted(role, module, action))
                                .as("%s %s:%s", role, module, action)
                                .isEqualTo(expected.isGranted(role, module, action));
                    }
                    assertThat(store.actionsFor(role, module))
                            .as("actions of %s on %s", role, module)
                            .containsExactlyInAnyOrderElementsOf(expected.actionsFor(role, module));
                }
            }
        }

        @Test
        @DisplayName("gives the administrator no rows")
        void noAdminRows() {
            assertThat(store.modulesWithAnyGrant(Roles.ADMIN)).isEmpty();
        }
    }

    @Nested
    @DisplayName("grant changes")
    class GrantChanges {

        @Test
        @DisplayName("a revoked row stops granting on the next call")
        void revoke() {
            assertThat(store.isGranted(Roles.AGENT, Modules.LEADS, Action.UPDATE)).isTrue();

            jdbcTemplate.update(
                    "UPDATE role_permissions SET granted = FALSE WHERE role = ? AND permission_id ="
                            + " (SELECT id FROM permissions WHERE module = ? AND action = ?)",
                    Roles.AGENT,
                    Modules.LEADS,
                    "update");

            assertThat(store.isGranted(Roles.AGENT, Modules.LEADS, Action.UPDATE)).isFalse();
            assertThat(store.isGranted(Roles.AGENT, Modules.LEADS, Action.READ)).isTrue();
        }

        @Test
        @DisplayName("a module whose rows are all revoked disappears from the module list")
        void revokeModule() {
            assertThat(store.modulesWithAnyGrant(Roles.CUSTOMER)).contains(Modules.NOTIFICATIONS);

            jdbcTemplate.update(
                    "UPDATE role_permissions SET granted = FALSE WHERE role = ? AND permission_id IN"
                            + " (SELECT id FROM permissions WHERE module = ?)",
                    Roles.CUSTOMER,
                    Modules.NOTIFICATIONS);

            assertThat(store.modulesWithAnyGrant(Roles.CUSTOMER)).doesNotContain(Modules.NOTIFICATIONS);
            assertThat(store.actionsFor(Roles.CUSTOMER, Modules.NOTIFICATIONS)).isEmpty();
        }

        @Test
        @DisplayName("a manage row implies the other actions")
        void manage() {
            assertThat(store.isGranted(Roles.FINANCE, Modules.INVOICES, Action.DELETE)).isTrue();
            assertThat(store.actionsFor(Roles.FINANCE, Modules.INVOICES)).containsExactlyInAnyOrder(Action.values());
        }
    }

    @Test
    @DisplayName("reports a missing schema as PolicyUnavailableException")
    void missingSchema() {
        var empty = new JdbcPermissionStore(new JdbcTemplate(freshDatabase()));

        assertThatThrownBy(() -> empty.isGranted(Roles.AGENT, Modules.LEADS, Action.READ))
                .isInstanceOf(PolicyUnavailableException.class)
                .hasMessage(PolicyUnavailableException.DEFAULT_MESSAGE);
        assertThatThrownBy(() -> empty.modulesWithAnyGrant(Roles.AGENT))
                .isInstanceOf(PolicyUnavailableException.class);
    }

    private static DataSource freshDatabase() {
        return new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
    }
}
