package com.wayfarer.security.scope;

import com.wayfarer.security.Modules;
import com.wayfarer.security.ResourceNotFoundException;
import com.wayfarer.security.UnauthenticatedException;
import com.wayfarer.security.testing.TestPrincipals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Row visibility under the CRM rule table.
 */
@DisplayName("RowScopingPolicy")
class RowScopingPolicyTest {

    private final RowScopingPolicy policy = new RowScopingPolicy(CrmScopeRules.defaults());

    private static final List<Map<String, Object>> RESERVATIONS = List.of(
            Map.of("id", 1, "customer_id", 42),
            Map.of("id", 2, "customer_id", 42),
            Map.of("id", 3, "customer_id", 77));

    @Nested
    @DisplayName("scopeFilter()")
    class ScopeFilter {

        @Test
        @DisplayName("customer sees only their own reservations")
        void customerReservations() {
            var predicate = policy.scopeFilter(Modules.RESERVATIONS, TestPrincipals.customer("42"));

            assertThat(RESERVATIONS.stream().filter(predicate::matches).map(row -> row.get("id")))
                    .containsExactly(1, 2);
        }

        @Test
        @DisplayName("administrator is never narrowed")
        void adminUnrestricted() {
            for (String module : Modules.SEEDED) {
                assertThat(policy.scopeFilter(module, TestPrincipals.admin()).isUnrestricted())
                        .as(module)
                        .isTrue();
            }
        }

        @Test
        @DisplayName("roles without a rule on the module are unrestricted")
        void noRule() {
            assertThat(policy.scopeFilter(Modules.RESERVATIONS, TestPrincipals.of("5", "finance")).isUnrestricted())
                    .isTrue();
        }

        @Test
        @DisplayName("agent tickets match assigned or created rows")
        void agentTickets() {
            var predicate = policy.scopeFilter(Modules.SUPPORT_TICKETS, TestPrincipals.agent("7"));

            assertThat(predicate.matches(Map.of("assigned_to", 7, "created_by", 3, "customer_id", 9))).isTrue();
            assertThat(predicate.matches(Map.of("assigned_to", 3, "created_by", 7, "customer_id", 9))).isTrue();
            assertThat(predicate.matches(Map.of("assigned_to", 3, "created_by", 3, "customer_id", 7))).isFalse();
        }

        @Test
        @DisplayName("sales tickets match assigned rows only")
        void salesTickets() {
            var predicate = policy.scopeFilter(Modules.SUPPORT_TICKETS, TestPrincipals.sales("9"));

            assertThat(predicate.matches(Map.of("assigned_to", 9, "created_by", 1))).isTrue();
            assertThat(predicate.matches(Map.of("assigned_to", 1, "created_by", 9))).isFalse();
        }

        @Test
        @DisplayName("is a pure function of module and principal")
        void idempotent() {
            var first = policy.scopeFilter(Modules.LEADS, TestPrincipals.agent("7"));
            var second = policy.scopeFilter(Modules.LEADS, TestPrincipals.agent("7"));

            assertThat(first).isEqualTo(second);
            assertThat(SqlScopeRenderer.render(first)).isEqualTo(SqlScopeRenderer.render(second));
        }

        @Test
        @DisplayName("requires a principal")
        void unauthenticated() {
            assertThatThrownBy(() -> policy.scopeFilter(Modules.LEADS, null))
                    .isInstanceOf(UnauthenticatedException.class);
        }
    }

    @Nested
    @DisplayName("requireVisible()")
    class RequireVisible {

        @Test
        @DisplayName("returns a row inside the scope")
        void inScope() {
            Map<String, Object> lead = Map.of("id", 11, "agent_id", 7);

            assertThat(policy.requireVisible(Modules.LEADS, TestPrincipals.agent("7"), "11", Optional.of(lead)))
                    .isSameAs(lead);
        }

        @Test
        @DisplayName("reports an out-of-scope row exactly like a missing one")
        void outOfScopeLooksMissing() {
            Map<String, Object> lead = Map.of("id", 12, "agent_id", 8);

            var hidden = catchNotFound(() -> policy.requireVisible(
                    Modules.LEADS, TestPrincipals.agent("7"), "12", Optional.of(lead)));
            var missing = catchNotFound(() -> policy.requireVisible(
                    Modules.LEADS, TestPrincipals.agent("7"), "12", Optional.<Map<String, Object>>empty()));

            assertThat(hidden.getMessage()).isEqualTo(missing.getMessage()).isEqualTo("leads record '12' not found");
            assertThat(hidden.reason()).isEqualTo(missing.reason());
        }

        @Test
        @DisplayName("agrees with the rendered filter when ids are bound as integers")
        void integerIdsAgreeWithFilter() {
            var typed = new RowScopingPolicy(CrmScopeRules.defaults(), ScopeValueBinding.integerIds());
            Map<String, Object> lead = Map.of("id", 11L, "agent_id", 7L);

            var filter = typed.scopeFilter(Modules.LEADS, TestPrincipals.agent("07"));

            assertThat(SqlScopeRenderer.render(filter).params()).containsExactly(7L);
            assertThat(typed.requireVisible(Modules.LEADS, TestPrincipals.agent("07"), "11", Optional.of(lead)))
                    .isSameAs(lead);
        }

        @Test
        @DisplayName("a principal id that cannot be an integer id sees nothing")
        void nonIntegerIdSeesNothing() {
            var typed = new RowScopingPolicy(CrmScopeRules.defaults(), ScopeValueBinding.integerIds());
            Map<String, Object> lead = Map.of("id", 11L, "agent_id", 7L);

            assertThat(typed.scopeFilter(Modules.LEADS, TestPrincipals.agent("u-7")).isNone()).isTrue();
            assertThatThrownBy(() -> typed.requireVisible(
                    Modules.LEADS, TestPrincipals.agent("u-7"), "11", Optional.of(lead)))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        private ResourceNotFoundException catchNotFound(Runnable call) {
            try {
                call.run();
            } catch (ResourceNotFoundException e) {
                return e;
            }
            throw new AssertionError("expected ResourceNotFoundException");
        }
    }
}
