package com.wayfarer.security.scope;

import com.wayfarer.security.Modules;
import com.wayfarer.security.Roles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScopeRuleSet")
class ScopeRuleSetTest {

    @Test
    @DisplayName("rejects a second rule for the same module and role")
    void duplicate() {
        var builder = ScopeRuleSet.builder().rule(Modules.LEADS, ScopeRule.ownedBy("agent_id"), Roles.AGENT);

        assertThatThrownBy(() -> builder.rule(Modules.LEADS, ScopeRule.ownedBy("created_by"), Roles.AGENT))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate scope rule");
    }

    @Test
    @DisplayName("rejects rules for the administrator")
    void admin() {
        assertThatThrownBy(() -> ScopeRuleSet.builder().rule(Modules.LEADS, ScopeRule.ownedBy("agent_id"), Roles.ADMIN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("same rule may serve several roles")
    void sharedRule() {
        var rules = ScopeRuleSet.builder()
                .rule(Modules.LEADS, ScopeRule.ownedBy("agent_id"), Roles.AGENT, Roles.SALES)
                .build();

        assertThat(rules.find(Modules.LEADS, Roles.AGENT)).isPresent();
        assertThat(rules.find(Modules.LEADS, Roles.SALES)).isPresent();
        assertThat(rules.find(Modules.LEADS, Roles.MANAGER)).isEmpty();
        assertThat(rules.find(Modules.CUSTOMERS, Roles.AGENT)).isEmpty();
    }

    @Test
    @DisplayName("empty set has no rules")
    void empty() {
        assertThat(ScopeRuleSet.empty().find(Modules.LEADS, Roles.AGENT)).isEmpty();
    }
}
