package com.wayfarer.security.scope;

import com.wayfarer.security.Modules;
import com.wayfarer.security.Roles;

/**
 * Row-ownership rules of the CRM resources, declared once for every resource model.
 */
public final class CrmScopeRules {

    private CrmScopeRules() {
        // factory
    }

    public static ScopeRuleSet defaults() {
        return ScopeRuleSet.builder()
                // customers log in as themselves; agents work their assigned book
                .rule(Modules.CUSTOMERS, ScopeRule.ownedBy("id"), Roles.CUSTOMER)
                .rule(Modules.CUSTOMERS, ScopeRule.ownedBy("assigned_staff_id"), Roles.AGENT)

                .rule(Modules.LEADS, ScopeRule.ownedBy("agent_id"), Roles.AGENT, Roles.SALES)
                .rule(Modules.SALES_CASES, ScopeRule.ownedByAny("assigned_to", "created_by"),
                        Roles.AGENT, Roles.SALES)

                .rule(Modules.RESERVATIONS, ScopeRule.ownedBy("customer_id"), Roles.CUSTOMER)
                .rule(Modules.PAYMENTS, ScopeRule.ownedBy("customer_id"), Roles.CUSTOMER)
                .rule(Modules.INVOICES, ScopeRule.ownedBy("customer_id"), Roles.CUSTOMER)

                .rule(Modules.SUPPORT_TICKETS, ScopeRule.ownedBy("customer_id"), Roles.CUSTOMER)
                .rule(Modules.SUPPORT_TICKETS, ScopeRule.ownedByAny("assigned_to", "created_by"), Roles.AGENT)
                .rule(Modules.SUPPORT_TICKETS, ScopeRule.ownedBy("assigned_to"), Roles.SALES)

                .rule(Modules.OPERATIONS, ScopeRule.ownedBy("assigned_to"), Roles.OPERATIONS)

                // non-admin users only ever see their own account
                .rule(Modules.USERS, ScopeRule.ownedBy("id"), Roles.STAFF_AND_CUSTOMER.toArray(String[]::new))
                .build();
    }
}
