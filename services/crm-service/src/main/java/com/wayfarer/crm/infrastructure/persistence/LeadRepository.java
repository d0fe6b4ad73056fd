package com.wayfarer.crm.infrastructure.persistence;

import com.wayfarer.crm.domain.Lead;
import com.wayfarer.crm.domain.LeadStatus;
import com.wayfarer.security.Modules;
import com.wayfarer.security.PolicyInitializer;
import com.wayfarer.security.Principal;
import com.wayfarer.security.scope.RowScopingPolicy;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class LeadRepository extends ScopedJdbcRepository<Lead> {

    public LeadRepository(JdbcTemplate jdbcTemplate, RowScopingPolicy scopingPolicy, PolicyInitializer initializer) {
        super(jdbcTemplate, scopingPolicy, initializer, Modules.LEADS, "leads");
    }

    public Lead updateStatus(Principal principal, long id, LeadStatus status) {
        return updateVisible(principal, id, set("status", status.label()));
    }

    @Override
    protected Lead map(Map<String, Object> row) {
        return new Lead(
                Rows.requireLong(row, "id"),
                Rows.string(row, "reference"),
                Rows.string(row, "name"),
                Rows.string(row, "email"),
                Rows.string(row, "phone"),
                Rows.string(row, "source"),
                Rows.string(row, "status"),
                Rows.nullableLong(row, "agent_id"),
                Rows.decimal(row, "lead_value"),
                Rows.instant(row, "created_at"),
                Rows.instant(row, "updated_at"));
    }
}
