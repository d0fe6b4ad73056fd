package com.wayfarer.crm.infrastructure.persistence;

import com.wayfarer.crm.domain.SupportTicket;
import com.wayfarer.crm.domain.TicketStatus;
import com.wayfarer.security.Modules;
import com.wayfarer.security.PolicyInitializer;
import com.wayfarer.security.Principal;
import com.wayfarer.security.scope.RowScopingPolicy;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class SupportTicketRepository extends ScopedJdbcRepository<SupportTicket> {

    private final Clock clock = Clock.systemUTC();

    public SupportTicketRepository(
            JdbcTemplate jdbcTemplate, RowScopingPolicy scopingPolicy, PolicyInitializer initializer) {
        super(jdbcTemplate, scopingPolicy, initializer, Modules.SUPPORT_TICKETS, "support_tickets");
    }

    /** Moves a ticket to {@code status}; resolving or closing stamps {@code resolved_at}, reopening clears it. */
    public SupportTicket updateStatus(Principal principal, long id, TicketStatus status) {
        Map<String, Object> changes = set("status", status.label());
        changes.put("resolved_at", status.isTerminal() ? Timestamp.from(clock.instant()) : null);
        return updateVisible(principal, id, changes);
    }

    @Override
    protected SupportTicket map(Map<String, Object> row) {
        return new SupportTicket(
                Rows.requireLong(row, "id"),
                Rows.string(row, "reference"),
                Rows.requireLong(row, "customer_id"),
                Rows.string(row, "subject"),
                Rows.string(row, "priority"),
                Rows.string(row, "status"),
                Rows.nullableLong(row, "assigned_to"),
                Rows.requireLong(row, "created_by"),
                Rows.instant(row, "resolved_at"),
                Rows.instant(row, "created_at"),
                Rows.instant(row, "updated_at"));
    }
}
