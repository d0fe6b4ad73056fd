package com.wayfarer.crm.infrastructure.persistence;

import com.wayfarer.crm.domain.Reservation;
import com.wayfarer.security.Modules;
import com.wayfarer.security.PolicyInitializer;
import com.wayfarer.security.scope.RowScopingPolicy;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class ReservationRepository extends ScopedJdbcRepository<Reservation> {

    public ReservationRepository(
            JdbcTemplate jdbcTemplate, RowScopingPolicy scopingPolicy, PolicyInitializer initializer) {
        super(jdbcTemplate, scopingPolicy, initializer, Modules.RESERVATIONS, "reservations");
    }

    @Override
    protected Reservation map(Map<String, Object> row) {
        return new Reservation(
                Rows.requireLong(row, "id"),
                Rows.string(row, "reference"),
                Rows.requireLong(row, "customer_id"),
                Rows.string(row, "service_type"),
                Rows.string(row, "destination"),
                Rows.date(row, "departure_date"),
                Rows.date(row, "return_date"),
                Rows.decimal(row, "total_amount"),
                Rows.string(row, "status"),
                Rows.string(row, "payment_status"));
    }
}
