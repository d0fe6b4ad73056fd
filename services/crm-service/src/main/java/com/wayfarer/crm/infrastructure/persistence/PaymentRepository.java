package com.wayfarer.crm.infrastructure.persistence;

import com.wayfarer.crm.domain.Payment;
import com.wayfarer.security.Modules;
import com.wayfarer.security.PolicyInitializer;
import com.wayfarer.security.scope.RowScopingPolicy;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class PaymentRepository extends ScopedJdbcRepository<Payment> {

    public PaymentRepository(JdbcTemplate jdbcTemplate, RowScopingPolicy scopingPolicy, PolicyInitializer initializer) {
        super(jdbcTemplate, scopingPolicy, initializer, Modules.PAYMENTS, "payments");
    }

    @Override
    protected Payment map(Map<String, Object> row) {
        return new Payment(
                Rows.requireLong(row, "id"),
                Rows.string(row, "reference"),
                Rows.requireLong(row, "reservation_id"),
                Rows.requireLong(row, "customer_id"),
                Rows.decimal(row, "amount"),
                Rows.string(row, "payment_method"),
                Rows.string(row, "payment_status"),
                Rows.date(row, "payment_date"));
    }
}
