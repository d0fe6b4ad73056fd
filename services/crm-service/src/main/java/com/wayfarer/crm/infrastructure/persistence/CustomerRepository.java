package com.wayfarer.crm.infrastructure.persistence;

import com.wayfarer.crm.domain.Customer;
import com.wayfarer.security.Modules;
import com.wayfarer.security.PolicyInitializer;
import com.wayfarer.security.scope.RowScopingPolicy;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class CustomerRepository extends ScopedJdbcRepository<Customer> {

    public CustomerRepository(
            JdbcTemplate jdbcTemplate, RowScopingPolicy scopingPolicy, PolicyInitializer initializer) {
        super(jdbcTemplate, scopingPolicy, initializer, Modules.CUSTOMERS, "customers");
    }

    @Override
    protected Customer map(Map<String, Object> row) {
        return new Customer(
                Rows.requireLong(row, "id"),
                Rows.string(row, "reference"),
                Rows.string(row, "name"),
                Rows.string(row, "email"),
                Rows.string(row, "phone"),
                Rows.string(row, "customer_type"),
                Rows.string(row, "status"),
                Rows.nullableLong(row, "assigned_staff_id"),
                Rows.instant(row, "created_at"));
    }
}
