package com.wayfarer.security;

import java.util.List;

/**
 * Module identifiers used by the CRM resources.
 * <p>
 * The resolver accepts any string; these constants only keep controllers and scope rules
 * from drifting apart on spelling.
 */
public final class Modules {

    public static final String CUSTOMERS = "customers";
    public static final String LEADS = "leads";
    public static final String SALES_CASES = "sales_cases";
    public static final String RESERVATIONS = "reservations";
    public static final String PAYMENTS = "payments";
    public static final String INVOICES = "invoices";
    public static final String SUPPORT_TICKETS = "support_tickets";
    public static final String PROPERTIES = "properties";
    public static final String OPERATIONS = "operations";
    public static final String OWNERS = "owners";
    public static final String SETTINGS = "settings";
    public static final String NOTIFICATIONS = "notifications";
    public static final String USERS = "users";
    public static final String ROLES = "roles";
    public static final String DEPARTMENTS = "departments";

    /** Modules provisioned by the seed migration, in display order. */
    public static final List<String> SEEDED = List.of(
            CUSTOMERS, LEADS, SALES_CASES, RESERVATIONS, PAYMENTS, INVOICES, SUPPORT_TICKETS,
            PROPERTIES, OPERATIONS, OWNERS, SETTINGS, NOTIFICATIONS, USERS, ROLES, DEPARTMENTS);

    private Modules() {
        // constants
    }
}
