/**
 * CRM resource types as returned by the API.
 *
 * <p>Rows are plain records; ownership columns ({@code agentId}, {@code customerId},
 * {@code assignedTo}...) are what the row-scoping rules filter on.
 */
package com.wayfarer.crm.domain;
