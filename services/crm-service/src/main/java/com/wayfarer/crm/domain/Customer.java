package com.wayfarer.crm.domain;

import java.time.Instant;

/**
 * A customer account. {@code assignedStaffId} is the agent working the account.
 */
public record Customer(
        long id,
        String reference,
        String name,
        String email,
        String phone,
        String type,
        String status,
        Long assignedStaffId,
        Instant createdAt) {}
