package com.wayfarer.crm.domain;

import java.time.Instant;

public record SupportTicket(
        long id,
        String reference,
        long customerId,
        String subject,
        String priority,
        String status,
        Long assignedTo,
        long createdBy,
        Instant resolvedAt,
        Instant createdAt,
        Instant updatedAt) {}
