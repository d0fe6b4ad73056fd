package com.wayfarer.crm.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A sales lead, owned by the agent in {@code agentId}.
 */
public record Lead(
        long id,
        String reference,
        String name,
        String email,
        String phone,
        String source,
        String status,
        Long agentId,
        BigDecimal value,
        Instant createdAt,
        Instant updatedAt) {}
