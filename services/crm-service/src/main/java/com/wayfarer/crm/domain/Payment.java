package com.wayfarer.crm.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record Payment(
        long id,
        String reference,
        long reservationId,
        long customerId,
        BigDecimal amount,
        String method,
        String status,
        LocalDate paymentDate) {}
