package com.wayfarer.crm.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record Reservation(
        long id,
        String reference,
        long customerId,
        String serviceType,
        String destination,
        LocalDate departureDate,
        LocalDate returnDate,
        BigDecimal totalAmount,
        String status,
        String paymentStatus) {}
