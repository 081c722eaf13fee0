package com.billing.subscription.client;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Payment as reported by the payment service.
 */
public record PaymentResponse(
        UUID id,
        String externalReference,
        BigDecimal amount,
        String currency,
        String status,
        Instant createdAt
) {}
