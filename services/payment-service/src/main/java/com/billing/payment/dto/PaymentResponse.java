package com.billing.payment.dto;

import com.billing.payment.entity.PaymentStatus;
import com.billing.payment.entity.PaymentTransaction;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentResponse(
        UUID id,
        String externalReference,
        BigDecimal amount,
        String currency,
        PaymentStatus status,
        String failureReason,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant updatedAt,
        Instant processedAt
) {
    public static PaymentResponse from(PaymentTransaction payment) {
        return new PaymentResponse(payment.getId(), payment.getExternalReference(), payment.getAmount(),
                payment.getCurrency(), payment.getStatus(), payment.getFailureReason(), payment.getMetadata(),
                payment.getCreatedAt(), payment.getUpdatedAt(), payment.getProcessedAt());
    }
}
