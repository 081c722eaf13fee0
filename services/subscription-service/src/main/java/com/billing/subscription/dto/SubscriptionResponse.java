package com.billing.subscription.dto;

import com.billing.subscription.entity.PaymentRecord;
import com.billing.subscription.entity.Plan;
import com.billing.subscription.entity.Subscription;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubscriptionResponse(
        UUID id,
        UUID userId,
        UUID planId,
        String planName,
        BigDecimal planPrice,
        String status,
        Instant startDate,
        Instant endDate,
        String paymentCorrelationId,
        UUID previousPlanId,
        UUID scheduledPlanId,
        Instant scheduledChangeAt,
        List<PaymentRecordResponse> paymentRecords,
        Instant createdAt,
        Instant updatedAt
) {
    public static SubscriptionResponse from(Subscription subscription) {
        List<PaymentRecordResponse> records = subscription.getPaymentRecords().stream()
                .map(PaymentRecordResponse::from)
                .toList();
        Plan plan = subscription.getPlan();
        return new SubscriptionResponse(
                subscription.getId(),
                subscription.getUserId(),
                plan.getId(),
                plan.getName(),
                plan.getPrice(),
                subscription.getStatus().name(),
                subscription.getStartDate(),
                subscription.getEndDate(),
                subscription.getPaymentCorrelationId(),
                idOf(subscription.getPreviousPlan()),
                idOf(subscription.getScheduledPlan()),
                subscription.getScheduledChangeAt(),
                records,
                subscription.getCreatedAt(),
                subscription.getUpdatedAt()
        );
    }

    private static UUID idOf(Plan plan) {
        return plan == null ? null : plan.getId();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PaymentRecordResponse(
            UUID id,
            BigDecimal amount,
            String currency,
            String status,
            String paymentCorrelationId,
            String failureReason,
            Instant createdAt,
            Instant updatedAt
    ) {
        public static PaymentRecordResponse from(PaymentRecord record) {
            return new PaymentRecordResponse(record.getId(), record.getAmount(), record.getCurrency(),
                    record.getStatus().name(), record.getPaymentCorrelationId(), record.getFailureReason(),
                    record.getCreatedAt(), record.getUpdatedAt());
        }
    }
}
