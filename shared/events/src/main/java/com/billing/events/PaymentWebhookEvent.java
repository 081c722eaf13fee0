package com.billing.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentWebhookEvent(
        @NotBlank
        @Pattern(regexp = "payment\\.completed|payment\\.failed", message = "must be payment.completed or payment.failed")
        String eventType,
        @NotBlank String paymentId,
        @NotBlank String externalReference,
        @NotBlank
        @Pattern(regexp = "success|failed", message = "must be success or failed")
        String status,
        @NotNull BigDecimal amount,
        @NotBlank
        @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
        String currency,
        @NotNull Instant timestamp,
        String failureReason,
        Map<String, Object> metadata
) {

    public static PaymentWebhookEvent from(PaymentOutcome outcome, String externalReference,
                                           Map<String, Object> metadata) {
        if (outcome instanceof PaymentOutcome.Failure failure) {
            return new PaymentWebhookEvent(EventTypes.PAYMENT_FAILED, failure.paymentId(), externalReference,
                    EventTypes.STATUS_FAILED, failure.amount(), failure.currency(), failure.occurredAt(),
                    failure.reason(), metadata);
        }
        return new PaymentWebhookEvent(EventTypes.PAYMENT_COMPLETED, outcome.paymentId(), externalReference,
                EventTypes.STATUS_SUCCESS, outcome.amount(), outcome.currency(), outcome.occurredAt(),
                null, metadata);
    }

    /**
     * Call only on a validated event; {@code status} decides the branch.
     */
    public PaymentOutcome outcome() {
        if (EventTypes.STATUS_SUCCESS.equals(status)) {
            return new PaymentOutcome.Success(paymentId, amount, currency, timestamp);
        }
        return new PaymentOutcome.Failure(paymentId, amount, currency, timestamp, failureReason);
    }
}
