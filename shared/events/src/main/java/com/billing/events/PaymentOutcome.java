package com.billing.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Result of settling a payment. Carried over the wire as a {@link PaymentWebhookEvent}.
 */
public sealed interface PaymentOutcome permits PaymentOutcome.Success, PaymentOutcome.Failure {

    String paymentId();

    BigDecimal amount();

    String currency();

    Instant occurredAt();

    record Success(String paymentId, BigDecimal amount, String currency, Instant occurredAt)
            implements PaymentOutcome {}

    record Failure(String paymentId, BigDecimal amount, String currency, Instant occurredAt, String reason)
            implements PaymentOutcome {}
}
