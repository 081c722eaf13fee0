package com.billing.payment.dispatch;

/**
 * How one dispatch of a webhook ended, after all in-process attempts.
 */
public sealed interface DeliveryResult {

    int attempts();

    record Delivered(int statusCode, int attempts) implements DeliveryResult {}

    /** Receiver refused the payload; sending it again cannot help. */
    record Rejected(int statusCode, String reason, int attempts) implements DeliveryResult {}

    /** Every attempt hit a retryable failure. {@code lastStatusCode} is null for network errors. */
    record Exhausted(Integer lastStatusCode, String lastError, int attempts) implements DeliveryResult {}
}
