package com.billing.payment.entity;

public enum WebhookDeliveryStatus {
    PENDING,
    DELIVERED,
    /** The receiver answered with a non-retryable 4xx. */
    REJECTED,
    /** Every scheduled round was exhausted. */
    FAILED
}
