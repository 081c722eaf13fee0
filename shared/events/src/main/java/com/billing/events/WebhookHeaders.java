package com.billing.events;

public final class WebhookHeaders {
    private WebhookHeaders() {}

    public static final String SIGNATURE = "X-Webhook-Signature";
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    /**
     * Stable key for every delivery of one settlement, so the receiver can absorb retries.
     */
    public static String webhookIdempotencyKey(Object paymentId) {
        return "webhook_" + paymentId;
    }
}
