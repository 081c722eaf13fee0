package com.billing.payment.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbox row for one payment-outcome webhook. The payload holds the exact bytes that get signed
 * and sent on every attempt; it is never re-serialized.
 */
@Entity
@Table(name = "webhook_deliveries")
public class WebhookDelivery {

    @Id
    private UUID id;

    @Column(name = "payment_id", nullable = false)
    private UUID paymentId;

    @Column(name = "idempotency_key", nullable = false)
    private String idempotencyKey;

    @Column(name = "payload", columnDefinition = "text", nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private WebhookDeliveryStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "next_attempt_at", nullable = false)
    private Instant nextAttemptAt;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "last_status_code")
    private Integer lastStatusCode;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    protected WebhookDelivery() {}

    public WebhookDelivery(UUID paymentId, String idempotencyKey, String payload) {
        this.id = UUID.randomUUID();
        this.paymentId = paymentId;
        this.idempotencyKey = idempotencyKey;
        this.payload = payload;
        this.status = WebhookDeliveryStatus.PENDING;
        this.attempts = 0;
        this.createdAt = Instant.now();
        this.nextAttemptAt = this.createdAt;
    }

    /**
     * Starts a round: counts it and hides the row from other pollers until {@code leaseUntil}.
     */
    public void beginRound(Instant leaseUntil) {
        this.attempts++;
        this.nextAttemptAt = leaseUntil;
    }

    public void markDelivered(int statusCode) {
        this.status = WebhookDeliveryStatus.DELIVERED;
        this.lastStatusCode = statusCode;
        this.lastError = null;
        this.deliveredAt = Instant.now();
    }

    public void markRejected(int statusCode, String error) {
        this.status = WebhookDeliveryStatus.REJECTED;
        this.lastStatusCode = statusCode;
        this.lastError = truncate(error);
    }

    public void retryAt(Instant when, Integer statusCode, String error) {
        this.nextAttemptAt = when;
        this.lastStatusCode = statusCode;
        this.lastError = truncate(error);
    }

    public void markFailed(Integer statusCode, String error) {
        this.status = WebhookDeliveryStatus.FAILED;
        this.lastStatusCode = statusCode;
        this.lastError = truncate(error);
    }

    /**
     * Puts the row back on the schedule from the first round, whatever state it ended in.
     */
    public void requeue(Instant now) {
        this.status = WebhookDeliveryStatus.PENDING;
        this.attempts = 0;
        this.nextAttemptAt = now;
        this.lastError = null;
        this.lastStatusCode = null;
        this.deliveredAt = null;
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= 1000) {
            return error;
        }
        return error.substring(0, 1000);
    }

    public UUID getId() { return id; }
    public UUID getPaymentId() { return paymentId; }
    public String getIdempotencyKey() { return idempotencyKey; }
    public String getPayload() { return payload; }
    public WebhookDeliveryStatus getStatus() { return status; }
    public int getAttempts() { return attempts; }
    public Instant getNextAttemptAt() { return nextAttemptAt; }
    public String getLastError() { return lastError; }
    public Integer getLastStatusCode() { return lastStatusCode; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getDeliveredAt() { return deliveredAt; }
}
