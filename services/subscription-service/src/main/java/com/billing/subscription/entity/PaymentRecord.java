package com.billing.subscription.entity;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "payment_records")
public class PaymentRecord {

    @Id
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "subscription_id", nullable = false)
    private Subscription subscription;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentRecordStatus status;

    @Column(name = "payment_correlation_id")
    private String paymentCorrelationId;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected PaymentRecord() {}

    PaymentRecord(Subscription subscription, BigDecimal amount, String currency) {
        this.id = UUID.randomUUID();
        this.subscription = subscription;
        this.amount = amount.setScale(2, RoundingMode.HALF_UP);
        this.currency = currency;
        this.status = PaymentRecordStatus.PENDING;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public boolean isSettled() {
        return status != PaymentRecordStatus.PENDING;
    }

    /**
     * Links the record to the payment-service payment. A record keeps its first correlation id.
     */
    public boolean assignCorrelation(String paymentId) {
        if (paymentCorrelationId != null) {
            return false;
        }
        this.paymentCorrelationId = paymentId;
        this.updatedAt = Instant.now();
        return true;
    }

    public void markSucceeded(String paymentId) {
        assignCorrelation(paymentId);
        this.status = PaymentRecordStatus.SUCCESS;
        this.failureReason = null;
        this.updatedAt = Instant.now();
    }

    public void markFailed(String paymentId, String reason) {
        assignCorrelation(paymentId);
        this.status = PaymentRecordStatus.FAILED;
        this.failureReason = reason;
        this.updatedAt = Instant.now();
    }

    public UUID getId() { return id; }
    public Subscription getSubscription() { return subscription; }
    public BigDecimal getAmount() { return amount; }
    public String getCurrency() { return currency; }
    public PaymentRecordStatus getStatus() { return status; }
    public String getPaymentCorrelationId() { return paymentCorrelationId; }
    public String getFailureReason() { return failureReason; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
