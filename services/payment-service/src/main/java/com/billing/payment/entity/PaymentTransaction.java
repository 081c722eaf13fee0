package com.billing.payment.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "payment_transactions")
public class PaymentTransaction {

    @Id
    private UUID id;

    @Column(name = "external_reference", nullable = false)
    private String externalReference;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Version
    private Long version;

    protected PaymentTransaction() {}

    public PaymentTransaction(String externalReference, BigDecimal amount, String currency,
                              Map<String, Object> metadata) {
        this.id = UUID.randomUUID();
        this.externalReference = externalReference;
        this.amount = amount.setScale(2, RoundingMode.HALF_UP);
        this.currency = currency;
        this.status = PaymentStatus.PENDING;
        this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public boolean startProcessing() {
        if (!status.canTransitionTo(PaymentStatus.PROCESSING)) {
            return false;
        }
        this.status = PaymentStatus.PROCESSING;
        this.updatedAt = Instant.now();
        return true;
    }

    public boolean succeed() {
        return settle(PaymentStatus.SUCCESS, null);
    }

    public boolean fail(String reason) {
        return settle(PaymentStatus.FAILED, reason);
    }

    private boolean settle(PaymentStatus target, String reason) {
        if (!status.canTransitionTo(target)) {
            return false;
        }
        this.status = target;
        this.failureReason = reason;
        this.processedAt = Instant.now();
        this.updatedAt = this.processedAt;
        return true;
    }

    public UUID getId() { return id; }
    public String getExternalReference() { return externalReference; }
    public BigDecimal getAmount() { return amount; }
    public String getCurrency() { return currency; }
    public PaymentStatus getStatus() { return status; }
    public String getFailureReason() { return failureReason; }
    public Map<String, Object> getMetadata() { return metadata; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getProcessedAt() { return processedAt; }
}
