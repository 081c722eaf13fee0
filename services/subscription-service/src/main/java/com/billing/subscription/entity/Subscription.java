package com.billing.subscription.entity;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(name = "subscriptions")
public class Subscription {

    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "plan_id", nullable = false)
    private Plan plan;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "previous_plan_id")
    private Plan previousPlan;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "scheduled_plan_id")
    private Plan scheduledPlan;

    @Column(name = "scheduled_change_at")
    private Instant scheduledChangeAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SubscriptionStatus status;

    @Column(name = "start_date", nullable = false)
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    @Column(name = "payment_correlation_id")
    private String paymentCorrelationId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @OneToMany(mappedBy = "subscription", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt DESC")
    private List<PaymentRecord> paymentRecords = new ArrayList<>();

    protected Subscription() {}

    public Subscription(UUID userId, Plan plan) {
        this.id = UUID.randomUUID();
        this.userId = userId;
        this.plan = plan;
        this.status = SubscriptionStatus.PENDING;
        this.startDate = Instant.now();
        this.createdAt = this.startDate;
        this.updatedAt = this.startDate;
    }

    public PaymentRecord addPaymentRecord(BigDecimal amount, String currency) {
        PaymentRecord record = new PaymentRecord(this, amount, currency);
        paymentRecords.add(0, record);
        touch();
        return record;
    }

    /**
     * Most recent pending record not yet tied to some other payment.
     */
    public Optional<PaymentRecord> latestUnclaimedPendingRecord() {
        return paymentRecords.stream()
                .filter(r -> r.getStatus() == PaymentRecordStatus.PENDING && r.getPaymentCorrelationId() == null)
                .max(Comparator.comparing(PaymentRecord::getCreatedAt));
    }

    public boolean updateStatus(SubscriptionStatus newStatus) {
        if (!this.status.canTransitionTo(newStatus)) {
            return false;
        }
        this.status = newStatus;
        if (newStatus.isTerminal()) {
            this.endDate = Instant.now();
            this.scheduledPlan = null;
            this.scheduledChangeAt = null;
        }
        touch();
        return true;
    }

    /**
     * Records the payment that settled the subscription and finalizes any plan change in flight.
     */
    public void confirmPayment(String paymentId) {
        this.paymentCorrelationId = paymentId;
        this.previousPlan = null;
        touch();
    }

    /**
     * Switches to {@code newPlan} right away, remembering the old plan until the charge settles.
     */
    public void changePlan(Plan newPlan) {
        this.previousPlan = this.plan;
        this.plan = newPlan;
        this.scheduledPlan = null;
        this.scheduledChangeAt = null;
        touch();
    }

    public void scheduleChange(Plan newPlan, Instant effectiveAt) {
        this.scheduledPlan = newPlan;
        this.scheduledChangeAt = effectiveAt;
        touch();
    }

    public boolean applyScheduledChange(Instant now) {
        if (scheduledPlan == null || scheduledChangeAt == null || scheduledChangeAt.isAfter(now)
                || status != SubscriptionStatus.ACTIVE) {
            return false;
        }
        this.previousPlan = null;
        this.plan = scheduledPlan;
        this.scheduledPlan = null;
        this.scheduledChangeAt = null;
        touch();
        return true;
    }

    public Instant nextBillingBoundary(Instant now) {
        return plan.getBillingCycle().nextBoundary(startDate, now);
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public Plan getPlan() { return plan; }
    public Plan getPreviousPlan() { return previousPlan; }
    public Plan getScheduledPlan() { return scheduledPlan; }
    public Instant getScheduledChangeAt() { return scheduledChangeAt; }
    public SubscriptionStatus getStatus() { return status; }
    public Instant getStartDate() { return startDate; }
    public Instant getEndDate() { return endDate; }
    public String getPaymentCorrelationId() { return paymentCorrelationId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getVersion() { return version; }
    public List<PaymentRecord> getPaymentRecords() { return paymentRecords; }
}
