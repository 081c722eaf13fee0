package com.billing.subscription.service;

import com.billing.common.error.ApiException;
import com.billing.subscription.dto.CreateSubscriptionRequest;
import com.billing.subscription.dto.DowngradeResponse;
import com.billing.subscription.dto.SubscriptionResponse;
import com.billing.subscription.dto.UpgradeResponse;
import com.billing.subscription.entity.PaymentRecord;
import com.billing.subscription.entity.Plan;
import com.billing.subscription.entity.Subscription;
import com.billing.subscription.entity.SubscriptionStatus;
import com.billing.subscription.repository.PlanRepository;
import com.billing.subscription.repository.SubscriptionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class SubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    static final String DOWNGRADE_NOTE = "Downgrade will take effect at the end of current billing period";

    private final SubscriptionRepository subscriptionRepository;
    private final PlanRepository planRepository;
    private final ProrationCalculator prorationCalculator;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    public SubscriptionService(SubscriptionRepository subscriptionRepository,
                               PlanRepository planRepository,
                               ProrationCalculator prorationCalculator,
                               ApplicationEventPublisher eventPublisher,
                               MeterRegistry meterRegistry) {
        this.subscriptionRepository = subscriptionRepository;
        this.planRepository = planRepository;
        this.prorationCalculator = prorationCalculator;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
    }

    @Transactional
    public SubscriptionResponse create(CreateSubscriptionRequest request) {
        Plan plan = activePlan(request.planId());

        subscriptionRepository.findFirstByUserIdAndStatusIn(request.userId(), SubscriptionStatus.LIVE)
                .ifPresent(existing -> {
                    throw liveSubscriptionExists(existing.getId(), existing.getPlan().getId());
                });

        Subscription subscription = new Subscription(request.userId(), plan);
        PaymentRecord record = subscription.addPaymentRecord(plan.getPrice(), plan.getCurrency());
        try {
            subscriptionRepository.saveAndFlush(subscription);
        } catch (DataIntegrityViolationException e) {
            // lost the race against a concurrent create for the same user
            throw liveSubscriptionExists(null, null);
        }

        eventPublisher.publishEvent(new PaymentInitiationRequested(record.getId()));

        meterRegistry.counter("subscriptions_created_total").increment();
        log.info("Subscription created: id={}, user={}, plan={}", subscription.getId(),
                request.userId(), plan.getName());
        return SubscriptionResponse.from(subscription);
    }

    @Transactional(readOnly = true)
    public SubscriptionResponse get(UUID id) {
        return SubscriptionResponse.from(find(id));
    }

    @Transactional(readOnly = true)
    public List<SubscriptionResponse> list(UUID userId, SubscriptionStatus status) {
        List<Subscription> subscriptions = status == null
                ? subscriptionRepository.findByUserIdOrderByCreatedAtDesc(userId)
                : subscriptionRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status);
        return subscriptions.stream().map(SubscriptionResponse::from).toList();
    }

    @Transactional
    public UpgradeResponse upgrade(UUID id, UUID newPlanId) {
        Subscription subscription = findForUpdate(id);
        requireActive(subscription, "upgrade");
        Plan newPlan = activePlan(newPlanId);
        Plan current = subscription.getPlan();

        if (!prorationCalculator.isUpgrade(current.getPrice(), newPlan.getPrice())) {
            throw ApiException.unprocessable(SubscriptionErrorCodes.INVALID_UPGRADE,
                    "New plan must be higher tier than current plan",
                    priceDetails(current, newPlan));
        }

        BigDecimal prorated = prorationCalculator.proratedAmount(current.getPrice(), newPlan.getPrice());
        subscription.changePlan(newPlan);
        PaymentRecord record = subscription.addPaymentRecord(prorated, newPlan.getCurrency());
        subscriptionRepository.saveAndFlush(subscription);

        eventPublisher.publishEvent(new PaymentInitiationRequested(record.getId()));

        meterRegistry.counter("subscription_plan_changes_total", "direction", "upgrade").increment();
        log.info("Subscription {} upgraded {} -> {}, prorated charge {}", id, current.getName(),
                newPlan.getName(), prorated);
        return new UpgradeResponse(SubscriptionResponse.from(subscription), prorated);
    }

    @Transactional
    public DowngradeResponse downgrade(UUID id, UUID newPlanId) {
        Subscription subscription = findForUpdate(id);
        requireActive(subscription, "downgrade");
        Plan newPlan = activePlan(newPlanId);
        Plan current = subscription.getPlan();

        if (!prorationCalculator.isDowngrade(current.getPrice(), newPlan.getPrice())) {
            throw ApiException.unprocessable(SubscriptionErrorCodes.INVALID_DOWNGRADE,
                    "New plan must be lower tier than current plan",
                    priceDetails(current, newPlan));
        }

        Instant effectiveDate = subscription.nextBillingBoundary(Instant.now());
        subscription.scheduleChange(newPlan, effectiveDate);
        subscriptionRepository.saveAndFlush(subscription);

        meterRegistry.counter("subscription_plan_changes_total", "direction", "downgrade").increment();
        log.info("Subscription {} downgrade {} -> {} scheduled for {}", id, current.getName(),
                newPlan.getName(), effectiveDate);
        return new DowngradeResponse(SubscriptionResponse.from(subscription), effectiveDate, DOWNGRADE_NOTE);
    }

    @Transactional
    public SubscriptionResponse cancel(UUID id, String reason) {
        Subscription subscription = findForUpdate(id);
        SubscriptionStatus status = subscription.getStatus();
        if (status == SubscriptionStatus.CANCELLED) {
            throw ApiException.unprocessable(SubscriptionErrorCodes.ALREADY_CANCELLED,
                    "Subscription is already cancelled", Map.of("subscriptionId", id));
        }
        if (!subscription.updateStatus(SubscriptionStatus.CANCELLED)) {
            throw ApiException.unprocessable(SubscriptionErrorCodes.INVALID_SUBSCRIPTION_STATE,
                    "Cannot cancel a subscription in status " + status,
                    Map.of("currentStatus", status.name()));
        }
        subscriptionRepository.saveAndFlush(subscription);

        meterRegistry.counter("subscriptions_cancelled_total", "source", "user").increment();
        log.info("Subscription {} cancelled by user: {}", id, reason == null ? "no reason given" : reason);
        return SubscriptionResponse.from(subscription);
    }

    /**
     * Applies a downgrade whose billing boundary has passed. Returns false when there was nothing to do.
     */
    @Transactional
    public boolean applyScheduledChange(UUID id, Instant now) {
        Subscription subscription = subscriptionRepository.findByIdForUpdate(id).orElse(null);
        if (subscription == null) {
            return false;
        }
        String from = subscription.getPlan().getName();
        if (!subscription.applyScheduledChange(now)) {
            return false;
        }
        log.info("Subscription {} moved from plan {} to {} at billing boundary", id, from,
                subscription.getPlan().getName());
        return true;
    }

    private Subscription find(UUID id) {
        return subscriptionRepository.findById(id).orElseThrow(() -> subscriptionNotFound(id));
    }

    private Subscription findForUpdate(UUID id) {
        return subscriptionRepository.findByIdForUpdate(id).orElseThrow(() -> subscriptionNotFound(id));
    }

    private Plan activePlan(UUID planId) {
        return planRepository.findById(planId)
                .filter(Plan::isActive)
                .orElseThrow(() -> ApiException.notFound(SubscriptionErrorCodes.PLAN_NOT_FOUND,
                        "Plan not found or inactive", Map.of("planId", planId)));
    }

    private static void requireActive(Subscription subscription, String operation) {
        if (subscription.getStatus() != SubscriptionStatus.ACTIVE) {
            throw ApiException.unprocessable(SubscriptionErrorCodes.INVALID_SUBSCRIPTION_STATE,
                    "Cannot " + operation + ": subscription is not active",
                    Map.of("currentStatus", subscription.getStatus().name(),
                            "requiredStatus", SubscriptionStatus.ACTIVE.name()));
        }
    }

    private static Map<String, Object> priceDetails(Plan current, Plan requested) {
        return Map.of("currentPlanPrice", current.getPrice(), "newPlanPrice", requested.getPrice());
    }

    static ApiException subscriptionNotFound(Object id) {
        return ApiException.notFound(SubscriptionErrorCodes.SUBSCRIPTION_NOT_FOUND, "Subscription not found",
                Map.of("subscriptionId", String.valueOf(id)));
    }

    private static ApiException liveSubscriptionExists(UUID existingId, UUID planId) {
        if (existingId == null) {
            return ApiException.conflict(SubscriptionErrorCodes.ACTIVE_SUBSCRIPTION_EXISTS,
                    "User already has an active subscription");
        }
        return ApiException.conflict(SubscriptionErrorCodes.ACTIVE_SUBSCRIPTION_EXISTS,
                "User already has an active subscription",
                Map.of("existingSubscriptionId", existingId, "currentPlan", planId));
    }
}
