package com.billing.subscription.service;

import com.billing.subscription.entity.SubscriptionStatus;
import com.billing.subscription.repository.SubscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Moves subscriptions onto their scheduled (downgraded) plan once the billing boundary passes.
 */
@Component
public class PlanChangeJob {

    private static final Logger log = LoggerFactory.getLogger(PlanChangeJob.class);

    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionService subscriptionService;

    public PlanChangeJob(SubscriptionRepository subscriptionRepository, SubscriptionService subscriptionService) {
        this.subscriptionRepository = subscriptionRepository;
        this.subscriptionService = subscriptionService;
    }

    @Scheduled(fixedDelayString = "${subscription.plan-change.interval-ms:60000}",
            initialDelayString = "${subscription.plan-change.initial-delay-ms:60000}")
    public void run() {
        applyDueChanges();
    }

    public int applyDueChanges() {
        Instant now = Instant.now();
        List<UUID> due = subscriptionRepository.findIdsWithChangeDue(SubscriptionStatus.ACTIVE, now);
        int applied = 0;
        for (UUID id : due) {
            try {
                if (subscriptionService.applyScheduledChange(id, now)) {
                    applied++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to apply scheduled plan change for subscription {}", id, e);
            }
        }
        if (applied > 0) {
            log.info("Applied {} scheduled plan changes", applied);
        }
        return applied;
    }
}
