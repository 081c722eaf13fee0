package com.billing.subscription.service;

import com.billing.common.error.ApiException;
import com.billing.common.tx.TransactionExecutor;
import com.billing.events.PaymentOutcome;
import com.billing.events.PaymentWebhookEvent;
import com.billing.subscription.dto.WebhookAckResponse;
import com.billing.subscription.entity.PaymentRecord;
import com.billing.subscription.entity.Subscription;
import com.billing.subscription.entity.SubscriptionStatus;
import com.billing.subscription.repository.PaymentRecordRepository;
import com.billing.subscription.repository.SubscriptionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies a verified payment outcome to the subscription it references.
 *
 * <p>The subscription row is locked for the whole unit, so deliveries for the same subscription
 * serialize while other subscriptions proceed. Every step checks current state before writing:
 * a duplicate or reordered delivery changes nothing and reports the status the subscription has.
 */
@Service
public class WebhookReconciler {

    private static final Logger log = LoggerFactory.getLogger(WebhookReconciler.class);

    static final String DEFAULT_FAILURE_REASON = "Payment processing failed";

    private final SubscriptionRepository subscriptionRepository;
    private final PaymentRecordRepository paymentRecordRepository;
    private final TransactionExecutor transactionExecutor;
    private final MeterRegistry meterRegistry;

    public WebhookReconciler(SubscriptionRepository subscriptionRepository,
                             PaymentRecordRepository paymentRecordRepository,
                             TransactionExecutor transactionExecutor,
                             MeterRegistry meterRegistry) {
        this.subscriptionRepository = subscriptionRepository;
        this.paymentRecordRepository = paymentRecordRepository;
        this.transactionExecutor = transactionExecutor;
        this.meterRegistry = meterRegistry;
    }

    public WebhookAckResponse reconcile(PaymentWebhookEvent event) {
        UUID subscriptionId = parseReference(event.externalReference());
        PaymentOutcome outcome = event.outcome();
        return transactionExecutor.run(() -> apply(subscriptionId, outcome),
                Isolation.READ_COMMITTED, TransactionExecutor.DEFAULT_MAX_RETRIES);
    }

    private WebhookAckResponse apply(UUID subscriptionId, PaymentOutcome outcome) {
        Subscription subscription = subscriptionRepository.findByIdForUpdate(subscriptionId)
                .orElseThrow(() -> SubscriptionService.subscriptionNotFound(subscriptionId));

        boolean settled = settlePaymentRecord(subscription, outcome);
        if (!settled) {
            meterRegistry.counter("webhooks_reconciled_total", "outcome", "duplicate").increment();
            log.info("Payment {} already reconciled for subscription {}, status stays {}",
                    outcome.paymentId(), subscriptionId, subscription.getStatus());
            return ack(subscription);
        }

        if (outcome instanceof PaymentOutcome.Success) {
            activate(subscription, outcome.paymentId());
            meterRegistry.counter("webhooks_reconciled_total", "outcome", "success").increment();
        } else {
            cancel(subscription, outcome.paymentId());
            meterRegistry.counter("webhooks_reconciled_total", "outcome", "failed").increment();
        }
        subscriptionRepository.saveAndFlush(subscription);
        return ack(subscription);
    }

    /**
     * Returns false when this payment was already settled on a record, which makes the whole
     * delivery a no-op. A payment correlated to another subscription's record is rejected.
     */
    private boolean settlePaymentRecord(Subscription subscription, PaymentOutcome outcome) {
        String paymentId = outcome.paymentId();
        Optional<PaymentRecord> correlated = paymentRecordRepository.findByPaymentCorrelationId(paymentId);
        if (correlated.isPresent() && !correlated.get().getSubscription().getId().equals(subscription.getId())) {
            throw ApiException.unprocessable(SubscriptionErrorCodes.PAYMENT_REFERENCE_MISMATCH,
                    "Payment " + paymentId + " does not belong to subscription " + subscription.getId(),
                    Map.of("paymentId", paymentId, "externalReference", subscription.getId().toString()));
        }
        if (correlated.isPresent() && correlated.get().isSettled()) {
            return false;
        }

        PaymentRecord record = correlated
                .or(subscription::latestUnclaimedPendingRecord)
                .orElse(null);
        if (record == null) {
            log.warn("No pending payment record awaits payment {} on subscription {}, recording it as a late settlement",
                    paymentId, subscription.getId());
            record = subscription.addPaymentRecord(outcome.amount(), outcome.currency());
        }

        if (outcome instanceof PaymentOutcome.Failure failure) {
            String reason = failure.reason() == null || failure.reason().isBlank()
                    ? DEFAULT_FAILURE_REASON : failure.reason();
            record.markFailed(paymentId, reason);
        } else {
            record.markSucceeded(paymentId);
        }
        return true;
    }

    private void activate(Subscription subscription, String paymentId) {
        SubscriptionStatus from = subscription.getStatus();
        if (from == SubscriptionStatus.ACTIVE || subscription.updateStatus(SubscriptionStatus.ACTIVE)) {
            subscription.confirmPayment(paymentId);
            log.info("Subscription {} {} -> ACTIVE after payment {}", subscription.getId(), from, paymentId);
            return;
        }
        log.warn("Subscription {} is {}, ignoring successful payment {} for status change",
                subscription.getId(), from, paymentId);
    }

    private void cancel(Subscription subscription, String paymentId) {
        SubscriptionStatus from = subscription.getStatus();
        if (subscription.updateStatus(SubscriptionStatus.CANCELLED)) {
            meterRegistry.counter("subscriptions_cancelled_total", "source", "payment").increment();
            log.info("Subscription {} {} -> CANCELLED after failed payment {}", subscription.getId(), from, paymentId);
            return;
        }
        log.warn("Subscription {} is {}, ignoring failed payment {} for status change",
                subscription.getId(), from, paymentId);
    }

    private static WebhookAckResponse ack(Subscription subscription) {
        return new WebhookAckResponse(true, Instant.now(), subscription.getId(), subscription.getStatus().name());
    }

    private static UUID parseReference(String externalReference) {
        try {
            return UUID.fromString(externalReference);
        } catch (IllegalArgumentException e) {
            throw SubscriptionService.subscriptionNotFound(externalReference);
        }
    }
}
