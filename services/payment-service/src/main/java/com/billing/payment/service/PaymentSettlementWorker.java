package com.billing.payment.service;

import com.billing.common.tx.TransactionExecutor;
import com.billing.events.PaymentOutcome;
import com.billing.events.PaymentWebhookEvent;
import com.billing.events.WebhookHeaders;
import com.billing.events.serde.EventObjectMapper;
import com.billing.payment.entity.PaymentStatus;
import com.billing.payment.entity.PaymentTransaction;
import com.billing.payment.entity.WebhookDelivery;
import com.billing.payment.repository.PaymentTransactionRepository;
import com.billing.payment.repository.WebhookDeliveryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Moves payments through the simulated processor: PENDING to PROCESSING after the pickup delay, then
 * to SUCCESS or FAILED after the processing delay. The outcome webhook is written to the outbox in the
 * same transaction as the settlement, so a settled payment always has a delivery to send.
 */
@Component
public class PaymentSettlementWorker {

    private static final Logger log = LoggerFactory.getLogger(PaymentSettlementWorker.class);

    static final String FAILURE_REASON = "Simulated payment failure";

    private final PaymentTransactionRepository paymentRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final PaymentOutcomeSimulator simulator;
    private final TransactionExecutor transactionExecutor;
    private final MeterRegistry meterRegistry;
    private final Duration pickupDelay;
    private final Duration processingDelay;
    private final int batchSize;

    public PaymentSettlementWorker(PaymentTransactionRepository paymentRepository,
                                   WebhookDeliveryRepository deliveryRepository,
                                   PaymentOutcomeSimulator simulator,
                                   TransactionExecutor transactionExecutor,
                                   MeterRegistry meterRegistry,
                                   @Value("${payment.simulate.pickup-delay:PT1S}") Duration pickupDelay,
                                   @Value("${payment.simulate.processing-delay:PT2S}") Duration processingDelay,
                                   @Value("${payment.settlement.batch-size:50}") int batchSize) {
        this.paymentRepository = paymentRepository;
        this.deliveryRepository = deliveryRepository;
        this.simulator = simulator;
        this.transactionExecutor = transactionExecutor;
        this.meterRegistry = meterRegistry;
        this.pickupDelay = pickupDelay;
        this.processingDelay = processingDelay;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${payment.settlement.interval-ms:500}",
            initialDelayString = "${payment.settlement.initial-delay-ms:1000}")
    public void run() {
        startProcessing();
        settleProcessed();
    }

    public int startProcessing() {
        Instant cutoff = Instant.now().minus(pickupDelay);
        return transactionExecutor.run(() -> {
            List<PaymentTransaction> due = paymentRepository.lockDue(PaymentStatus.PENDING.name(), cutoff, batchSize);
            for (PaymentTransaction payment : due) {
                payment.startProcessing();
                log.debug("Processing payment {}", payment.getId());
            }
            return due.size();
        });
    }

    public int settleProcessed() {
        Instant cutoff = Instant.now().minus(processingDelay);
        return transactionExecutor.run(() -> {
            List<PaymentTransaction> due = paymentRepository.lockDue(PaymentStatus.PROCESSING.name(), cutoff, batchSize);
            for (PaymentTransaction payment : due) {
                settle(payment);
            }
            return due.size();
        });
    }

    private void settle(PaymentTransaction payment) {
        boolean success = simulator.succeeds(payment.getId());
        if (success) {
            payment.succeed();
            meterRegistry.counter("payments_settled_total", "outcome", "success").increment();
            log.info("Payment {} succeeded for reference {}", payment.getId(), payment.getExternalReference());
        } else {
            payment.fail(FAILURE_REASON);
            meterRegistry.counter("payments_settled_total", "outcome", "failure").increment();
            log.warn("Payment {} failed for reference {}", payment.getId(), payment.getExternalReference());
        }
        deliveryRepository.save(outboxRow(payment));
    }

    /**
     * Outbox row carrying the outcome webhook of a settled payment.
     */
    WebhookDelivery outboxRow(PaymentTransaction payment) {
        String paymentId = payment.getId().toString();
        Instant settledAt = payment.getProcessedAt() == null ? Instant.now() : payment.getProcessedAt();
        PaymentOutcome outcome = payment.getStatus() == PaymentStatus.SUCCESS
                ? new PaymentOutcome.Success(paymentId, payment.getAmount(), payment.getCurrency(), settledAt)
                : new PaymentOutcome.Failure(paymentId, payment.getAmount(), payment.getCurrency(), settledAt,
                        payment.getFailureReason());
        PaymentWebhookEvent event = PaymentWebhookEvent.from(outcome, payment.getExternalReference(),
                payment.getMetadata().isEmpty() ? null : payment.getMetadata());
        try {
            String payload = EventObjectMapper.instance().writeValueAsString(event);
            return new WebhookDelivery(payment.getId(), WebhookHeaders.webhookIdempotencyKey(paymentId), payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize webhook for payment " + paymentId, e);
        }
    }
}
