package com.billing.payment.dispatch;

import com.billing.common.tx.TransactionExecutor;
import com.billing.payment.entity.WebhookDelivery;
import com.billing.payment.entity.WebhookDeliveryStatus;
import com.billing.payment.repository.WebhookDeliveryRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drains the webhook outbox. A row is sent in rounds; each round is one {@link WebhookDispatcher#deliver}
 * call with its own short in-process retries. When a round is exhausted the row waits for the next
 * step of the schedule, and past the last step it is marked FAILED.
 *
 * <p>Rows are claimed with a lease (their next attempt is pushed out) in a short transaction, so the
 * HTTP calls run without holding row locks and other instances skip rows already in flight.
 */
@Component
public class WebhookOutboxRelay {

    private static final Logger log = LoggerFactory.getLogger(WebhookOutboxRelay.class);

    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookDispatcher dispatcher;
    private final TransactionExecutor transactionExecutor;
    private final MeterRegistry meterRegistry;
    private final List<Duration> schedule;
    private final int attemptsPerRound;
    private final int batchSize;
    private final Duration lease;

    public WebhookOutboxRelay(WebhookDeliveryRepository deliveryRepository,
                              WebhookDispatcher dispatcher,
                              TransactionExecutor transactionExecutor,
                              MeterRegistry meterRegistry,
                              @Value("${webhook.relay.schedule:PT0S,PT30S,PT2M,PT10M,PT30M,PT1H}") List<Duration> schedule,
                              @Value("${webhook.relay.attempts-per-round:3}") int attemptsPerRound,
                              @Value("${webhook.relay.batch-size:20}") int batchSize,
                              @Value("${webhook.relay.lease:PT5M}") Duration lease) {
        if (schedule.isEmpty()) {
            throw new IllegalArgumentException("webhook.relay.schedule needs at least one step");
        }
        this.deliveryRepository = deliveryRepository;
        this.dispatcher = dispatcher;
        this.transactionExecutor = transactionExecutor;
        this.meterRegistry = meterRegistry;
        this.schedule = List.copyOf(schedule);
        this.attemptsPerRound = attemptsPerRound;
        this.batchSize = batchSize;
        this.lease = lease;
    }

    @Scheduled(fixedDelayString = "${webhook.relay.interval-ms:1000}",
            initialDelayString = "${webhook.relay.initial-delay-ms:1000}")
    public void run() {
        relayDue();
    }

    /**
     * Sends every row that is due now. Returns how many rows were attempted.
     */
    public int relayDue() {
        Instant now = Instant.now();
        List<Claimed> claimed = transactionExecutor.run(() -> claim(now));
        for (Claimed row : claimed) {
            DeliveryResult result = dispatcher.deliver(row.payload(), row.idempotencyKey(), attemptsPerRound);
            transactionExecutor.run(() -> record(row, result));
        }
        return claimed.size();
    }

    private List<Claimed> claim(Instant now) {
        List<Claimed> claimed = new ArrayList<>();
        for (WebhookDelivery delivery : deliveryRepository.lockDue(now, batchSize)) {
            delivery.beginRound(now.plus(lease));
            claimed.add(new Claimed(delivery.getId(), delivery.getPaymentId(), delivery.getIdempotencyKey(),
                    delivery.getPayload(), delivery.getAttempts()));
        }
        return claimed;
    }

    private Void record(Claimed row, DeliveryResult result) {
        WebhookDelivery delivery = deliveryRepository.findById(row.id()).orElse(null);
        if (delivery == null || delivery.getStatus() != WebhookDeliveryStatus.PENDING
                || delivery.getAttempts() != row.round()) {
            // requeued or finished elsewhere while this round was in flight
            log.info("Webhook delivery {} changed during round {}, leaving it as is", row.id(), row.round());
            return null;
        }

        if (result instanceof DeliveryResult.Delivered delivered) {
            delivery.markDelivered(delivered.statusCode());
        } else if (result instanceof DeliveryResult.Rejected rejected) {
            delivery.markRejected(rejected.statusCode(), rejected.reason());
            log.error("Webhook for payment {} rejected by receiver ({}), giving up", row.paymentId(),
                    rejected.statusCode());
        } else if (result instanceof DeliveryResult.Exhausted exhausted) {
            Duration wait = delayAfterRound(row.round());
            if (wait == null) {
                delivery.markFailed(exhausted.lastStatusCode(), exhausted.lastError());
                meterRegistry.counter("webhook_deliveries_failed_total").increment();
                log.error("Webhook for payment {} FAILED after {} rounds, last error: {}", row.paymentId(),
                        row.round(), exhausted.lastError());
            } else {
                delivery.retryAt(Instant.now().plus(wait), exhausted.lastStatusCode(), exhausted.lastError());
                log.warn("Webhook for payment {} round {} exhausted, next round in {}", row.paymentId(),
                        row.round(), wait);
            }
        }
        return null;
    }

    /**
     * Wait before the round after {@code round}, or null once the schedule is used up.
     */
    Duration delayAfterRound(int round) {
        return round < schedule.size() ? schedule.get(round) : null;
    }

    private record Claimed(UUID id, UUID paymentId, String idempotencyKey, String payload, int round) {}
}
