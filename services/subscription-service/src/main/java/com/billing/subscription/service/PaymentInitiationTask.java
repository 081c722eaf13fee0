package com.billing.subscription.service;

import com.billing.common.tx.TransactionExecutor;
import com.billing.subscription.client.InitiatePaymentRequest;
import com.billing.subscription.client.PaymentClient;
import com.billing.subscription.client.PaymentResponse;
import com.billing.subscription.entity.PaymentRecord;
import com.billing.subscription.entity.Subscription;
import com.billing.subscription.repository.PaymentRecordRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Calls the payment service for a pending payment record off the request thread. Every run ends in
 * an {@link InitiationResult}; a failed run leaves the record unacknowledged for
 * {@link PaymentInitiationRetryJob} to pick up again.
 */
@Component
public class PaymentInitiationTask {

    private static final Logger log = LoggerFactory.getLogger(PaymentInitiationTask.class);

    private final PaymentRecordRepository paymentRecordRepository;
    private final PaymentClient paymentClient;
    private final TransactionExecutor transactionExecutor;
    private final Executor executor;
    private final MeterRegistry meterRegistry;

    public PaymentInitiationTask(PaymentRecordRepository paymentRecordRepository,
                                 PaymentClient paymentClient,
                                 TransactionExecutor transactionExecutor,
                                 @Qualifier("paymentInitiationExecutor") Executor executor,
                                 MeterRegistry meterRegistry) {
        this.paymentRecordRepository = paymentRecordRepository;
        this.paymentClient = paymentClient;
        this.transactionExecutor = transactionExecutor;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPaymentRequested(PaymentInitiationRequested event) {
        submit(event.paymentRecordId());
    }

    public CompletableFuture<InitiationResult> submit(UUID paymentRecordId) {
        CompletableFuture<InitiationResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> initiate(paymentRecordId), executor);
        } catch (RejectedExecutionException e) {
            future = CompletableFuture.completedFuture(
                    new InitiationResult.Failed(paymentRecordId, "initiation queue is full"));
        }
        return future.whenComplete(this::report);
    }

    /**
     * Idempotency key for the payment-service call. Stable per record so retries never create a second payment.
     */
    static String idempotencyKey(UUID paymentRecordId) {
        return "payment-" + paymentRecordId;
    }

    InitiationResult initiate(UUID paymentRecordId) {
        try {
            Prepared prepared = transactionExecutor.run(() -> prepare(paymentRecordId));
            if (prepared.done() != null) {
                return prepared.done();
            }

            PaymentResponse payment = paymentClient.initiatePayment(prepared.request(), idempotencyKey(paymentRecordId));
            String paymentId = payment.id().toString();
            transactionExecutor.run(() -> paymentRecordRepository.assignCorrelationIfUnclaimed(paymentRecordId, paymentId));
            return new InitiationResult.Initiated(paymentRecordId, paymentId);
        } catch (RuntimeException e) {
            return new InitiationResult.Failed(paymentRecordId, e.getMessage());
        }
    }

    private Prepared prepare(UUID paymentRecordId) {
        PaymentRecord record = paymentRecordRepository.findById(paymentRecordId).orElse(null);
        if (record == null) {
            return Prepared.finished(new InitiationResult.Failed(paymentRecordId, "payment record not found"));
        }
        if (record.getPaymentCorrelationId() != null) {
            return Prepared.finished(new InitiationResult.Initiated(paymentRecordId, record.getPaymentCorrelationId()));
        }
        if (record.isSettled()) {
            return Prepared.finished(new InitiationResult.Failed(paymentRecordId, "payment record already settled"));
        }

        Subscription subscription = record.getSubscription();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("userId", subscription.getUserId().toString());
        metadata.put("planId", subscription.getPlan().getId().toString());
        metadata.put("planName", subscription.getPlan().getName());
        metadata.put("paymentRecordId", paymentRecordId.toString());

        return Prepared.call(new InitiatePaymentRequest(subscription.getId().toString(), record.getAmount(),
                record.getCurrency(), metadata));
    }

    private void report(InitiationResult result, Throwable error) {
        if (error != null) {
            meterRegistry.counter("payment_initiations_total", "result", "error").increment();
            log.error("Payment initiation crashed", error);
            return;
        }
        if (result instanceof InitiationResult.Initiated initiated) {
            meterRegistry.counter("payment_initiations_total", "result", "initiated").increment();
            log.info("Payment record {} acknowledged as payment {}", initiated.paymentRecordId(), initiated.paymentId());
        } else if (result instanceof InitiationResult.Failed failed) {
            meterRegistry.counter("payment_initiations_total", "result", "failed").increment();
            log.warn("Payment initiation for record {} failed, will retry: {}", failed.paymentRecordId(), failed.reason());
        }
    }

    private record Prepared(InitiatePaymentRequest request, InitiationResult done) {
        static Prepared call(InitiatePaymentRequest request) {
            return new Prepared(request, null);
        }

        static Prepared finished(InitiationResult result) {
            return new Prepared(null, result);
        }
    }
}
