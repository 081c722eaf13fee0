package com.billing.subscription.service;

import com.billing.subscription.entity.PaymentRecordStatus;
import com.billing.subscription.repository.PaymentRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

@Component
public class PaymentInitiationRetryJob {

    private static final Logger log = LoggerFactory.getLogger(PaymentInitiationRetryJob.class);

    private final PaymentRecordRepository paymentRecordRepository;
    private final PaymentInitiationTask initiationTask;
    private final Duration minAge;
    private final Duration maxAge;
    private final int batchSize;

    public PaymentInitiationRetryJob(PaymentRecordRepository paymentRecordRepository,
                                     PaymentInitiationTask initiationTask,
                                     @Value("${payment-initiation.retry.min-age:PT30S}") Duration minAge,
                                     @Value("${payment-initiation.retry.max-age:PT24H}") Duration maxAge,
                                     @Value("${payment-initiation.retry.batch-size:50}") int batchSize) {
        this.paymentRecordRepository = paymentRecordRepository;
        this.initiationTask = initiationTask;
        this.minAge = minAge;
        this.maxAge = maxAge;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${payment-initiation.retry.interval-ms:30000}",
            initialDelayString = "${payment-initiation.retry.initial-delay-ms:30000}")
    public void retryUnacknowledged() {
        Instant now = Instant.now();
        List<UUID> recordIds = paymentRecordRepository.findUnacknowledged(PaymentRecordStatus.PENDING,
                now.minus(maxAge), now.minus(minAge), PageRequest.of(0, batchSize));
        if (recordIds.isEmpty()) {
            return;
        }
        log.info("Retrying payment initiation for {} unacknowledged records", recordIds.size());
        CompletableFuture<?>[] runs = recordIds.stream()
                .map(initiationTask::submit)
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(runs).join();
    }
}
