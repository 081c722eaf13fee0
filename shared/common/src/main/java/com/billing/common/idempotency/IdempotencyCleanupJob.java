package com.billing.common.idempotency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class IdempotencyCleanupJob {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyCleanupJob.class);

    private final IdempotencyStore store;

    public IdempotencyCleanupJob(IdempotencyStore store) {
        this.store = store;
    }

    @Scheduled(fixedDelayString = "${idempotency.cleanup.interval-ms:3600000}",
            initialDelayString = "${idempotency.cleanup.initial-delay-ms:60000}")
    public void purgeExpiredKeys() {
        int deleted = store.purgeExpired(Instant.now());
        if (deleted > 0) {
            log.info("Cleaned up {} expired idempotency keys", deleted);
        }
    }
}
