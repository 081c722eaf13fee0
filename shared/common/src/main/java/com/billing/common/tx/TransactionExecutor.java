package com.billing.common.tx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of work in its own transaction and retries it when the data store reports a
 * transient failure (serialization failure, deadlock, lock timeout, optimistic-lock conflict).
 * Backoff between attempts is {@code 2^attempt * baseDelay}. Isolation is chosen by the caller.
 */
@Component
public class TransactionExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransactionExecutor.class);

    public static final int DEFAULT_MAX_RETRIES = 3;

    private final PlatformTransactionManager transactionManager;
    private final long baseDelayMs;

    @Autowired
    public TransactionExecutor(PlatformTransactionManager transactionManager,
                               @Value("${transaction.retry.base-delay-ms:100}") long baseDelayMs) {
        this.transactionManager = transactionManager;
        this.baseDelayMs = baseDelayMs;
    }

    public <T> T run(Supplier<T> unit) {
        return run(unit, Isolation.DEFAULT, DEFAULT_MAX_RETRIES);
    }

    public <T> T run(Supplier<T> unit, int maxRetries) {
        return run(unit, Isolation.DEFAULT, maxRetries);
    }

    public <T> T run(Supplier<T> unit, Isolation isolation, int maxRetries) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(isolation.value());
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        TransientDataAccessException lastError = null;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                return template.execute(status -> unit.get());
            } catch (TransientDataAccessException e) {
                lastError = e;
                log.warn("Transaction attempt {}/{} failed: {}", attempt, maxRetries, e.getMessage());
                if (attempt < maxRetries) {
                    sleep(backoffMs(attempt));
                }
            }
        }
        log.error("Transaction failed after {} attempts", maxRetries);
        throw lastError;
    }

    long backoffMs(int attempt) {
        return (1L << attempt) * baseDelayMs;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while backing off a transaction retry", e);
        }
    }
}
