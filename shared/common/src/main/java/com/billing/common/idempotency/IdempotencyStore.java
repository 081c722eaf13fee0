package com.billing.common.idempotency;

import com.billing.common.error.ApiException;
import com.billing.common.error.ErrorCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Durable record of mutating requests, keyed by the client-supplied idempotency key.
 * Each call runs in its own short transaction so a claim is visible to concurrent requests
 * before the guarded operation starts.
 */
@Component
public class IdempotencyStore {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyStore.class);

    private final IdempotencyRecordRepository repository;
    private final Duration ttl;
    private final Duration inFlightTtl;

    public IdempotencyStore(IdempotencyRecordRepository repository,
                            @Value("${idempotency.ttl:PT24H}") Duration ttl,
                            @Value("${idempotency.in-flight-ttl:PT5M}") Duration inFlightTtl) {
        this.repository = repository;
        this.ttl = ttl;
        this.inFlightTtl = inFlightTtl;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IdempotencyDecision check(String key, String method, String path, String requestHash) {
        Instant now = Instant.now();
        if (tryClaim(key, method, path, requestHash, now)) {
            return IdempotencyDecision.proceed();
        }

        IdempotencyRecord existing = repository.findById(key).orElse(null);
        if (existing == null || existing.isExpired(now)) {
            if (existing != null) {
                repository.deleteIfExpired(key, now);
                log.debug("Idempotency key {} expired, treating as new", key);
            }
            if (tryClaim(key, method, path, requestHash, now)) {
                return IdempotencyDecision.proceed();
            }
            throw inProgress(key);
        }

        if (!existing.matches(method, path, requestHash)) {
            throw ApiException.conflict(ErrorCodes.IDEMPOTENCY_KEY_REUSED,
                    "Idempotency key was already used for a different request: "
                            + existing.getRequestMethod() + " " + existing.getRequestPath(),
                    Map.of("originalMethod", existing.getRequestMethod(),
                            "originalPath", existing.getRequestPath()));
        }
        if (!existing.isCompleted()) {
            throw inProgress(key);
        }
        return new IdempotencyDecision.Replay(existing.getResponseStatus(), existing.getResponseBody());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void commit(String key, int status, String body) {
        int updated = repository.complete(key, status, body, Instant.now().plus(ttl));
        if (updated == 0) {
            log.warn("Idempotency key {} was no longer claimed when completing", key);
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void release(String key) {
        repository.releaseClaim(key);
    }

    @Transactional
    public int purgeExpired(Instant cutoff) {
        return repository.deleteExpiredBefore(cutoff);
    }

    private boolean tryClaim(String key, String method, String path, String hash, Instant now) {
        return repository.claim(key, method, path, hash, now, now.plus(inFlightTtl)) == 1;
    }

    private static ApiException inProgress(String key) {
        return ApiException.conflict(ErrorCodes.IDEMPOTENCY_REQUEST_IN_PROGRESS,
                "A request with this idempotency key is still being processed",
                Map.of("idempotencyKey", key));
    }
}
